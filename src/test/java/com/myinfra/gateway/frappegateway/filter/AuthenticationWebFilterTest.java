package com.myinfra.gateway.frappegateway.filter;

import com.myinfra.gateway.frappegateway.config.AppConfig;
import com.myinfra.gateway.frappegateway.exception.AuthenticationException;
import com.myinfra.gateway.frappegateway.exception.ValidationException;
import com.myinfra.gateway.frappegateway.model.Identity;
import com.myinfra.gateway.frappegateway.service.AuthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthenticationWebFilterTest {

    private final AtomicBoolean chainCalled = new AtomicBoolean();
    private final WebFilterChain chain = exchange -> {
        chainCalled.set(true);
        return Mono.empty();
    };

    private AuthService authService;
    private AppConfig appConfig;
    private AuthenticationWebFilter filter;

    @BeforeEach
    void setUp() {
        authService = mock(AuthService.class);
        appConfig = new AppConfig();
        filter = new AuthenticationWebFilter(authService, appConfig);
    }

    @Test
    void attachesResolvedIdentity() {
        Identity identity = Identity.fromBearer("u1", "u1@example.com", null, "web", null, "tok");
        when(authService.authenticate(any())).thenReturn(Mono.just(identity));
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/api/v1/resource/Project"));

        filter.filter(exchange, chain).block();

        assertThat(chainCalled).isTrue();
        assertThat(IdentityCarrier.current(exchange)).contains(identity);
    }

    @Test
    void bindsCsrfTokenToSessionIdentity() {
        when(authService.authenticate(any()))
                .thenReturn(Mono.just(Identity.fromSession("jane@example.com", "sess-1")));
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.post("/api/v1/resource/Project")
                .header("X-Frappe-CSRF-Token", "csrf-1"));

        filter.filter(exchange, chain).block();

        assertThat(IdentityCarrier.current(exchange))
                .hasValueSatisfying(identity -> assertThat(identity.csrfToken()).isEqualTo("csrf-1"));
    }

    @Test
    void optionalModeContinuesWithoutIdentity() {
        when(authService.authenticate(any())).thenReturn(Mono.error(new ValidationException("invalid token: status 401")));
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/api/v1/resource/Project")
                .header(HttpHeaders.AUTHORIZATION, "Bearer bad"));

        filter.filter(exchange, chain).block();

        assertThat(chainCalled).isTrue();
        assertThat(IdentityCarrier.current(exchange)).isEmpty();
    }

    @Test
    void requiredModeRejectsUnauthenticatedRequest() {
        appConfig.getAuth().setRequireAuth(true);
        when(authService.authenticate(any())).thenReturn(Mono.error(new AuthenticationException("missing")));
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/api/v1/resource/Project"));

        assertThatThrownBy(() -> filter.filter(exchange, chain).block())
                .isInstanceOf(AuthenticationException.class)
                .hasMessage("Valid authentication required");
        assertThat(chainCalled).isFalse();
    }

    @Test
    void unexpectedFailuresPropagate() {
        when(authService.authenticate(any())).thenReturn(Mono.error(new IllegalStateException("boom")));
        MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/api/v1/resource/Project"));

        assertThatThrownBy(() -> filter.filter(exchange, chain).block())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void skipsNonApiPathsPreflightAndDisabledAuth() {
        filter.filter(exchange(MockServerHttpRequest.get("/actuator/health")), chain).block();
        filter.filter(exchange(MockServerHttpRequest.options("/api/v1/resource/Project")
                .header(HttpHeaders.ORIGIN, "http://ui.test")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, HttpMethod.POST.name())), chain).block();
        appConfig.getAuth().setEnabled(false);
        filter.filter(exchange(MockServerHttpRequest.get("/api/v1/resource/Project")), chain).block();

        verify(authService, never()).authenticate(any());
        assertThat(chainCalled).isTrue();
    }

    private static MockServerWebExchange exchange(MockServerHttpRequest.BaseBuilder<?> request) {
        return MockServerWebExchange.from(request);
    }
}
