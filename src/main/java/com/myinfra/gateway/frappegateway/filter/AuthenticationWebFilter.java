package com.myinfra.gateway.frappegateway.filter;

import com.myinfra.gateway.frappegateway.config.AppConfig;
import com.myinfra.gateway.frappegateway.exception.AuthenticationException;
import com.myinfra.gateway.frappegateway.model.Identity;
import com.myinfra.gateway.frappegateway.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.reactive.CorsUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Authenticates every API request and attaches the caller's identity to the exchange.
 * <p>
 * In optional mode a failed authentication lets the request through without an identity,
 * so upstream calls fall back to the service key. In required mode it ends the request
 * with 401.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthenticationWebFilter implements WebFilter, Ordered {

    static final String API_PATH_PREFIX = "/api/";

    private final AuthService authService;
    private final AppConfig appConfig;

    /**
     * @param exchange The current server exchange (request + response context)
     * @param chain    The web filter chain
     * @return Mono<Void> indicating request completion
     */
    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().value();

        if (!appConfig.getAuth().isEnabled()
                || !path.startsWith(API_PATH_PREFIX)
                || CorsUtils.isPreFlightRequest(request)) {
            return chain.filter(exchange);
        }

        boolean requireAuth = appConfig.getAuth().isRequireAuth();

        return authService.authenticate(request)
                .map(identity -> Optional.of(bindCsrfToken(identity, request)))
                .onErrorResume(AuthenticationException.class, e -> {
                    if (requireAuth) {
                        log.warn("401 - Authentication failed for path: {} reason: {}", path, e.getMessage());
                        return Mono.error(new AuthenticationException("Valid authentication required", e));
                    }
                    log.debug("Proceeding without identity for path: {} reason: {}", path, e.getMessage());
                    return Mono.just(Optional.empty());
                })
                .flatMap(identity -> {
                    identity.ifPresent(resolved -> IdentityCarrier.attach(exchange, resolved));
                    return chain.filter(exchange);
                });
    }

    /**
     * The CSRF token belongs to this call only, so it is bound to a per-call copy of the
     * (possibly cached) identity.
     */
    private Identity bindCsrfToken(Identity identity, ServerHttpRequest request) {
        String csrfToken = request.getHeaders().getFirst(appConfig.getAuth().getCsrfHeader());
        return identity.withCsrfToken(csrfToken);
    }

    /**
     * Runs early; CORS preflight requests pass through untouched.
     *
     * @return filter order priority
     */
    @Override
    public int getOrder() {
        return -1;
    }
}
