package com.myinfra.gateway.frappegateway.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(objectMapper);

    @Test
    void authenticationFailureIsUnauthorized() throws Exception {
        JsonNode body = handle(new AuthenticationException("Valid authentication required"), HttpStatus.UNAUTHORIZED);

        assertThat(body.get("error").asText()).isEqualTo("Unauthorized");
        assertThat(body.get("message").asText()).isEqualTo("Valid authentication required");
        assertThat(body.get("path").asText()).isEqualTo("/api/v1/resource/Project/P1");
        assertThat(body.has("target")).isFalse();
    }

    @Test
    void missingCsrfIsForbidden() throws Exception {
        handle(new ConfigurationException("CSRF token is required"), HttpStatus.FORBIDDEN);
    }

    @Test
    void upstreamClientErrorKeepsItsStatus() throws Exception {
        UpstreamException notFound = new UpstreamException("get document Project/P1", 404, "Project P1 not found", null, null);

        JsonNode body = handle(notFound, HttpStatus.NOT_FOUND);

        assertThat(body.get("message").asText()).isEqualTo("Project P1 not found");
        assertThat(body.get("target").asText()).isEqualTo("get document Project/P1");
        assertThat(body.get("upstreamStatus").asInt()).isEqualTo(404);
    }

    @Test
    void upstreamServerErrorIsBadGateway() throws Exception {
        handle(new UpstreamException("t", 500, "boom", null, null), HttpStatus.BAD_GATEWAY);
    }

    @Test
    void exhaustedRetriesAreBadGateway() throws Exception {
        UpstreamException last = new UpstreamException("list documents Project", 503, "down", null, null);

        JsonNode body = handle(new RetryExhaustedException("list documents Project", 3, last), HttpStatus.BAD_GATEWAY);

        assertThat(body.get("message").asText()).contains("after 3 attempts");
        assertThat(body.get("upstreamStatus").asInt()).isEqualTo(503);
    }

    @Test
    void networkFailureIsBadGateway() throws Exception {
        handle(new NetworkException("refused", new IOException("refused")), HttpStatus.BAD_GATEWAY);
    }

    @Test
    void deadlineIsGatewayTimeout() throws Exception {
        handle(new DeadlineExceededException("get document Project/P1", Duration.ofSeconds(1), new TimeoutException()),
                HttpStatus.GATEWAY_TIMEOUT);
    }

    @Test
    void openCircuitIsServiceUnavailable() throws Exception {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("test");
        breaker.transitionToOpenState();

        handle(CallNotPermittedException.createCallNotPermittedException(breaker), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void wrappedGatewayExceptionIsStillClassified() throws Exception {
        handle(new IllegalStateException("wrapper", new AuthenticationException("missing")), HttpStatus.UNAUTHORIZED);
    }

    @Test
    void responseStatusExceptionKeepsItsStatusAndReason() throws Exception {
        JsonNode body = handle(new ResponseStatusException(HttpStatus.BAD_REQUEST, "filters must be valid JSON"),
                HttpStatus.BAD_REQUEST);

        assertThat(body.get("message").asText()).isEqualTo("filters must be valid JSON");
    }

    @Test
    void anythingElseIsInternalServerError() throws Exception {
        JsonNode body = handle(new IllegalStateException("bug"), HttpStatus.INTERNAL_SERVER_ERROR);

        assertThat(body.get("message").asText()).isEqualTo("An unexpected error occurred.");
    }

    private JsonNode handle(Throwable error, HttpStatus expected) throws Exception {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/api/v1/resource/Project/P1"));

        handler.handle(exchange, error).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(expected);
        assertThat(exchange.getResponse().getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        JsonNode body = objectMapper.readTree(exchange.getResponse().getBodyAsString().block());
        assertThat(body.get("status").asInt()).isEqualTo(expected.value());
        return body;
    }
}
