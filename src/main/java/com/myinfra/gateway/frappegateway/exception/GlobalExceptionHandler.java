package com.myinfra.gateway.frappegateway.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Global Exception Handler for the gateway.
 * Intercepts all unhandled exceptions in the reactive chain and ensures
 * the client always receives a standardized JSON response (ErrorResponse).
 */
@Slf4j
@Component
@Order(-2) // High priority: Runs before Spring Boot's DefaultErrorWebExceptionHandler (Order -1)
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    private final ObjectMapper objectMapper;

    /**
     * Entry point called by the WebFlux dispatcher for every unhandled exception.
     *
     * @param exchange Current server exchange (request/response context)
     * @param ex       The unhandled exception
     * @return {@code Mono<Void>} completing when the error response has been written
     */
    @Override
    @NonNull
    public Mono<Void> handle(@NonNull ServerWebExchange exchange, @NonNull Throwable ex) {

        ServerHttpResponse response = exchange.getResponse();

        if (response.isCommitted()) {
            log.warn("Response already committed, cannot write error for path={} error={}",
                    exchange.getRequest().getURI().getPath(), ex.getMessage());
            return Objects.requireNonNull(Mono.<Void>error(ex));
        }

        Throwable cause = unwrapCause(ex);
        Outcome outcome = classify(cause);
        HttpStatus status = outcome.status();

        String path = exchange.getRequest().getURI().getPath();

        if (status.is5xxServerError()) {
            log.error("Gateway error - status={} path={} error={}",
                    status.value(), path, cause.getMessage(), cause);
        } else {
            log.warn("Gateway error - status={} path={} error={}",
                    status.value(), path, cause.getMessage());
        }

        ErrorResponse errorResponse = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(outcome.message())
                .path(path)
                .target(outcome.target())
                .upstreamStatus(outcome.upstreamStatus())
                .build();

        return Objects.requireNonNull(writeErrorResponse(response, status, errorResponse));
    }

    /**
     * Maps a failure onto the status and message the client sees.
     */
    Outcome classify(Throwable cause) {
        if (cause instanceof ResponseStatusException rse) {
            HttpStatus status = HttpStatus.valueOf(rse.getStatusCode().value());
            String reason = rse.getReason();
            return new Outcome(status, (reason != null && !reason.isBlank()) ? reason : status.getReasonPhrase());
        }
        if (cause instanceof AuthenticationException) {
            return new Outcome(HttpStatus.UNAUTHORIZED, cause.getMessage());
        }
        if (cause instanceof ConfigurationException) {
            return new Outcome(HttpStatus.FORBIDDEN, cause.getMessage());
        }
        if (cause instanceof UpstreamException upstream) {
            HttpStatus status = upstream.isRetryable()
                    ? HttpStatus.BAD_GATEWAY
                    : Objects.requireNonNullElse(HttpStatus.resolve(upstream.getStatusCode()), HttpStatus.BAD_REQUEST);
            return new Outcome(status, upstream.getUpstreamMessage(), upstream.getTarget(), upstream.getStatusCode());
        }
        if (cause instanceof RetryExhaustedException exhausted) {
            Integer upstreamStatus = exhausted.getCause() instanceof UpstreamException upstream
                    ? upstream.getStatusCode()
                    : null;
            return new Outcome(HttpStatus.BAD_GATEWAY, exhausted.getMessage(), null, upstreamStatus);
        }
        if (cause instanceof NetworkException || cause instanceof ConnectException) {
            return new Outcome(HttpStatus.BAD_GATEWAY, "Could not connect to the upstream service.");
        }
        if (cause instanceof DeadlineExceededException || cause instanceof TimeoutException) {
            return new Outcome(HttpStatus.GATEWAY_TIMEOUT, "The upstream service did not respond in time. Please retry.");
        }
        if (cause instanceof CallNotPermittedException) {
            return new Outcome(HttpStatus.SERVICE_UNAVAILABLE,
                    "Service is temporarily unavailable. Circuit breaker is open.");
        }
        return new Outcome(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");
    }

    /**
     * Serializes the {@link ErrorResponse} to JSON bytes and writes them into
     * the reactive response with the correct {@code Content-Type} header.
     *
     * @param response      The server HTTP response
     * @param status        HTTP status to set on the response
     * @param errorResponse The payload to serialize
     * @return {@code Mono<Void>} completing when the write is done
     */
    @NonNull
    private Mono<Void> writeErrorResponse(ServerHttpResponse response,
                                          HttpStatus status,
                                          ErrorResponse errorResponse) {

        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(errorResponse);
        } catch (JsonProcessingException jsonEx) {
            log.error("Failed to serialize ErrorResponse to JSON", jsonEx);

            String fallbackTime = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss"));
            String fallbackJson = String.format(
                    "{\"timestamp\":\"%s\",\"status\":500,\"error\":\"Internal Server Error\",\"message\":\"Error serialization failed.\",\"path\":\"%s\"}",
                    fallbackTime, errorResponse.getPath()
            );
            bytes = fallbackJson.getBytes(StandardCharsets.UTF_8);
        }

        DataBuffer buffer = response.bufferFactory().wrap(Objects.requireNonNull(bytes));

        return response.writeWith(Objects.requireNonNull(Mono.just(buffer)));
    }

    /**
     * Walks the cause chain to the first exception this handler knows how to classify,
     * or to the deepest cause when there is none. Gateway exceptions wrap their causes on
     * purpose (an exhausted retry wraps the last upstream error), so they are not unwrapped.
     *
     * @param t The top-level throwable
     * @return The exception to classify
     */
    private Throwable unwrapCause(Throwable t) {
        Throwable curr = t;
        Throwable deepest = t;

        int depth = 0;
        while (curr != null && depth++ < 10) {
            if (curr instanceof GatewayException
                    || curr instanceof ResponseStatusException
                    || curr instanceof CallNotPermittedException) {
                return curr;
            }
            deepest = curr;
            curr = curr.getCause();
        }

        return deepest;
    }

    record Outcome(HttpStatus status, String message, String target, Integer upstreamStatus) {

        Outcome(HttpStatus status, String message) {
            this(status, message, null, null);
        }
    }
}
