package com.myinfra.gateway.frappegateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.frappegateway.exception.GatewayException;
import com.myinfra.gateway.frappegateway.exception.NetworkException;
import com.myinfra.gateway.frappegateway.exception.RetryExhaustedException;
import com.myinfra.gateway.frappegateway.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes one upstream call with bounded retry.
 * <p>
 * Transport failures and 5xx answers are retried with the policy's backoff; 4xx answers
 * fail at once. When every attempt fails the caller gets a {@link RetryExhaustedException}
 * wrapping the last failure. All waits are {@link Mono#delay} timers, so cancelling the
 * subscription stops both the backoff and the in-flight exchange.
 */
@Slf4j
public class RetryingDispatcher {

    private static final int MAX_MESSAGE_LENGTH = 500;

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RetryingDispatcher(WebClient webClient, RetryPolicy retryPolicy, ObjectMapper objectMapper) {
        this(webClient, retryPolicy, objectMapper, Clock.systemUTC());
    }

    RetryingDispatcher(WebClient webClient, RetryPolicy retryPolicy, ObjectMapper objectMapper, Clock clock) {
        this.webClient = Objects.requireNonNull(webClient, "WebClient must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "RetryPolicy must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        this.clock = clock;
    }

    /**
     * Dispatches the request, retrying retryable failures.
     *
     * @param request    The call to make
     * @param credential Credential to present on every attempt
     * @return Mono emitting the successful response body ("" when empty)
     */
    public Mono<String> dispatch(UpstreamRequest request, UpstreamCredential credential) {
        int maxAttempts = retryPolicy.attemptsFor(request.operation());

        return Mono.defer(() -> exchange(request, credential))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    Throwable failure = signal.failure();
                    int nextAttempt = (int) signal.totalRetries() + 1;

                    if (!isRetryable(failure)) {
                        return Mono.error(failure);
                    }
                    if (nextAttempt >= maxAttempts) {
                        log.error("{} failed after {} attempts: {}", request.target(), nextAttempt, failure.getMessage());
                        return Mono.error(new RetryExhaustedException(request.target(), nextAttempt, failure));
                    }

                    Duration delay = retryPolicy.delayFor(nextAttempt, retryAfterOf(failure));
                    log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                            request.target(), nextAttempt, maxAttempts, delay.toMillis(), failure.getMessage());
                    return Mono.delay(delay);
                })));
    }

    private Mono<String> exchange(UpstreamRequest request, UpstreamCredential credential) {
        log.debug("Making API request method={} url={} auth={}", request.method(), request.uri(), credential.describe());

        WebClient.RequestBodySpec spec = webClient
                .method(request.method())
                .uri(request.uri())
                .headers(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                    credential.applyTo(headers);
                });

        WebClient.RequestHeadersSpec<?> ready = request.body() != null ? spec.bodyValue(request.body()) : spec;

        return ready
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> toResult(request, response, body)))
                .onErrorMap(e -> e instanceof WebClientRequestException || e instanceof IOException,
                        e -> new NetworkException(request.target() + ": request failed: " + e.getMessage(), e));
    }

    private Mono<String> toResult(UpstreamRequest request, ClientResponse response, String body) {
        int status = response.statusCode().value();
        log.debug("Received API response status={} bodySize={}", status, body.length());

        if (status < 400) {
            return Mono.just(body);
        }

        Duration retryAfter = parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        UpstreamException error = toUpstreamException(request.target(), status, body, retryAfter);
        if (!error.isRetryable()) {
            log.warn("{} rejected with status {}: {}", request.target(), status, error.getUpstreamMessage());
        }
        return Mono.error(error);
    }

    /**
     * Builds the error from a Frappe error body, falling back to the raw body text or
     * the reason phrase when the body has no recognisable message.
     */
    UpstreamException toUpstreamException(String target, int status, String body, Duration retryAfter) {
        String message = null;
        String exc = null;

        try {
            JsonNode root = body.isBlank() ? null : objectMapper.readTree(body);
            if (root != null && root.isObject()) {
                message = firstText(root, "message", "exception", "exc_type");
                if (message == null) {
                    message = serverMessage(root.path("_server_messages"));
                }
                exc = root.hasNonNull("exc") ? root.get("exc").asText() : null;
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body from {} is not JSON", target);
        }

        if (message == null || message.isBlank()) {
            message = body.isBlank() ? reasonPhrase(status) : truncate(body);
        }
        return new UpstreamException(target, status, message, exc, retryAfter);
    }

    private String serverMessage(JsonNode serverMessages) throws JsonProcessingException {
        if (!serverMessages.isTextual()) {
            return null;
        }
        JsonNode messages = objectMapper.readTree(serverMessages.asText());
        if (!messages.isArray() || messages.isEmpty()) {
            return null;
        }
        JsonNode first = messages.get(0);
        if (first.isTextual()) {
            try {
                JsonNode inner = objectMapper.readTree(first.asText());
                return inner.isObject() ? firstText(inner, "message") : first.asText();
            } catch (JsonProcessingException e) {
                // plain text entry
                return first.asText();
            }
        }
        return first.isObject() ? firstText(first, "message") : null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * Reads a {@code Retry-After} header given as delta-seconds or as an HTTP date.
     *
     * @return The requested wait, or null when absent or unreadable
     */
    Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration wait = Duration.between(clock.instant(), at.toInstant());
                return wait.isNegative() ? Duration.ZERO : wait;
            } catch (DateTimeParseException notDate) {
                log.debug("Ignoring unreadable Retry-After header: {}", trimmed);
                return null;
            }
        }
    }

    private static Optional<Duration> retryAfterOf(Throwable failure) {
        if (failure instanceof UpstreamException upstream) {
            return upstream.retryAfter();
        }
        return Optional.empty();
    }

    private static boolean isRetryable(Throwable failure) {
        return failure instanceof GatewayException gatewayException && gatewayException.isRetryable();
    }

    private static String reasonPhrase(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved.getReasonPhrase() : "HTTP " + status;
    }

    private static String truncate(String body) {
        return body.length() > MAX_MESSAGE_LENGTH ? body.substring(0, MAX_MESSAGE_LENGTH) + "..." : body;
    }
}
