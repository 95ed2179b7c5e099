package com.myinfra.gateway.frappegateway.service;

import com.myinfra.gateway.frappegateway.config.AppConfig.RetryConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounded retry with linear backoff: attempt {@code n} (n &ge; 1) waits
 * {@code min(n * initialDelay, maxDelay)}; attempt 0 does not wait.
 *
 * @param maxAttempts    Total attempts including the first, at least 1
 * @param initialDelay   Backoff unit
 * @param maxDelay       Upper bound for any single wait
 * @param retryMutations Whether create, update and delete calls are retried too
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, boolean retryMutations) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
        maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
    }

    public static RetryPolicy from(RetryConfig config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getInitialDelay(), config.getMaxDelay(),
                config.isRetryMutations());
    }

    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        Duration delay = initialDelay.multipliedBy(attempt);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * Delay before {@code attempt}, preferring the wait the upstream asked for.
     * A requested wait is still capped at {@link #maxDelay()}.
     */
    public Duration delayFor(int attempt, Optional<Duration> retryAfter) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        return retryAfter
                .map(requested -> requested.compareTo(maxDelay) > 0 ? maxDelay : requested)
                .orElseGet(() -> delayFor(attempt));
    }

    public int attemptsFor(UpstreamOperation operation) {
        return operation.isMutating() && !retryMutations ? 1 : maxAttempts;
    }
}
