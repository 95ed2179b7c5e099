package com.myinfra.gateway.frappegateway.service;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * In-process token bucket bounding the outbound request rate.
 * <p>
 * The bucket holds up to {@code burst} tokens and refills at {@code requestsPerSecond}.
 * A caller that finds the bucket empty reserves the next token and waits for it; the
 * balance may go negative to queue reservations but never exceeds the capacity. Cancelling
 * a wait (deadline or unsubscribe) hands the reserved token back.
 */
@Slf4j
public class RateLimiter {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final double capacity;
    private final double tokensPerNano;
    private final boolean unlimited;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;

    public RateLimiter(double requestsPerSecond, int burst) {
        this(requestsPerSecond, burst, System::nanoTime);
    }

    RateLimiter(double requestsPerSecond, int burst, LongSupplier nanoClock) {
        this.unlimited = requestsPerSecond <= 0;
        this.capacity = Math.max(1, burst);
        this.tokensPerNano = requestsPerSecond / NANOS_PER_SECOND;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Takes one token, waiting for it when the bucket is empty.
     *
     * @return Mono completing once the caller holds a token
     */
    public Mono<Void> acquire() {
        if (unlimited) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            long waitNanos = reserve();
            if (waitNanos <= 0) {
                return Mono.empty();
            }
            log.debug("Rate limit reached, waiting {}ms for a token", waitNanos / 1_000_000);
            return Mono.delay(Duration.ofNanos(waitNanos))
                    .doOnCancel(this::release)
                    .then();
        });
    }

    /**
     * Reserves the next token.
     *
     * @return Nanoseconds until the reserved token becomes available, 0 when it is available now
     */
    synchronized long reserve() {
        refill();
        tokens -= 1;
        if (tokens >= 0) {
            return 0;
        }
        return (long) Math.ceil(-tokens / tokensPerNano);
    }

    synchronized void release() {
        refill();
        tokens = Math.min(capacity, tokens + 1);
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }
}
