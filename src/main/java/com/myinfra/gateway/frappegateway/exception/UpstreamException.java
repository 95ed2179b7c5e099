package com.myinfra.gateway.frappegateway.exception;

import lombok.Getter;

import java.time.Duration;
import java.util.Optional;

/**
 * The upstream answered with an HTTP error status. Server errors are retryable,
 * client errors are not.
 */
public class UpstreamException extends GatewayException {

    @Getter
    private final int statusCode;
    @Getter
    private final String upstreamMessage;
    @Getter
    private final String exc;
    @Getter
    private final String target;
    private final Duration retryAfter;

    public UpstreamException(String target, int statusCode, String upstreamMessage, String exc, Duration retryAfter) {
        super(target + " returned " + statusCode + ": " + upstreamMessage);
        this.statusCode = statusCode;
        this.upstreamMessage = upstreamMessage;
        this.exc = exc;
        this.target = target;
        this.retryAfter = retryAfter;
    }

    @Override
    public boolean isRetryable() {
        return isRetryableStatus(statusCode);
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public static boolean isRetryableStatus(int statusCode) {
        return statusCode >= 500;
    }
}
