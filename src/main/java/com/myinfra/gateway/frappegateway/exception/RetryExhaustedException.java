package com.myinfra.gateway.frappegateway.exception;

import lombok.Getter;

/**
 * Every attempt of a call failed with a retryable error. The last failure is the cause.
 */
@Getter
public class RetryExhaustedException extends GatewayException {

    private final int attempts;

    public RetryExhaustedException(String target, int attempts, Throwable lastFailure) {
        super(target + ": request failed after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }
}
