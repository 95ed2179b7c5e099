package com.myinfra.gateway.frappegateway.exception;

import java.time.Duration;

/**
 * The caller's time budget ran out while waiting for a rate-limit token, a backoff
 * sleep or the upstream response.
 */
public class DeadlineExceededException extends GatewayException {

    public DeadlineExceededException(String operation, Duration deadline, Throwable cause) {
        super(operation + " did not complete within " + deadline.toMillis() + "ms", cause);
    }
}
