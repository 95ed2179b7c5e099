package com.myinfra.gateway.frappegateway.exception;

/**
 * Base of every failure the gateway raises on purpose. Anything else reaching the
 * {@link GlobalExceptionHandler} is treated as an unexpected error.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return true when repeating the same call may plausibly succeed
     */
    public boolean isRetryable() {
        return false;
    }
}
