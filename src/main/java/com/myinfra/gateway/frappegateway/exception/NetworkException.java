package com.myinfra.gateway.frappegateway.exception;

/**
 * Transport failure before any HTTP response arrived.
 */
public class NetworkException extends GatewayException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
