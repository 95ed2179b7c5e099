package com.myinfra.gateway.frappegateway.exception;

/**
 * No usable credential was presented.
 */
public class AuthenticationException extends GatewayException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
