package com.myinfra.gateway.frappegateway.exception;

/**
 * A credential was presented but the identity provider rejected it, or its answer could
 * not be understood.
 */
public class ValidationException extends AuthenticationException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
