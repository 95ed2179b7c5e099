package com.myinfra.gateway.frappegateway.exception;

/**
 * The call cannot be made as configured: a session-authenticated write without a CSRF
 * token, or a client built without its base configuration.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(message);
    }
}
