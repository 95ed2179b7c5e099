package com.myinfra.gateway.frappegateway.service;

import org.springframework.http.HttpHeaders;

/**
 * Credential presented on an outbound call.
 */
public interface UpstreamCredential {

    void applyTo(HttpHeaders headers);

    /**
     * @return Short label for logs, never the secret itself
     */
    String describe();

    /**
     * User session passed through as a cookie, with the call's CSRF token when present.
     */
    record Session(String cookieName, String sessionId, String csrfHeader, String csrfToken)
            implements UpstreamCredential {

        @Override
        public void applyTo(HttpHeaders headers) {
            headers.add(HttpHeaders.COOKIE, cookieName + "=" + sessionId);
            if (csrfToken != null && !csrfToken.isEmpty()) {
                headers.set(csrfHeader, csrfToken);
            }
        }

        @Override
        public String describe() {
            return "session";
        }
    }

    /**
     * User's OAuth2 access token.
     */
    record Bearer(String token) implements UpstreamCredential {

        @Override
        public void applyTo(HttpHeaders headers) {
            headers.setBearerAuth(token);
        }

        @Override
        public String describe() {
            return "bearer";
        }
    }

    /**
     * Service-level API key pair, used only when the caller brings no credential.
     */
    record ApiKey(String apiKey, String apiSecret) implements UpstreamCredential {

        @Override
        public void applyTo(HttpHeaders headers) {
            headers.set(HttpHeaders.AUTHORIZATION, "token " + apiKey + ":" + apiSecret);
        }

        @Override
        public String describe() {
            return "api-key";
        }
    }
}
