package com.myinfra.gateway.frappegateway.service;

import com.myinfra.gateway.frappegateway.exception.AuthenticationException;
import com.myinfra.gateway.frappegateway.exception.ConfigurationException;
import com.myinfra.gateway.frappegateway.model.Identity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

/**
 * Picks the credential for one outbound call, in order of preference: the caller's
 * session, the caller's bearer token, the service key pair.
 */
@Slf4j
public class CredentialSelector {

    private final String sessionCookie;
    private final String csrfHeader;
    private final UpstreamCredential.ApiKey serviceKey;

    public CredentialSelector(String sessionCookie, String csrfHeader, String apiKey, String apiSecret) {
        this.sessionCookie = sessionCookie;
        this.csrfHeader = csrfHeader;
        this.serviceKey = isPresent(apiKey) && isPresent(apiSecret)
                ? new UpstreamCredential.ApiKey(apiKey, apiSecret)
                : null;
    }

    /**
     * @param identity  Caller of the operation, null when the request was not authenticated
     * @param operation Operation about to be dispatched
     * @return The credential to present
     * @throws ConfigurationException  for a session-authenticated write without a CSRF token
     * @throws AuthenticationException when no credential is available at all
     */
    public UpstreamCredential select(@Nullable Identity identity, UpstreamOperation operation) {
        if (identity != null && identity.hasSession()) {
            if (operation.isMutating() && !identity.hasCsrfToken()) {
                throw new ConfigurationException("CSRF token is required to " + operation.getDescription()
                        + " with a session credential; send it in the " + csrfHeader + " header");
            }
            log.debug("Using session credential for user={}", identity.email());
            return new UpstreamCredential.Session(sessionCookie, identity.sessionId(), csrfHeader, identity.csrfToken());
        }
        if (identity != null && identity.hasBearerToken()) {
            log.debug("Using bearer credential for user={}", identity.email());
            return new UpstreamCredential.Bearer(identity.bearerToken());
        }
        if (serviceKey != null) {
            log.debug("Using service API key credential");
            return serviceKey;
        }
        throw new AuthenticationException("no authentication credentials available (no session, token, or API key)");
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
