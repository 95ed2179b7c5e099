package com.myinfra.gateway.frappegateway.model;

import java.util.List;

/**
 * Resolved caller of a request, together with the upstream credential it may present.
 * <p>
 * An identity carries at most one upstream credential: either a Frappe session id or an
 * OAuth2 bearer token. The CSRF token is bound to the current call and only accompanies a
 * session id.
 *
 * @param id          The unique user ID (token subject or session user)
 * @param email       The user's email
 * @param fullName    The display name
 * @param roles       Roles reported by the identity provider (empty when unknown)
 * @param clientId    OAuth2 client that obtained the token, if any
 * @param sessionId   Frappe session id kept for pass-through, if any
 * @param bearerToken OAuth2 access token kept for pass-through, if any
 * @param csrfToken   CSRF token of the current call, only with a session id
 */
public record Identity(
        String id,
        String email,
        String fullName,
        List<String> roles,
        String clientId,
        String sessionId,
        String bearerToken,
        String csrfToken) {

    public static final String ANONYMOUS_ID = "anonymous";

    public Identity {
        roles = roles == null ? List.of() : List.copyOf(roles);
        if (isPresent(sessionId) && isPresent(bearerToken)) {
            throw new IllegalArgumentException("Identity may carry a session id or a bearer token, not both");
        }
        if (isPresent(csrfToken) && !isPresent(sessionId)) {
            throw new IllegalArgumentException("CSRF token requires a session id");
        }
    }

    public static Identity fromSession(String email, String sessionId) {
        return new Identity(email, email, null, List.of(), null, sessionId, null, null);
    }

    public static Identity fromBearer(String id, String email, String fullName, String clientId,
                                      List<String> roles, String bearerToken) {
        return new Identity(id, email, fullName, roles, clientId, null, bearerToken, null);
    }

    /**
     * Identity asserted by a trusted backend client: no roles and no credential of its own.
     */
    public static Identity delegated(String id, String email, String fullName) {
        return new Identity(id, email, fullName, List.of(), null, null, null, null);
    }

    public static Identity anonymous() {
        return new Identity(ANONYMOUS_ID, "anonymous@example.com", null, List.of(), null, null, null, null);
    }

    /**
     * Copy of this identity bound to the CSRF token sent with the current call.
     * Identities without a session id are returned unchanged.
     */
    public Identity withCsrfToken(String token) {
        if (!hasSession() || !isPresent(token)) {
            return this;
        }
        return new Identity(id, email, fullName, roles, clientId, sessionId, null, token);
    }

    public boolean hasSession() {
        return isPresent(sessionId);
    }

    public boolean hasBearerToken() {
        return isPresent(bearerToken);
    }

    public boolean hasCsrfToken() {
        return isPresent(csrfToken);
    }

    @Override
    public String toString() {
        // credentials stay out of logs
        return "Identity[id=" + id + ", email=" + email + ", clientId=" + clientId
                + ", session=" + hasSession() + ", bearer=" + hasBearerToken() + "]";
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
