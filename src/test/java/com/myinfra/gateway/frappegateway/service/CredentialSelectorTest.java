package com.myinfra.gateway.frappegateway.service;

import com.myinfra.gateway.frappegateway.exception.AuthenticationException;
import com.myinfra.gateway.frappegateway.exception.ConfigurationException;
import com.myinfra.gateway.frappegateway.model.Identity;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialSelectorTest {

    private static final String CSRF_HEADER = "X-Frappe-CSRF-Token";

    private final CredentialSelector withServiceKey = new CredentialSelector("sid", CSRF_HEADER, "key", "secret");
    private final CredentialSelector withoutServiceKey = new CredentialSelector("sid", CSRF_HEADER, null, null);

    @Test
    void sessionWinsAndCarriesCsrfToken() {
        Identity identity = Identity.fromSession("a@example.com", "sess-1").withCsrfToken("csrf-1");

        UpstreamCredential credential = withServiceKey.select(identity, UpstreamOperation.UPDATE_DOCUMENT);

        HttpHeaders headers = new HttpHeaders();
        credential.applyTo(headers);
        assertThat(credential).isInstanceOf(UpstreamCredential.Session.class);
        assertThat(headers.getFirst(HttpHeaders.COOKIE)).isEqualTo("sid=sess-1");
        assertThat(headers.getFirst(CSRF_HEADER)).isEqualTo("csrf-1");
        assertThat(headers.containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
    }

    @Test
    void sessionReadDoesNotNeedCsrf() {
        Identity identity = Identity.fromSession("a@example.com", "sess-1");

        UpstreamCredential credential = withServiceKey.select(identity, UpstreamOperation.GET_DOCUMENT);

        HttpHeaders headers = new HttpHeaders();
        credential.applyTo(headers);
        assertThat(headers.getFirst(HttpHeaders.COOKIE)).isEqualTo("sid=sess-1");
        assertThat(headers.containsKey(CSRF_HEADER)).isFalse();
    }

    @Test
    void sessionWriteWithoutCsrfIsRejected() {
        Identity identity = Identity.fromSession("a@example.com", "sess-1");

        assertThatThrownBy(() -> withServiceKey.select(identity, UpstreamOperation.CREATE_DOCUMENT))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("CSRF token is required")
                .hasMessageContaining(CSRF_HEADER);
    }

    @Test
    void bearerTokenIsPassedThrough() {
        Identity identity = Identity.fromBearer("u1", "u1@example.com", null, "client", List.of(), "tok-1");

        UpstreamCredential credential = withServiceKey.select(identity, UpstreamOperation.DELETE_DOCUMENT);

        HttpHeaders headers = new HttpHeaders();
        credential.applyTo(headers);
        assertThat(headers.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer tok-1");
    }

    @Test
    void serviceKeyIsTheFallback() {
        UpstreamCredential anonymous = withServiceKey.select(null, UpstreamOperation.LIST_DOCUMENTS);
        UpstreamCredential delegated = withServiceKey.select(
                Identity.delegated("u2", "u2@example.com", "User Two"), UpstreamOperation.LIST_DOCUMENTS);

        HttpHeaders headers = new HttpHeaders();
        anonymous.applyTo(headers);
        assertThat(headers.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("token key:secret");
        assertThat(delegated).isInstanceOf(UpstreamCredential.ApiKey.class);
    }

    @Test
    void failsWhenNoCredentialIsAvailable() {
        assertThatThrownBy(() -> withoutServiceKey.select(null, UpstreamOperation.GET_DOCUMENT))
                .isInstanceOf(AuthenticationException.class)
                .hasMessage("no authentication credentials available (no session, token, or API key)");
    }
}
