package com.myinfra.gateway.frappegateway.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.myinfra.gateway.frappegateway.config.AppConfig;
import com.myinfra.gateway.frappegateway.config.AppConfig.AuthConfig;
import com.myinfra.gateway.frappegateway.exception.AuthenticationException;
import com.myinfra.gateway.frappegateway.exception.ValidationException;
import com.myinfra.gateway.frappegateway.model.Identity;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Resolves an inbound request to the calling {@link Identity}.
 * <p>
 * A Frappe session cookie is tried first; if it is absent or rejected the OAuth2 bearer
 * token is introspected. Each credential form costs at most one remote call per request,
 * and successful resolutions are cached for the configured TTL.
 */
@Slf4j
@Service
public class AuthService {

    static final String LOGGED_USER_METHOD = "/method/frappe.auth.get_logged_user";
    private static final String BEARER_PREFIX = "Bearer ";

    private final WebClient webClient;
    private final CredentialCache credentialCache;

    private final String tokenInfoUrl;
    private final String sessionCheckUrl;
    private final boolean validateRemote;
    private final String sessionCookie;
    private final String delegatedHeaderPrefix;

    private final Set<String> trustedClients = new HashSet<>();
    private final ReadWriteLock trustedClientsLock = new ReentrantReadWriteLock();

    public AuthService(WebClient.Builder webClientBuilder, AppConfig appConfig) {
        Objects.requireNonNull(webClientBuilder, "WebClient.Builder must not be null");
        AuthConfig auth = Objects.requireNonNull(appConfig, "AppConfig must not be null").getAuth();

        this.tokenInfoUrl = auth.getTokenInfoUrl();
        this.sessionCheckUrl = trimTrailingSlash(auth.getIssuerUrl()) + appConfig.getUpstream().getApiPrefix()
                + LOGGED_USER_METHOD;
        this.validateRemote = auth.isValidateRemote();
        this.sessionCookie = auth.getSessionCookie();
        this.delegatedHeaderPrefix = auth.getDelegatedHeaderPrefix();
        this.credentialCache = new CredentialCache(auth.getTokenCache().getTtl(), auth.getTokenCache().getMaxSize());

        if (auth.getTrustedClients() != null) {
            trustedClients.addAll(auth.getTrustedClients());
        }

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) auth.getTimeout().toMillis())
                .responseTimeout(auth.getTimeout());

        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();

        if (!validateRemote) {
            log.warn("Remote credential validation is DISABLED: every caller resolves to the anonymous identity. "
                    + "Never run this configuration in production.");
        }
    }

    /**
     * Authenticates an incoming request.
     *
     * @param request The incoming HTTP request
     * @return Mono emitting the resolved identity, or failing with an {@link AuthenticationException}
     *         (a {@link ValidationException} when a bearer token was rejected)
     */
    public Mono<Identity> authenticate(ServerHttpRequest request) {
        return Mono.defer(() -> authenticateSession(request)
                .switchIfEmpty(Mono.defer(() -> authenticateBearer(request))));
    }

    /**
     * Session path. Never fails: any problem completes empty so the bearer path gets its turn.
     */
    private Mono<Identity> authenticateSession(ServerHttpRequest request) {
        HttpCookie cookie = request.getCookies().getFirst(sessionCookie);
        if (cookie == null || cookie.getValue().isEmpty()) {
            return Mono.empty();
        }
        if (!validateRemote) {
            return Mono.just(Identity.anonymous());
        }

        String sessionId = cookie.getValue();
        Identity cached = credentialCache.get(CredentialCache.Kind.SESSION, sessionId).orElse(null);
        if (cached != null) {
            log.debug("Session resolved from cache for user={}", cached.email());
            return Mono.just(cached);
        }

        return webClient.get()
                .uri(sessionCheckUrl)
                .cookie(sessionCookie, sessionId)
                .exchangeToMono(response -> readOk(response, SessionInfo.class, "invalid session"))
                .flatMap(info -> {
                    if (info.message() == null || info.message().isBlank()) {
                        return Mono.error(new ValidationException("session check returned no user"));
                    }
                    Identity identity = Identity.fromSession(info.message(), sessionId);
                    credentialCache.put(CredentialCache.Kind.SESSION, sessionId, identity);
                    log.debug("Session validated for user={}", identity.email());
                    return Mono.just(identity);
                })
                .onErrorResume(e -> {
                    log.debug("Session validation failed, falling back to bearer token: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Identity> authenticateBearer(ServerHttpRequest request) {
        String token = extractBearerToken(request);
        if (token == null) {
            return Mono.error(new AuthenticationException(
                    "missing authentication: no session cookie or Bearer token found"));
        }
        if (!validateRemote) {
            return Mono.just(Identity.anonymous());
        }

        Mono<Identity> resolved = credentialCache.get(CredentialCache.Kind.BEARER, token)
                .map(identity -> {
                    log.debug("Bearer token resolved from cache for user={}", identity.email());
                    return Mono.just(identity);
                })
                .orElseGet(() -> introspect(token));

        return resolved.map(identity -> applyDelegation(identity, request));
    }

    private Mono<Identity> introspect(String token) {
        return webClient.get()
                .uri(tokenInfoUrl)
                .headers(headers -> headers.setBearerAuth(token))
                .exchangeToMono(response -> readOk(response, TokenInfo.class, "invalid token"))
                .switchIfEmpty(Mono.error(new ValidationException("token introspection returned an empty body")))
                .onErrorMap(e -> !(e instanceof AuthenticationException),
                        e -> new ValidationException("token validation failed: " + e.getMessage(), e))
                .flatMap(info -> {
                    if (info.sub() == null || info.sub().isBlank()) {
                        return Mono.error(new ValidationException("token introspection returned no subject"));
                    }
                    Identity identity = Identity.fromBearer(
                            info.sub(), info.email(), info.name(), info.clientId(), info.roles(), token);
                    credentialCache.put(CredentialCache.Kind.BEARER, token, identity);
                    log.debug("Bearer token validated for user={} client={}", identity.email(), identity.clientId());
                    return Mono.just(identity);
                })
                .doOnError(e -> log.warn("Bearer token rejected: {}", e.getMessage()));
    }

    /**
     * Replaces the identity of a trusted backend client with the end user it forwards.
     * The token's own identity stays in the cache; delegation is decided per request.
     */
    private Identity applyDelegation(Identity identity, ServerHttpRequest request) {
        if (!isTrustedClient(identity.clientId())) {
            return identity;
        }

        HttpHeaders headers = request.getHeaders();
        String userId = headers.getFirst(delegatedHeaderPrefix + "ID");
        if (userId == null || userId.isEmpty()) {
            return identity;
        }

        log.debug("Trusted client {} acting on behalf of user={}", identity.clientId(), userId);
        return Identity.delegated(
                userId,
                headers.getFirst(delegatedHeaderPrefix + "Email"),
                headers.getFirst(delegatedHeaderPrefix + "Name"));
    }

    private <T> Mono<T> readOk(ClientResponse response, Class<T> type, String rejection) {
        int status = response.statusCode().value();
        if (status != 200) {
            return response.releaseBody()
                    .then(Mono.<T>error(new ValidationException(rejection + ": status " + status)));
        }
        return response.bodyToMono(type);
    }

    /**
     * Extracts the token from an {@code Authorization: Bearer <token>} header.
     *
     * @param request Incoming HTTP request
     * @return The token, or null when absent or empty
     */
    static String extractBearerToken(ServerHttpRequest request) {
        String authHeader = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    public boolean isTrustedClient(String clientId) {
        if (clientId == null || clientId.isEmpty()) {
            return false;
        }
        trustedClientsLock.readLock().lock();
        try {
            return trustedClients.contains(clientId);
        } finally {
            trustedClientsLock.readLock().unlock();
        }
    }

    public void trustClients(Collection<String> clientIds) {
        trustedClientsLock.writeLock().lock();
        try {
            trustedClients.addAll(clientIds);
        } finally {
            trustedClientsLock.writeLock().unlock();
        }
    }

    public void revokeClient(String clientId) {
        trustedClientsLock.writeLock().lock();
        try {
            trustedClients.remove(clientId);
        } finally {
            trustedClientsLock.writeLock().unlock();
        }
    }

    public void clearCache() {
        credentialCache.clear();
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenInfo(
            String sub,
            String email,
            String name,
            @JsonProperty("client_id") String clientId,
            List<String> roles) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SessionInfo(String message) {
    }
}
