package com.myinfra.gateway.frappegateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "app")
@Validated
public class AppConfig {

    @Valid
    @NotNull
    private UpstreamConfig upstream = new UpstreamConfig();

    @Valid
    @NotNull
    private AuthConfig auth = new AuthConfig();

    /**
     * Without a required, enabled authentication step there is no per-user credential,
     * so every upstream call needs the service key pair.
     */
    @AssertTrue(message = "app.upstream.api-key and api-secret are required when authentication is disabled or optional")
    public boolean isServiceCredentialConfigured() {
        if (auth.isEnabled() && auth.isRequireAuth()) {
            return true;
        }
        return upstream.hasServiceKey();
    }

    @AssertTrue(message = "app.auth.token-info-url and issuer-url are required when remote validation is enabled")
    public boolean isAuthEndpointsConfigured() {
        if (!auth.isEnabled() || !auth.isValidateRemote()) {
            return true;
        }
        return isPresent(auth.getTokenInfoUrl()) && isPresent(auth.getIssuerUrl());
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    @Data
    public static class UpstreamConfig {
        @NotBlank
        private String baseUrl;

        private String apiPrefix = "/api";

        private String apiKey;
        private String apiSecret;

        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration timeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ofSeconds(60);

        private RateLimitConfig rateLimit = new RateLimitConfig();
        private RetryConfig retry = new RetryConfig();
        private CacheConfig cache = new CacheConfig();
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        public boolean hasServiceKey() {
            return isPresent(apiKey) && isPresent(apiSecret);
        }

        @AssertTrue(message = "app.upstream.api-key and api-secret must be configured together")
        public boolean isServiceKeyPairComplete() {
            return isPresent(apiKey) == isPresent(apiSecret);
        }
    }

    @Data
    public static class RateLimitConfig {
        private double requestsPerSecond = 10;
        private int burst = 20;
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
        private boolean retryMutations = true;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(5);
        private long maxSize = 1000;
    }

    @Data
    public static class CircuitBreakerConfig {
        private float failureRateThreshold = 50.0f;
        private Duration waitDuration = Duration.ofSeconds(10);
        private int slidingWindowSize = 10;
        private int minimumNumberOfCalls = 10;
        private int permittedNumberOfCallsInHalfOpenState = 3;
    }

    @Data
    public static class AuthConfig {
        private boolean enabled = true;
        private boolean requireAuth = false;
        private boolean validateRemote = true;

        private String tokenInfoUrl;
        private String issuerUrl;
        private List<String> trustedClients = new ArrayList<>();

        private Duration timeout = Duration.ofSeconds(30);

        private String sessionCookie = "sid";
        private String csrfHeader = "X-Frappe-CSRF-Token";
        private String delegatedHeaderPrefix = "X-MCP-User-";

        private TokenCacheConfig tokenCache = new TokenCacheConfig();
    }

    @Data
    public static class TokenCacheConfig {
        private Duration ttl = Duration.ofMinutes(5);
        private long maxSize = 10_000;
    }
}
