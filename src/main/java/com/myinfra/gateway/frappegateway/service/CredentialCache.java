package com.myinfra.gateway.frappegateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.myinfra.gateway.frappegateway.model.Identity;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Time-expiring store of identities resolved from session ids and bearer tokens.
 * Only successful validations are stored; an expired entry reads as a miss.
 */
public class CredentialCache {

    public enum Kind {
        SESSION,
        BEARER
    }

    record Key(Kind kind, String value) {
    }

    private final Cache<Key, Identity> cache;

    public CredentialCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, Ticker.systemTicker());
    }

    CredentialCache(Duration ttl, long maxSize, Ticker ticker) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    public Optional<Identity> get(Kind kind, String credential) {
        return Optional.ofNullable(cache.getIfPresent(new Key(kind, credential)));
    }

    public void put(Kind kind, String credential, Identity identity) {
        cache.put(new Key(kind, credential), identity);
    }

    public void invalidate(Kind kind, String credential) {
        cache.invalidate(new Key(kind, credential));
    }

    public void clear() {
        cache.invalidateAll();
    }
}
