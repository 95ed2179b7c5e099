package com.myinfra.gateway.frappegateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.myinfra.gateway.frappegateway.config.AppConfig.CacheConfig;
import com.myinfra.gateway.frappegateway.model.Document;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Last known state of single documents, keyed by doctype and name.
 * <p>
 * All invalidation rules live here: a write to one document drops its key, a create drops
 * every key of the doctype because the new name was unknown before the call. A disabled
 * cache stores nothing.
 * <p>
 * Every invalidation advances a generation. A read takes a {@link #stamp()} before it goes
 * upstream and hands it back to {@link #put}; the result is dropped when its key, its doctype
 * or the whole cache was invalidated after the stamp was taken.
 */
public class DocumentCache {

    record Key(String doctype, String name) {
    }

    private final Cache<Key, Document> cache;

    private final AtomicLong generation = new AtomicLong();
    private final Cache<Key, Long> keyInvalidations;
    private final Map<String, Long> doctypeInvalidations = new ConcurrentHashMap<>();
    private volatile long clearedAt;

    // puts share the read lock, invalidations take the write lock
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DocumentCache(CacheConfig config) {
        this(config.isEnabled(), config.getTtl(), config.getMaxSize(), Ticker.systemTicker());
    }

    DocumentCache(boolean enabled, Duration ttl, long maxSize, Ticker ticker) {
        this.cache = enabled
                ? Caffeine.newBuilder().expireAfterWrite(ttl).maximumSize(maxSize).ticker(ticker).build()
                : null;
        // a read older than the ttl cannot still be in flight under the call timeout
        this.keyInvalidations = enabled
                ? Caffeine.newBuilder().expireAfterWrite(ttl).ticker(ticker).build()
                : null;
    }

    public Optional<Document> get(String doctype, String name) {
        if (cache == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(new Key(doctype, name)));
    }

    /**
     * Current invalidation generation, taken before a read is sent upstream.
     */
    public long stamp() {
        return generation.get();
    }

    /**
     * Stores a document read under the given stamp, unless it was invalidated since.
     *
     * @return true when the document was stored
     */
    public boolean put(String doctype, String name, Document document, long stamp) {
        if (cache == null || document == null) {
            return false;
        }
        Key key = new Key(doctype, name);

        lock.readLock().lock();
        try {
            if (invalidatedSince(key, stamp)) {
                return false;
            }
            cache.put(key, document);
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void invalidate(String doctype, String name) {
        if (cache == null) {
            return;
        }
        Key key = new Key(doctype, name);

        lock.writeLock().lock();
        try {
            keyInvalidations.put(key, generation.incrementAndGet());
            cache.invalidate(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidateDoctype(String doctype) {
        if (cache == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            doctypeInvalidations.put(doctype, generation.incrementAndGet());
            cache.asMap().keySet().removeIf(key -> key.doctype().equals(doctype));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        if (cache == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            clearedAt = generation.incrementAndGet();
            cache.invalidateAll();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long size() {
        if (cache == null) {
            return 0;
        }
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private boolean invalidatedSince(Key key, long stamp) {
        if (clearedAt > stamp) {
            return true;
        }
        Long doctypeGeneration = doctypeInvalidations.get(key.doctype());
        if (doctypeGeneration != null && doctypeGeneration > stamp) {
            return true;
        }
        Long keyGeneration = keyInvalidations.getIfPresent(key);
        return keyGeneration != null && keyGeneration > stamp;
    }
}
