package com.swingtrader.common.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory TTL cache backed by a {@link ConcurrentHashMap}.
 *
 * <p>An entry is live while {@code now - storedAt < ttl}. Expiry is lazy: there is no
 * sweeper thread, an expired entry is removed by the first {@link #get} that observes it.
 * Removal is conditional on the entry still being the expired one, so a concurrent
 * {@link #set} is never lost.
 *
 * <p>The {@link Clock} is injectable so tests can advance time deterministically.
 */
public class InMemoryResultCache implements ResultCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResultCache.class);

    private final Map<String, CacheEntry> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryResultCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public InMemoryResultCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive, got " + ttl);
        }
        this.ttl   = ttl;
        this.clock = clock;
    }

    @Override
    public Object get(String key) {
        CacheEntry entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            store.remove(key, entry);
            log.debug("CACHE_EXPIRED key={} storedAt={}", key, entry.storedAt());
            return null;
        }
        return entry.value();
    }

    @Override
    public void set(String key, Object value) {
        store.put(key, new CacheEntry(value, clock.instant()));
        log.debug("CACHE_STORE key={} ttl={}", key, ttl);
    }

    @Override
    public void clear() {
        store.clear();
    }

    @Override
    public int size() {
        return store.size();
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean isExpired(CacheEntry entry) {
        Instant expiresAt = entry.storedAt().plus(ttl);
        return !clock.instant().isBefore(expiresAt);
    }
}
