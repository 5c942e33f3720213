package org.scoringapi.gateway.store;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe in-memory Store. Cache entries expire against the given clock;
 * when a new key would take the cache past its limit the cache is cleared first.
 * Cache writes are serialized, so the cache never holds more than the limit.
 */
public final class InMemoryStore implements Store {

    private static final Logger LOG = Logger.getLogger(InMemoryStore.class.getName());

    private final Map<String, Entry> cache = new ConcurrentHashMap<>();
    private final Map<String, String> data = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;

    public InMemoryStore(Clock clock, int maxEntries) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxEntries = Math.max(1, maxEntries);
    }

    @Override
    public String cacheGet(String key) {
        if (key == null) {
            return null;
        }
        Entry entry = cache.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAtMs <= clock.millis()) {
            cache.remove(key, entry);
            return null;
        }
        return entry.value;
    }

    @Override
    public synchronized void cacheSet(String key, String value, long ttlSeconds) {
        Objects.requireNonNull(key, "key must not be null");
        if (cache.size() >= maxEntries && !cache.containsKey(key)) {
            LOG.fine(() -> "Cache limit " + maxEntries + " reached, clearing");
            cache.clear();
        }
        long ttlMs = Math.max(0, ttlSeconds) * 1000L;
        cache.put(key, new Entry(value, clock.millis() + ttlMs));
    }

    @Override
    public String get(String key) {
        return key == null ? null : data.get(key);
    }

    @Override
    public void set(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        data.put(key, value);
    }

    /**
     * Number of live and not yet evicted cache entries.
     */
    public int cacheSize() {
        return cache.size();
    }

    private static final class Entry {
        private final String value;
        private final long expiresAtMs;

        private Entry(String value, long expiresAtMs) {
            this.value = value;
            this.expiresAtMs = expiresAtMs;
        }
    }
}
