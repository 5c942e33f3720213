package org.scoringapi.gateway.store;

/**
 * Key-value backing service used by the scoring functions.
 */
public interface Store {

    /**
     * Get a cached value, or null if missing or expired.
     */
    String cacheGet(String key);

    /**
     * Cache a value for the given number of seconds.
     */
    void cacheSet(String key, String value, long ttlSeconds);

    /**
     * Get a stored value, or null if missing.
     */
    String get(String key);

    /**
     * Store a value without expiry.
     */
    void set(String key, String value);
}
