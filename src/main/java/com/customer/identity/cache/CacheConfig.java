package com.customer.identity.cache;

/**
 * Configuration of the search result cache.
 *
 * @param maxSize    maximum number of cached queries
 * @param ttlSeconds time-to-live of each entry; kept short because resolutions change rankings
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 1,000 entries, 30s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, 30, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
