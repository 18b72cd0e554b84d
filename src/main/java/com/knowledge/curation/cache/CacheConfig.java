package com.knowledge.curation.cache;

/**
 * Configuration for the neighbor cache.
 *
 * @param maxSize    maximum number of cached neighbor lists
 * @param ttlSeconds time-to-live in seconds for each list
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
     * Default configuration: 50,000 neighbor lists, kept for one overnight run (12h).
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 12 * 3600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
