package com.identity.resolution.cache;

/**
 * @param maxSize    maximum cached alias lookups
 * @param ttlSeconds expiry after write
 * @param enabled    false selects {@link NoOpAliasCache}
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
     * 10,000 entries, 300s TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 300, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }

    public AliasCache create() {
        return enabled ? new CaffeineAliasCache(this) : new NoOpAliasCache();
    }
}
