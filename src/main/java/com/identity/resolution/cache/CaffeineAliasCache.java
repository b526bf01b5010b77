package com.identity.resolution.cache;

import com.identity.resolution.core.model.AliasScope;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed {@link AliasCache} with a canonical id index for targeted invalidation.
 */
public class CaffeineAliasCache implements AliasCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAliasCache.class);

    private final Cache<LookupKey, String> cache;
    // canonicalId -> keys currently resolving to it
    private final ConcurrentMap<String, Set<LookupKey>> byCanonical = new ConcurrentHashMap<>();

    public CaffeineAliasCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((LookupKey key, String canonicalId, RemovalCause cause) -> {
                    if (key != null && canonicalId != null) {
                        Set<LookupKey> keys = byCanonical.get(canonicalId);
                        if (keys != null) {
                            keys.remove(key);
                        }
                    }
                })
                .build();
        log.info("cache.initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> get(AliasScope scope, String lookupKey) {
        return Optional.ofNullable(cache.getIfPresent(new LookupKey(scope, lookupKey)));
    }

    @Override
    public void put(AliasScope scope, String lookupKey, String canonicalId) {
        LookupKey key = new LookupKey(scope, lookupKey);
        byCanonical.computeIfAbsent(canonicalId, k -> ConcurrentHashMap.newKeySet()).add(key);
        cache.put(key, canonicalId);
    }

    @Override
    public void invalidateKey(AliasScope scope, String lookupKey) {
        cache.invalidate(new LookupKey(scope, lookupKey));
    }

    @Override
    public void invalidate(String canonicalId) {
        Set<LookupKey> keys = byCanonical.remove(canonicalId);
        if (keys != null) {
            cache.invalidateAll(keys);
            log.debug("cache.invalidated canonicalId={} entries={}", canonicalId, keys.size());
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        byCanonical.clear();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    record LookupKey(AliasScope scope, String lookupKey) {}
}
