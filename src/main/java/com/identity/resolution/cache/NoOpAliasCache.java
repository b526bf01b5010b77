package com.identity.resolution.cache;

import com.identity.resolution.core.model.AliasScope;

import java.util.Optional;

public class NoOpAliasCache implements AliasCache {

    @Override
    public Optional<String> get(AliasScope scope, String lookupKey) {
        return Optional.empty();
    }

    @Override
    public void put(AliasScope scope, String lookupKey, String canonicalId) {
        // no-op
    }

    @Override
    public void invalidateKey(AliasScope scope, String lookupKey) {
        // no-op
    }

    @Override
    public void invalidate(String canonicalId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
