package com.identity.resolution.cache;

import com.identity.resolution.core.model.AliasScope;

import java.util.Optional;

/**
 * Cache of successful exact lookups, {@code (scope, lookupKey) -> canonicalId}.
 * Only positive results are cached, so a newly inserted alias is visible at once;
 * entries are dropped whenever the entity they point to changes.
 */
public interface AliasCache extends MergeListener {

    Optional<String> get(AliasScope scope, String lookupKey);

    void put(AliasScope scope, String lookupKey, String canonicalId);

    /**
     * Drops a single lookup key, e.g. after alias deactivation.
     */
    void invalidateKey(AliasScope scope, String lookupKey);

    /**
     * Drops every cached lookup resolving to {@code canonicalId}.
     */
    void invalidate(String canonicalId);

    void invalidateAll();

    CacheStats getStats();

    @Override
    default void onMerge(String winnerId, String loserId) {
        invalidate(loserId);
        invalidate(winnerId);
    }
}
