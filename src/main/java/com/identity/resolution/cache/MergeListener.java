package com.identity.resolution.cache;

/**
 * Notified after a merge has been committed.
 */
public interface MergeListener {

    void onMerge(String winnerId, String loserId);
}
