package com.identity.resolution.lock;

/**
 * Keyed mutual exclusion around canonical entity auto-creation, so that two workers
 * seeing the same unknown name cannot both create an entity for it.
 */
public interface DistributedLock {

    /**
     * Blocks until the lock for {@code key} is held.
     *
     * @param key typically {@code normalizedName:ENTITY_TYPE}
     * @throws LockAcquisitionException if the lock is not acquired within the configured timeout
     */
    void lock(String key);

    /**
     * Releases {@code key} if held by the calling thread.
     */
    void unlock(String key);

    static String key(String normalizedName, Enum<?> type) {
        return normalizedName + ":" + type.name();
    }
}
