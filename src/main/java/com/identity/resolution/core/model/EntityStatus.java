package com.identity.resolution.core.model;

/**
 * Lifecycle status of a canonical entity.
 * Entity ids are never deleted or reused; a retired id stays retired.
 */
public enum EntityStatus {
    /**
     * Entity is the live join key for its aliases and match results.
     */
    ACTIVE,

    /**
     * Entity lost a merge or was retired by a data steward.
     * Kept for audit; no new aliases or match results may point at it.
     */
    RETIRED
}
