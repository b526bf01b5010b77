package com.identity.resolution.audit;

/**
 * Changes to the canonical store that are recorded for stewardship review.
 */
public enum AuditAction {
    ALIAS_CREATED,
    ALIAS_DEACTIVATED,
    ENTITY_AUTO_CREATED,
    ENTITY_RENAMED,
    ENTITY_RETIRED,
    ENTITY_MERGED,
    RECORD_RESOLVED_MANUALLY,
    RECORD_DISMISSED
}
