package com.identity.resolution.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One audited change. {@code subjectId} is the canonical id or source id the change applies to.
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subjectId,
        String actor,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry of(AuditAction action, String subjectId, String actor, Map<String, Object> details) {
        return new AuditEntry(UUID.randomUUID().toString(), action, subjectId, actor, details, Instant.now());
    }
}
