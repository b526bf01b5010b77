package com.identity.resolution.audit;

import java.util.List;

/**
 * Append-only storage for {@link AuditEntry} records.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    int count();
}
