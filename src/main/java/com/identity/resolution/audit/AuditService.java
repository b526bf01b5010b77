package com.identity.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Records audit entries for alias, entity and stewardship changes.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "system";

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actor, Map<String, Object> details) {
        AuditEntry entry = repository.save(AuditEntry.of(action, subjectId,
                actor != null ? actor : SYSTEM_ACTOR, details));
        log.debug("audit.recorded action={} subjectId={} actor={}", action, subjectId, entry.actor());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actor) {
        return record(action, subjectId, actor, null);
    }

    public List<AuditEntry> getEntriesFor(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }
}
