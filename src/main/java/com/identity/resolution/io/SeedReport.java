package com.identity.resolution.io;

import java.util.List;

/**
 * Outcome of loading an alias seed file.
 *
 * @param entitiesCreated  canonical entities that did not exist before
 * @param entitiesExisting canonical entities already present (re-load)
 * @param aliasesInserted  name and reference-number aliases written, including no-op re-inserts
 * @param conflicts        aliases skipped because they already map to another entity
 */
public record SeedReport(int entitiesCreated, int entitiesExisting, int aliasesInserted, List<String> conflicts) {

    public SeedReport {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
