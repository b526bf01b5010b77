package com.identity.resolution.pipeline;

import com.identity.resolution.core.model.UnresolvedReason;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Per-run counts for operator triage.
 *
 * @param runId           pipeline run identifier
 * @param processed       records taken off the queue
 * @param matched         records with an accepted canonical match (auto-created included)
 * @param unresolved      unresolved and ambiguous records by reason
 * @param autoAliased     aliases written back after high-confidence fuzzy or keyword matches
 * @param autoCreated     canonical entities created for unmatched names
 * @param derivedInserted derived records written by the dedup writer
 * @param failures        records whose store writes failed; the run went on without them
 * @param deferred        records left for the next run when the batch timeout expired
 * @param duration        wall-clock time of the run
 */
public record RunReport(
        String runId,
        int processed,
        int matched,
        Map<UnresolvedReason, Integer> unresolved,
        int autoAliased,
        int autoCreated,
        int derivedInserted,
        List<RecordFailure> failures,
        int deferred,
        Duration duration
) {
    public RunReport {
        unresolved = unresolved != null ? Map.copyOf(unresolved) : Map.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public int unresolvedCount(UnresolvedReason reason) {
        return unresolved.getOrDefault(reason, 0);
    }

    public int totalUnresolved() {
        return unresolved.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * A record that could not be persisted.
     */
    public record RecordFailure(String sourceId, String error) {
    }

    @Override
    public String toString() {
        return "RunReport{runId=" + runId +
                ", processed=" + processed +
                ", matched=" + matched +
                ", unresolved=" + unresolved +
                ", autoAliased=" + autoAliased +
                ", autoCreated=" + autoCreated +
                ", derivedInserted=" + derivedInserted +
                ", failures=" + failures.size() +
                ", deferred=" + deferred +
                ", duration=" + duration.toMillis() + "ms}";
    }
}
