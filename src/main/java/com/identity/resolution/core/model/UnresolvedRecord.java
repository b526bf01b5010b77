package com.identity.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A source record with no accepted canonical match, queued for manual stewardship.
 * Created when a run leaves the record unmatched; cleared when a later run or a
 * manual alias resolves it.
 */
public final class UnresolvedRecord {
    private final String sourceId;
    private final String sourceSystem;
    private final String rawName;
    private final UnresolvedReason reason;
    private final String candidateId;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final String lastRunId;
    private final long occurrences;
    private final boolean resolved;
    private final String resolvedCanonicalId;

    private UnresolvedRecord(Builder builder) {
        this.sourceId = builder.sourceId;
        this.sourceSystem = builder.sourceSystem;
        this.rawName = builder.rawName;
        this.reason = builder.reason;
        this.candidateId = builder.candidateId;
        this.firstSeen = builder.firstSeen != null ? builder.firstSeen : Instant.now();
        this.lastSeen = builder.lastSeen != null ? builder.lastSeen : this.firstSeen;
        this.lastRunId = builder.lastRunId;
        this.occurrences = builder.occurrences;
        this.resolved = builder.resolved;
        this.resolvedCanonicalId = builder.resolvedCanonicalId;
    }

    /**
     * Creates a fresh, unresolved entry for a record first seen in {@code runId}.
     */
    public static UnresolvedRecord firstSeen(SourceRecord record, UnresolvedReason reason,
                                             String candidateId, String runId, Instant at) {
        return builder()
                .sourceId(record.sourceId())
                .sourceSystem(record.sourceSystem())
                .rawName(record.rawName())
                .reason(reason)
                .candidateId(candidateId)
                .firstSeen(at)
                .lastSeen(at)
                .lastRunId(runId)
                .occurrences(1)
                .build();
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    public String getRawName() {
        return rawName;
    }

    public UnresolvedReason getReason() {
        return reason;
    }

    /**
     * Best-scoring candidate for ambiguous records, null otherwise.
     */
    public String getCandidateId() {
        return candidateId;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public String getLastRunId() {
        return lastRunId;
    }

    /**
     * Number of distinct runs that left this record unresolved.
     */
    public long getOccurrences() {
        return occurrences;
    }

    public boolean isResolved() {
        return resolved;
    }

    public String getResolvedCanonicalId() {
        return resolvedCanonicalId;
    }

    /**
     * Records another sighting. Re-running the same run id does not bump the counter.
     * A previously resolved record becomes pending again.
     */
    public UnresolvedRecord seenAgain(UnresolvedReason newReason, String newCandidateId,
                                      String rawNameNow, String runId, Instant at) {
        boolean sameRun = Objects.equals(lastRunId, runId) && !resolved;
        return builder(this)
                .rawName(rawNameNow)
                .reason(newReason)
                .candidateId(newCandidateId)
                .lastSeen(at)
                .lastRunId(runId)
                .occurrences(sameRun ? occurrences : occurrences + 1)
                .resolved(false)
                .resolvedCanonicalId(null)
                .build();
    }

    public UnresolvedRecord markResolved(String canonicalId) {
        return builder(this).resolved(true).resolvedCanonicalId(canonicalId).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnresolvedRecord that = (UnresolvedRecord) o;
        return Objects.equals(sourceId, that.sourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId);
    }

    @Override
    public String toString() {
        return "UnresolvedRecord{" +
                "sourceId='" + sourceId + '\'' +
                ", rawName='" + rawName + '\'' +
                ", reason=" + reason +
                ", occurrences=" + occurrences +
                ", resolved=" + resolved +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(UnresolvedRecord r) {
        return new Builder()
                .sourceId(r.sourceId)
                .sourceSystem(r.sourceSystem)
                .rawName(r.rawName)
                .reason(r.reason)
                .candidateId(r.candidateId)
                .firstSeen(r.firstSeen)
                .lastSeen(r.lastSeen)
                .lastRunId(r.lastRunId)
                .occurrences(r.occurrences)
                .resolved(r.resolved)
                .resolvedCanonicalId(r.resolvedCanonicalId);
    }

    public static class Builder {
        private String sourceId;
        private String sourceSystem;
        private String rawName;
        private UnresolvedReason reason;
        private String candidateId;
        private Instant firstSeen;
        private Instant lastSeen;
        private String lastRunId;
        private long occurrences = 1;
        private boolean resolved;
        private String resolvedCanonicalId;

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public Builder rawName(String rawName) {
            this.rawName = rawName;
            return this;
        }

        public Builder reason(UnresolvedReason reason) {
            this.reason = reason;
            return this;
        }

        public Builder candidateId(String candidateId) {
            this.candidateId = candidateId;
            return this;
        }

        public Builder firstSeen(Instant firstSeen) {
            this.firstSeen = firstSeen;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder lastRunId(String lastRunId) {
            this.lastRunId = lastRunId;
            return this;
        }

        public Builder occurrences(long occurrences) {
            this.occurrences = occurrences;
            return this;
        }

        public Builder resolved(boolean resolved) {
            this.resolved = resolved;
            return this;
        }

        public Builder resolvedCanonicalId(String resolvedCanonicalId) {
            this.resolvedCanonicalId = resolvedCanonicalId;
            return this;
        }

        public UnresolvedRecord build() {
            Objects.requireNonNull(sourceId, "sourceId is required");
            Objects.requireNonNull(reason, "reason is required");
            return new UnresolvedRecord(this);
        }
    }
}
