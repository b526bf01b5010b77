package com.identity.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of matching one source record against the canonical store.
 * One result is kept per {@code (sourceId, runId)}; re-running a pipeline run overwrites it.
 *
 * <p>For unresolved and ambiguous outcomes {@code reason} is the
 * {@link UnresolvedReason} code ({@code no_match}, {@code ambiguous},
 * {@code invalid_input}); for matches it describes what was hit.</p>
 *
 * <p>Only matched results carry a {@code canonicalId}, so joins on it never pick up a
 * result that was not accepted. Ambiguous results keep their best-scoring entity in
 * {@code candidateId} for the reviewer.</p>
 *
 * <p>{@code matchedAt} is bookkeeping and does not take part in equality, so two
 * matcher runs over the same store state and input compare equal.</p>
 */
public record MatchResult(
        String sourceId,
        String runId,
        String canonicalId,
        String candidateId,
        MatchStrategy strategy,
        MatchOutcome outcome,
        double confidence,
        String reason,
        String matchedAlias,
        Instant matchedAt
) {
    public MatchResult {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(outcome, "outcome is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (outcome == MatchOutcome.MATCHED && canonicalId == null) {
            throw new IllegalArgumentException("A matched result requires a canonicalId");
        }
        if (outcome != MatchOutcome.MATCHED && canonicalId != null) {
            throw new IllegalArgumentException("Only a matched result may carry a canonicalId, got " + outcome);
        }
        matchedAt = matchedAt != null ? matchedAt : Instant.now();
    }

    public static MatchResult matched(String sourceId, String canonicalId, MatchStrategy strategy,
                                      double confidence, String reason, String matchedAlias) {
        return new MatchResult(sourceId, null, canonicalId, null, strategy, MatchOutcome.MATCHED,
                confidence, reason, matchedAlias, null);
    }

    /**
     * Top candidate is recorded for the reviewer but the result is not accepted.
     */
    public static MatchResult ambiguous(String sourceId, String topCandidateId, MatchStrategy strategy,
                                        double confidence, String matchedAlias) {
        return new MatchResult(sourceId, null, null, topCandidateId, strategy, MatchOutcome.AMBIGUOUS,
                confidence, UnresolvedReason.AMBIGUOUS.getCode(), matchedAlias, null);
    }

    public static MatchResult unresolved(String sourceId, UnresolvedReason reason) {
        return new MatchResult(sourceId, null, null, null, MatchStrategy.NONE, MatchOutcome.UNRESOLVED,
                0.0, reason.getCode(), null, null);
    }

    public boolean isMatched() {
        return outcome == MatchOutcome.MATCHED;
    }

    public boolean isAmbiguous() {
        return outcome == MatchOutcome.AMBIGUOUS;
    }

    /**
     * Reason to queue this record for review, empty when it was matched.
     */
    public Optional<UnresolvedReason> unresolvedReason() {
        if (outcome == MatchOutcome.MATCHED) {
            return Optional.empty();
        }
        if (outcome == MatchOutcome.AMBIGUOUS) {
            return Optional.of(UnresolvedReason.AMBIGUOUS);
        }
        for (UnresolvedReason r : UnresolvedReason.values()) {
            if (r.getCode().equals(reason)) {
                return Optional.of(r);
            }
        }
        return Optional.of(UnresolvedReason.NO_MATCH);
    }

    public MatchResult withRunId(String newRunId) {
        return new MatchResult(sourceId, newRunId, canonicalId, candidateId, strategy, outcome,
                confidence, reason, matchedAlias, matchedAt);
    }

    /**
     * Moves references to {@code fromId}, accepted or candidate, over to {@code toId}.
     */
    public MatchResult repointed(String fromId, String toId) {
        return new MatchResult(sourceId, runId,
                fromId.equals(canonicalId) ? toId : canonicalId,
                fromId.equals(candidateId) ? toId : candidateId,
                strategy, outcome, confidence, reason, matchedAlias, matchedAt);
    }

    /**
     * Demotes an accepted match to ambiguous, keeping the candidate for the reviewer.
     */
    public MatchResult asAmbiguous() {
        String candidate = canonicalId != null ? canonicalId : candidateId;
        return new MatchResult(sourceId, runId, null, candidate, strategy, MatchOutcome.AMBIGUOUS,
                confidence, UnresolvedReason.AMBIGUOUS.getCode(), matchedAlias, matchedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchResult that)) return false;
        return Double.compare(confidence, that.confidence) == 0
                && sourceId.equals(that.sourceId)
                && Objects.equals(runId, that.runId)
                && Objects.equals(canonicalId, that.canonicalId)
                && Objects.equals(candidateId, that.candidateId)
                && strategy == that.strategy
                && outcome == that.outcome
                && Objects.equals(reason, that.reason)
                && Objects.equals(matchedAlias, that.matchedAlias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, runId, canonicalId, candidateId, strategy, outcome, confidence, reason, matchedAlias);
    }
}
