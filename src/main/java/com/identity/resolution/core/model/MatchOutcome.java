package com.identity.resolution.core.model;

/**
 * Classification of a match attempt.
 */
public enum MatchOutcome {
    /** A single canonical entity was accepted. */
    MATCHED,
    /** Two or more candidates scored too close together to auto-resolve. */
    AMBIGUOUS,
    /** No candidate cleared its threshold, or the input was malformed. */
    UNRESOLVED
}
