package com.identity.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MatchResultTest {

    @Test
    @DisplayName("Equality ignores the match timestamp")
    void testEqualityIgnoresMatchedAt() {
        MatchResult first = new MatchResult("s1", "run-1", "client-1", null, MatchStrategy.FUZZY,
                MatchOutcome.MATCHED, 0.9, "fuzzy", "western health", Instant.parse("2024-01-01T00:00:00Z"));
        MatchResult second = new MatchResult("s1", "run-1", "client-1", null, MatchStrategy.FUZZY,
                MatchOutcome.MATCHED, 0.9, "fuzzy", "western health", Instant.parse("2024-06-01T00:00:00Z"));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, second.withRunId("run-2"));
    }

    @Test
    @DisplayName("Invalid results are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> MatchResult.matched("s1", "client-1", MatchStrategy.FUZZY, 1.2, "fuzzy", "x"));
        assertThrows(IllegalArgumentException.class,
                () -> MatchResult.matched("s1", null, MatchStrategy.EXACT_NAME, 0.95, "exact_name", "x"));
        assertThrows(NullPointerException.class,
                () -> MatchResult.unresolved(null, UnresolvedReason.NO_MATCH));
        assertThrows(IllegalArgumentException.class, () -> new MatchResult("s1", "run-1", "client-1", null,
                MatchStrategy.FUZZY, MatchOutcome.AMBIGUOUS, 0.9, "ambiguous", "x", null));
    }

    @Test
    @DisplayName("Ambiguous results keep the candidate out of the canonical id")
    void testAmbiguousCandidate() {
        MatchResult ambiguous = MatchResult.ambiguous("s1", "client-1", MatchStrategy.FUZZY, 0.9, "western health");

        assertNull(ambiguous.canonicalId());
        assertEquals("client-1", ambiguous.candidateId());

        MatchResult repointed = ambiguous.repointed("client-1", "client-2");
        assertEquals("client-2", repointed.candidateId());
        assertNull(repointed.canonicalId());
        assertSame(ambiguous.matchedAt(), repointed.matchedAt());
    }

    @Test
    @DisplayName("Unresolved reason follows the outcome")
    void testUnresolvedReason() {
        MatchResult matched = MatchResult.matched("s1", "client-1", MatchStrategy.KEYWORD, 0.75, "keyword", "x");
        assertEquals(Optional.empty(), matched.unresolvedReason());

        MatchResult demoted = matched.asAmbiguous();
        assertTrue(demoted.isAmbiguous());
        assertEquals("client-1", demoted.candidateId());
        assertNull(demoted.canonicalId());
        assertEquals(Optional.of(UnresolvedReason.AMBIGUOUS), demoted.unresolvedReason());

        assertEquals(Optional.of(UnresolvedReason.INVALID_INPUT),
                MatchResult.unresolved("s2", UnresolvedReason.INVALID_INPUT).unresolvedReason());
        assertEquals(MatchStrategy.NONE, MatchResult.unresolved("s2", UnresolvedReason.NO_MATCH).strategy());
    }
}
