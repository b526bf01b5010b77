package com.identity.resolution.similarity;

import com.identity.resolution.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityEngineTest {

    @Nested
    @DisplayName("Levenshtein")
    class LevenshteinTests {

        private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

        @Test
        @DisplayName("Identical and empty strings")
        void testBoundaries() {
            assertEquals(1.0, levenshtein.compute("wa health", "wa health"));
            assertEquals(1.0, levenshtein.compute("", ""));
            assertEquals(0.0, levenshtein.compute("", "x"));
            assertEquals(0.0, levenshtein.compute("x", ""));
            assertEquals(1.0, levenshtein.compute(null, null));
        }

        @ParameterizedTest
        @DisplayName("Should be symmetric")
        @CsvSource({
                "barwon health,barwon helth",
                "monash,monash health",
                "western health,eastern health",
                "kitten,sitting"
        })
        void testSymmetric(String a, String b) {
            assertEquals(levenshtein.compute(a, b), levenshtein.compute(b, a), 1e-12);
        }

        @Test
        @DisplayName("Should compute classic distances")
        void testDistance() {
            assertEquals(3, LevenshteinSimilarity.distance("kitten", "sitting"));
            assertEquals(0, LevenshteinSimilarity.distance("abc", "abc"));
            assertEquals(3, LevenshteinSimilarity.distance("", "abc"));
        }

        @Test
        @DisplayName("Similarity is 1 - distance / max length")
        void testScore() {
            // one deletion over 13 characters
            assertEquals(1.0 - 1.0 / 13, levenshtein.compute("barwon health", "barwon helth"), 1e-9);
        }
    }

    @Nested
    @DisplayName("Token overlap")
    class TokenOverlapTests {

        private final TokenOverlapSimilarity overlap = new TokenOverlapSimilarity();

        @Test
        @DisplayName("Should keep only tokens longer than three characters")
        void testTokenize() {
            assertEquals(Set.of("imaging", "upgrade"), overlap.tokenize("gha imaging upgrade"));
        }

        @Test
        @DisplayName("Should skip stop words")
        void testStopWords() {
            assertEquals(Set.of("services", "hospital"), overlap.tokenize("services from the hospital"));
        }

        @Test
        @DisplayName("Ratio is shared over the larger token set")
        void testRatio() {
            TokenOverlapSimilarity.Overlap result = overlap.overlap(
                    overlap.tokenize("gippsland health alliance imaging upgrade"),
                    overlap.tokenize("gha imaging upgrade"));
            assertEquals(2, result.shared());
            assertEquals(0.4, result.ratio(), 1e-9);
        }

        @Test
        @DisplayName("Empty token sets share nothing")
        void testEmpty() {
            assertEquals(0.0, overlap.compute("", "imaging upgrade"));
            assertEquals(0.0, overlap.compute("abc", "abc"));
        }
    }

    @Nested
    @DisplayName("Engine")
    class EngineTests {

        private final SimilarityEngine engine = new SimilarityEngine(
                DefaultNormalizationRules.createDefaultNormalizer());

        @Test
        @DisplayName("Should normalize before comparing")
        void testNormalizesFirst() {
            assertEquals(1.0, engine.similarity("  WA  Health ", "wa health"));
            assertEquals(engine.similarity("Barwon Health", "BARWON HELTH"),
                    engine.similarityOfNormalized("barwon health", "barwon helth"), 1e-12);
        }

        @Test
        @DisplayName("Empty names follow the algorithm boundaries")
        void testEmptyNames() {
            assertEquals(1.0, engine.similarity("", ""));
            assertEquals(0.0, engine.similarity("", "x"));
            assertEquals("levenshtein", engine.getAlgorithm().getName());
        }
    }
}
