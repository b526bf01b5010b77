package com.identity.resolution.similarity;

import com.identity.resolution.rules.NameNormalizer;

/**
 * Name similarity over normalized forms. Normalization happens here so every
 * caller compares names the same way.
 */
public class SimilarityEngine {

    private final NameNormalizer normalizer;
    private final SimilarityAlgorithm algorithm;

    public SimilarityEngine(NameNormalizer normalizer) {
        this(normalizer, new LevenshteinSimilarity());
    }

    public SimilarityEngine(NameNormalizer normalizer, SimilarityAlgorithm algorithm) {
        this.normalizer = normalizer;
        this.algorithm = algorithm;
    }

    /**
     * {@code similarity(a, b)} in [0, 1] after normalizing both names.
     */
    public double similarity(String a, String b) {
        return algorithm.compute(normalizer.normalize(a), normalizer.normalize(b));
    }

    /**
     * Same as {@link #similarity} for inputs the caller has already normalized.
     */
    public double similarityOfNormalized(String normalizedA, String normalizedB) {
        return algorithm.compute(normalizedA, normalizedB);
    }

    public SimilarityAlgorithm getAlgorithm() {
        return algorithm;
    }
}
