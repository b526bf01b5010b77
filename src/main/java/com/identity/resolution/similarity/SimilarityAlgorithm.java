package com.identity.resolution.similarity;

/**
 * String similarity scored in [0, 1], where 1 means identical.
 * Implementations must be pure, symmetric and deterministic.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two already-comparable strings.
     */
    double compute(String s1, String s2);

    String getName();
}
