package com.identity.resolution.similarity;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Significant-word overlap: {@code |A ∩ B| / max(|A|, |B|)}.
 * Only words longer than three characters that are not stop words count.
 */
public class TokenOverlapSimilarity implements SimilarityAlgorithm {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 4;

    private static final Pattern SEPARATOR = Pattern.compile("\\s+");
    private static final Set<String> STOP_WORDS = Set.of(
            "that", "this", "with", "from", "into", "over", "under", "their", "there");

    private final int minTokenLength;

    public TokenOverlapSimilarity() {
        this(DEFAULT_MIN_TOKEN_LENGTH);
    }

    public TokenOverlapSimilarity(int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }

    @Override
    public double compute(String s1, String s2) {
        return overlap(tokenize(s1), tokenize(s2)).ratio();
    }

    @Override
    public String getName() {
        return "token-overlap";
    }

    /**
     * Significant tokens of an already simplified name, in order of appearance.
     */
    public Set<String> tokenize(String simplified) {
        Set<String> tokens = new LinkedHashSet<>();
        if (simplified == null || simplified.isBlank()) {
            return tokens;
        }
        for (String token : SEPARATOR.split(simplified.trim())) {
            if (token.length() >= minTokenLength && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public Overlap overlap(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return new Overlap(0, 0.0);
        }
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) {
                shared++;
            }
        }
        return new Overlap(shared, (double) shared / Math.max(a.size(), b.size()));
    }

    /**
     * @param shared number of tokens present in both names
     * @param ratio  shared / max(|A|, |B|)
     */
    public record Overlap(int shared, double ratio) {}
}
