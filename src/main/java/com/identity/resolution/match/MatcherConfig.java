package com.identity.resolution.match;

/**
 * Thresholds of the matcher cascade.
 */
public class MatcherConfig {

    private static final double DEFAULT_FUZZY_THRESHOLD = 0.85;
    private static final double DEFAULT_OVERLAP_THRESHOLD = 0.6;
    private static final double DEFAULT_AMBIGUITY_MARGIN = 0.03;
    private static final int DEFAULT_MIN_SHARED_TOKENS = 2;
    private static final int DEFAULT_MIN_TOKEN_LENGTH = 4;

    private final double fuzzyThreshold;
    private final double overlapThreshold;
    private final double ambiguityMargin;
    private final int minSharedTokens;
    private final int minTokenLength;

    private MatcherConfig(Builder builder) {
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.overlapThreshold = builder.overlapThreshold;
        this.ambiguityMargin = builder.ambiguityMargin;
        this.minSharedTokens = builder.minSharedTokens;
        this.minTokenLength = builder.minTokenLength;
    }

    /**
     * Minimum edit-distance similarity for a fuzzy hit (inclusive).
     */
    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    /**
     * Token overlap ratio a keyword hit must exceed (exclusive).
     */
    public double getOverlapThreshold() {
        return overlapThreshold;
    }

    /**
     * Top two candidates closer than this are ambiguous.
     */
    public double getAmbiguityMargin() {
        return ambiguityMargin;
    }

    public int getMinSharedTokens() {
        return minSharedTokens;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    public static MatcherConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MatcherConfig{fuzzyThreshold=" + fuzzyThreshold +
                ", overlapThreshold=" + overlapThreshold +
                ", ambiguityMargin=" + ambiguityMargin +
                ", minSharedTokens=" + minSharedTokens +
                ", minTokenLength=" + minTokenLength + '}';
    }

    public static class Builder {
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private double overlapThreshold = DEFAULT_OVERLAP_THRESHOLD;
        private double ambiguityMargin = DEFAULT_AMBIGUITY_MARGIN;
        private int minSharedTokens = DEFAULT_MIN_SHARED_TOKENS;
        private int minTokenLength = DEFAULT_MIN_TOKEN_LENGTH;

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            validateThreshold(fuzzyThreshold, "fuzzyThreshold");
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder overlapThreshold(double overlapThreshold) {
            validateThreshold(overlapThreshold, "overlapThreshold");
            this.overlapThreshold = overlapThreshold;
            return this;
        }

        public Builder ambiguityMargin(double ambiguityMargin) {
            validateThreshold(ambiguityMargin, "ambiguityMargin");
            this.ambiguityMargin = ambiguityMargin;
            return this;
        }

        public Builder minSharedTokens(int minSharedTokens) {
            if (minSharedTokens < 1) {
                throw new IllegalArgumentException("minSharedTokens must be >= 1");
            }
            this.minSharedTokens = minSharedTokens;
            return this;
        }

        public Builder minTokenLength(int minTokenLength) {
            if (minTokenLength < 1) {
                throw new IllegalArgumentException("minTokenLength must be >= 1");
            }
            this.minTokenLength = minTokenLength;
            return this;
        }

        public MatcherConfig build() {
            return new MatcherConfig(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
