package com.identity.resolution.core.model;

/**
 * Matcher strategy that produced a result, in cascade order.
 */
public enum MatchStrategy {
    REFERENCE_NUMBER("reference_number"),
    EXACT_NAME("exact_name"),
    FUZZY("fuzzy"),
    KEYWORD("keyword"),
    /** Canonical entity created by the pipeline because nothing matched. */
    AUTO_CREATED("auto_created"),
    NONE("none");

    private final String code;

    MatchStrategy(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Fuzzy and keyword hits are the only ones eligible for automatic aliasing.
     */
    public boolean isApproximate() {
        return this == FUZZY || this == KEYWORD;
    }
}
