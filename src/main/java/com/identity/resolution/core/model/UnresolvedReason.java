package com.identity.resolution.core.model;

/**
 * Why a source record was queued for manual review.
 */
public enum UnresolvedReason {
    NO_MATCH("no_match"),
    AMBIGUOUS("ambiguous"),
    INVALID_INPUT("invalid_input");

    private final String code;

    UnresolvedReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
