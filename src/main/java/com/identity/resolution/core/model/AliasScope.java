package com.identity.resolution.core.model;

/**
 * Namespace of an alias. Name aliases and reference-number aliases never collide.
 */
public enum AliasScope {
    NAME("name"),
    REFERENCE_NUMBER("reference_number");

    private final String code;

    AliasScope(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
