package com.identity.resolution.core.model;

import java.util.Locale;

/**
 * Kinds of canonical entities that source records are resolved against.
 */
public enum EntityType {
    CLIENT("Client"),
    OPPORTUNITY("Opportunity");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a type name case-insensitively, e.g. {@code "client"} or {@code "OPPORTUNITY"}.
     *
     * @throws IllegalArgumentException if the value is not a known type
     */
    public static EntityType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity type must not be blank");
        }
        return EntityType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
