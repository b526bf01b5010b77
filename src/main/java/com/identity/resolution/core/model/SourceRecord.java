package com.identity.resolution.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A raw record produced by an external source system (CRM export, spreadsheet, ledger).
 * Read-only input; {@code rawName} may be null or blank, in which case the matcher
 * classifies the record as {@code invalid_input}.
 *
 * @param sourceId        identifier of the record within its source system
 * @param sourceSystem    name of the producing system
 * @param rawName         hand-typed name as found in the source
 * @param referenceNumber optional external reference (quote or agreement number)
 * @param attributes      remaining source columns, passed through untouched
 */
public record SourceRecord(
        String sourceId,
        String sourceSystem,
        String rawName,
        String referenceNumber,
        Map<String, String> attributes
) {
    public SourceRecord {
        Objects.requireNonNull(sourceId, "sourceId is required");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static SourceRecord of(String sourceId, String sourceSystem, String rawName) {
        return new SourceRecord(sourceId, sourceSystem, rawName, null, Map.of());
    }

    public static SourceRecord of(String sourceId, String sourceSystem, String rawName, String referenceNumber) {
        return new SourceRecord(sourceId, sourceSystem, rawName, referenceNumber, Map.of());
    }

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }
}
