package com.identity.resolution.dedup;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A record written into a target system on behalf of a source record that has no
 * counterpart there, e.g. an opportunity present in the CRM but missing from the ledger.
 *
 * @param targetSystem    system the record is written to
 * @param naturalKey      strongest available key: reference number, else normalized name
 * @param referenceNumber cleaned reference number, may be null
 * @param normalizedName  normalized source name, may be empty when a reference number exists
 * @param name            source name as found
 * @param sourceId        originating source record
 * @param sourceSystem    originating system
 * @param attributes      source attributes carried over
 * @param createdAt       insertion time
 */
public record DerivedRecord(
        String targetSystem,
        String naturalKey,
        String referenceNumber,
        String normalizedName,
        String name,
        String sourceId,
        String sourceSystem,
        Map<String, String> attributes,
        Instant createdAt
) {
    public DerivedRecord {
        Objects.requireNonNull(targetSystem, "targetSystem is required");
        Objects.requireNonNull(naturalKey, "naturalKey is required");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    static String naturalKey(String referenceNumber, String normalizedName) {
        if (referenceNumber != null) {
            return "ref:" + referenceNumber.toUpperCase(Locale.ROOT);
        }
        return "name:" + normalizedName;
    }
}
