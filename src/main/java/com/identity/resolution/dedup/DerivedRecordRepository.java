package com.identity.resolution.dedup;

import java.util.List;
import java.util.Optional;

/**
 * Storage of derived records in a target system.
 */
public interface DerivedRecordRepository {

    Optional<DerivedRecord> findByReferenceNumber(String targetSystem, String referenceNumber);

    Optional<DerivedRecord> findByNormalizedName(String targetSystem, String normalizedName);

    /**
     * Inserts unless a record with the same target system and natural key exists.
     *
     * @return true if inserted
     */
    boolean insertIfAbsent(DerivedRecord record);

    List<DerivedRecord> findAll(String targetSystem);

    long count(String targetSystem);
}
