package com.identity.resolution.dedup;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDerivedRecordRepository implements DerivedRecordRepository {

    private final Map<String, DerivedRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<DerivedRecord> findByReferenceNumber(String targetSystem, String referenceNumber) {
        String wanted = referenceNumber.toUpperCase(Locale.ROOT);
        return records.values().stream()
                .filter(r -> r.targetSystem().equals(targetSystem))
                .filter(r -> r.referenceNumber() != null && r.referenceNumber().toUpperCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    @Override
    public Optional<DerivedRecord> findByNormalizedName(String targetSystem, String normalizedName) {
        return records.values().stream()
                .filter(r -> r.targetSystem().equals(targetSystem))
                .filter(r -> Objects.equals(r.normalizedName(), normalizedName))
                .findFirst();
    }

    @Override
    public boolean insertIfAbsent(DerivedRecord record) {
        return records.putIfAbsent(record.targetSystem() + "|" + record.naturalKey(), record) == null;
    }

    @Override
    public List<DerivedRecord> findAll(String targetSystem) {
        return records.values().stream()
                .filter(r -> r.targetSystem().equals(targetSystem))
                .sorted(Comparator.comparing(DerivedRecord::naturalKey))
                .toList();
    }

    @Override
    public long count(String targetSystem) {
        return records.values().stream().filter(r -> r.targetSystem().equals(targetSystem)).count();
    }
}
