package com.identity.resolution.dedup;

import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DedupWriterTest {

    private InMemoryDerivedRecordRepository repository;
    private DedupWriter writer;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDerivedRecordRepository();
        writer = new DedupWriter(repository, DefaultNormalizationRules.createDefaultNormalizer(),
                Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("The same reference number is written once across runs")
    void testSameReferenceNumber() {
        SourceRecord first = SourceRecord.of("crm-1", "crm", "Imaging Upgrade", "CS12345678");
        SourceRecord renamed = SourceRecord.of("crm-1", "crm", "Imaging Upgrade (revised)", "CS12345678");

        assertEquals(WriteOutcome.INSERTED, writer.write(first, "erp"));
        assertEquals(WriteOutcome.EXISTING, writer.write(renamed, "erp"));
        assertEquals(1, repository.count("erp"));
        assertEquals("ref:CS12345678", repository.findAll("erp").get(0).naturalKey());
    }

    @Test
    @DisplayName("Without a reference number the normalized name is the key")
    void testNameKey() {
        assertEquals(WriteOutcome.INSERTED, writer.write(SourceRecord.of("a", "crm", "Zebra Logistics"), "erp"));
        assertEquals(WriteOutcome.EXISTING, writer.write(SourceRecord.of("b", "crm", "ZEBRA  logistics!"), "erp"));

        DerivedRecord stored = repository.findAll("erp").get(0);
        assertEquals("name:zebra logistics", stored.naturalKey());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), stored.createdAt());
    }

    @Test
    @DisplayName("Target systems are deduplicated independently")
    void testTargetsIndependent() {
        SourceRecord record = SourceRecord.of("a", "crm", "Zebra Logistics");

        assertEquals(WriteOutcome.INSERTED, writer.write(record, "erp"));
        assertEquals(WriteOutcome.INSERTED, writer.write(record, "billing"));
    }

    @Test
    @DisplayName("Records with neither key are skipped")
    void testSkipped() {
        assertEquals(WriteOutcome.SKIPPED, writer.write(SourceRecord.of("a", "crm", "!!!"), "erp"));
        assertEquals(0, repository.count("erp"));
    }
}
