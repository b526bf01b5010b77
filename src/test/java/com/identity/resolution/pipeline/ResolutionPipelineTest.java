package com.identity.resolution.pipeline;

import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.audit.AuditService;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchResult;
import com.identity.resolution.core.model.MatchStrategy;
import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.core.model.UnresolvedReason;
import com.identity.resolution.dedup.DedupWriter;
import com.identity.resolution.dedup.InMemoryDerivedRecordRepository;
import com.identity.resolution.match.Matcher;
import com.identity.resolution.match.MatcherConfig;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.rules.DefaultNormalizationRules;
import com.identity.resolution.similarity.DefaultBlockingKeyStrategy;
import com.identity.resolution.similarity.SimilarityAlgorithm;
import com.identity.resolution.store.AliasKeys;
import com.identity.resolution.store.InMemoryCanonicalStore;
import com.identity.resolution.store.RetryPolicy;
import com.identity.resolution.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionPipelineTest {

    private AliasKeys keys;
    private InMemoryCanonicalStore store;
    private AuditService audit;
    private CanonicalEntity waHealth;
    private CanonicalEntity imaging;

    @BeforeEach
    void setUp() {
        keys = new AliasKeys(DefaultNormalizationRules.createDefaultNormalizer(), new DefaultBlockingKeyStrategy());
        store = new InMemoryCanonicalStore(keys, Clock.systemUTC());
        audit = new AuditService();
        waHealth = store.createEntity("Western Australia Department Of Health", EntityType.CLIENT, Map.of());
        imaging = store.createEntity("Gippsland Health Alliance - Imaging Upgrade", EntityType.OPPORTUNITY, Map.of());
        store.insertAlias("wa health", waHealth.getId(), AliasScope.NAME);
    }

    private ResolutionPipeline pipeline(PipelineOptions options) {
        return ResolutionPipeline.builder(store, keys).options(options).auditService(audit).build();
    }

    private static PipelineOptions.Builder options() {
        return PipelineOptions.builder().workerThreads(4).retryPolicy(RetryPolicy.noRetry());
    }

    @Test
    @DisplayName("A run reports matched and unresolved records")
    void testRunReport() {
        RunReport report = pipeline(options().build()).run("run-1", List.of(
                SourceRecord.of("crm-1", "crm", "WA Health"),
                SourceRecord.of("crm-2", "crm", "GHA Imaging Upgrade"),
                SourceRecord.of("crm-3", "crm", ""),
                SourceRecord.of("crm-4", "crm", "Zebra Logistics")));

        assertEquals(4, report.processed());
        assertEquals(2, report.matched());
        assertEquals(1, report.unresolvedCount(UnresolvedReason.INVALID_INPUT));
        assertEquals(1, report.unresolvedCount(UnresolvedReason.NO_MATCH));
        assertEquals(0, report.deferred());
        assertFalse(report.hasFailures());

        MatchResult exact = store.findMatchResult("crm-1", "run-1").orElseThrow();
        assertEquals(MatchStrategy.EXACT_NAME, exact.strategy());
        assertEquals("run-1", exact.runId());
        assertEquals(2, store.findPendingUnresolved().size());
    }

    @Nested
    @DisplayName("Alias write-back")
    class AutoAliasTests {

        @Test
        @DisplayName("High-confidence keyword matches become aliases for the next run")
        void testKeywordWriteBack() {
            ResolutionPipeline pipeline = pipeline(options().build());
            SourceRecord record = SourceRecord.of("crm-2", "crm", "GHA Imaging Upgrade");

            RunReport first = pipeline.run("run-1", List.of(record));
            assertEquals(1, first.autoAliased());
            assertEquals(MatchStrategy.KEYWORD, store.findMatchResult("crm-2", "run-1").orElseThrow().strategy());
            assertEquals(AliasSource.AUTO, store.findAliases(imaging.getId()).get(0).getSource());
            assertEquals(1, audit.getEntriesByAction(AuditAction.ALIAS_CREATED).size());

            RunReport second = pipeline.run("run-2", List.of(record));
            assertEquals(0, second.autoAliased());
            MatchResult rerun = store.findMatchResult("crm-2", "run-2").orElseThrow();
            assertEquals(MatchStrategy.EXACT_NAME, rerun.strategy());
            assertEquals(imaging.getId(), rerun.canonicalId());
        }

        @Test
        @DisplayName("Matches below the threshold are not written back")
        void testBelowThreshold() {
            ResolutionPipeline pipeline = pipeline(options().autoAliasThreshold(1.0).build());

            pipeline.run("run-1", List.of(
                    SourceRecord.of("crm-5", "crm", "Western Australia Departmnt Of Health")));

            assertEquals(MatchStrategy.FUZZY, store.findMatchResult("crm-5", "run-1").orElseThrow().strategy());
            assertEquals(1, store.findAliases(waHealth.getId()).size());
        }

        @Test
        @DisplayName("Ambiguous results are queued for review and never aliased")
        void testAmbiguousNotAliased() {
            store.createEntity(CanonicalEntity.builder()
                    .id("client-a").canonicalName("Western Health").type(EntityType.CLIENT).build());
            store.createEntity(CanonicalEntity.builder()
                    .id("client-b").canonicalName("Western Hospital Group").type(EntityType.CLIENT).build());
            SimilarityAlgorithm close = new SimilarityAlgorithm() {
                @Override
                public double compute(String s1, String s2) {
                    return s2.startsWith("western h") ? 0.97 : 0.0;
                }

                @Override
                public String getName() {
                    return "close";
                }
            };
            ResolutionPipeline pipeline = ResolutionPipeline.builder(store, keys)
                    .options(options().build())
                    .matcher(new Matcher(store, keys, MatcherConfig.defaults(), close, new NoOpMetricsService()))
                    .build();

            RunReport report = pipeline.run("run-1", List.of(SourceRecord.of("crm-6", "crm", "Western Health Group")));

            assertEquals(1, report.unresolvedCount(UnresolvedReason.AMBIGUOUS));
            assertEquals(0, report.autoAliased());
            assertEquals("client-a", store.findUnresolved("crm-6").orElseThrow().getCandidateId());
            assertTrue(store.findAliases("client-a").isEmpty());
            assertTrue(store.resolveAlias("Western Health Group", AliasScope.NAME).isEmpty());

            MatchResult stored = store.findMatchResult("crm-6", "run-1").orElseThrow();
            assertNull(stored.canonicalId());
            assertEquals("client-a", stored.candidateId());
            assertTrue(store.findMatchResultsByCanonical("client-a").isEmpty());
        }
    }

    @Test
    @DisplayName("Re-running the same run id changes nothing")
    void testIdempotentRerun() {
        ResolutionPipeline pipeline = pipeline(options().build());
        List<SourceRecord> records = List.of(
                SourceRecord.of("crm-1", "crm", "WA Health"),
                SourceRecord.of("crm-4", "crm", "Zebra Logistics"));

        pipeline.run("run-1", records);
        pipeline.run("run-1", records);

        assertEquals(2, store.status().matchResults());
        assertEquals(1, store.findUnresolved("crm-4").orElseThrow().getOccurrences());
    }

    @Test
    @DisplayName("A record matched in a later run leaves the review queue")
    void testLaterMatchClearsUnresolved() {
        ResolutionPipeline pipeline = pipeline(options().build());
        SourceRecord record = SourceRecord.of("crm-4", "crm", "Zebra Logistics");

        pipeline.run("run-1", List.of(record));
        CanonicalEntity zebra = store.createEntity("Zebra Logistics", EntityType.CLIENT, Map.of());
        pipeline.run("run-2", List.of(record));

        assertTrue(store.findPendingUnresolved().isEmpty());
        assertEquals(zebra.getId(), store.findUnresolved("crm-4").orElseThrow().getResolvedCanonicalId());
    }

    @Nested
    @DisplayName("Auto-creation")
    class AutoCreateTests {

        @Test
        @DisplayName("Unmatched records create a canonical entity when enabled")
        void testAutoCreate() {
            ResolutionPipeline pipeline = pipeline(options().autoCreateCanonical(true).build());
            SourceRecord record = new SourceRecord("crm-7", "crm", "  Zebra Logistics ", null,
                    Map.of("entity_type", "opportunity"));

            RunReport report = pipeline.run("run-1", List.of(record));

            assertEquals(1, report.autoCreated());
            MatchResult result = store.findMatchResult("crm-7", "run-1").orElseThrow();
            assertEquals(MatchStrategy.AUTO_CREATED, result.strategy());
            assertEquals(1.0, result.confidence());
            CanonicalEntity created = store.findEntity(result.canonicalId()).orElseThrow();
            assertEquals("Zebra Logistics", created.getCanonicalName());
            assertEquals(EntityType.OPPORTUNITY, created.getType());
            assertEquals(1, audit.getEntriesByAction(AuditAction.ENTITY_AUTO_CREATED).size());
        }

        @Test
        @DisplayName("Concurrent records with the same new name create one entity")
        void testSingleCreation() {
            ResolutionPipeline pipeline = pipeline(options().autoCreateCanonical(true).build());
            List<SourceRecord> records = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                records.add(SourceRecord.of("crm-" + i, "crm", "Zebra Logistics"));
            }

            RunReport report = pipeline.run("run-1", records);

            assertEquals(1, report.autoCreated());
            assertEquals(20, report.matched());
            assertEquals(1, store.findActiveEntities(EntityType.CLIENT).stream()
                    .filter(e -> e.getCanonicalName().equals("Zebra Logistics")).count());
        }

        @Test
        @DisplayName("Auto-creation is off by default")
        void testDisabledByDefault() {
            RunReport report = pipeline(options().build())
                    .run("run-1", List.of(SourceRecord.of("crm-7", "crm", "Zebra Logistics")));

            assertEquals(0, report.autoCreated());
            assertEquals(1, report.unresolvedCount(UnresolvedReason.NO_MATCH));
        }
    }

    @Test
    @DisplayName("A store failure on one record does not stop the run")
    void testFailureContinues() {
        InMemoryCanonicalStore failing = new InMemoryCanonicalStore(keys, Clock.systemUTC()) {
            @Override
            public void upsertMatchResult(MatchResult result) {
                if (result.sourceId().equals("bad")) {
                    throw new StoreException("disk full");
                }
                super.upsertMatchResult(result);
            }
        };
        ResolutionPipeline pipeline = ResolutionPipeline.builder(failing, keys).options(options().build()).build();

        RunReport report = pipeline.run("run-1", List.of(
                SourceRecord.of("good-1", "crm", "Acme"),
                SourceRecord.of("bad", "crm", "Acme"),
                SourceRecord.of("good-2", "crm", "Acme")));

        assertEquals(3, report.processed());
        assertEquals(1, report.failures().size());
        assertEquals("bad", report.failures().get(0).sourceId());
        assertTrue(failing.findMatchResult("good-1", "run-1").isPresent());
        assertTrue(failing.findMatchResult("good-2", "run-1").isPresent());
    }

    @Test
    @DisplayName("Records left when the batch times out are deferred")
    void testTimeoutDefers() {
        InMemoryCanonicalStore slow = new InMemoryCanonicalStore(keys, Clock.systemUTC()) {
            @Override
            public void upsertMatchResult(MatchResult result) {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.upsertMatchResult(result);
            }
        };
        ResolutionPipeline pipeline = ResolutionPipeline.builder(slow, keys)
                .options(options().workerThreads(1).batchTimeout(Duration.ofMillis(50)).build())
                .build();
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            records.add(SourceRecord.of("crm-" + i, "crm", "Acme"));
        }

        RunReport report = pipeline.run("run-1", records);

        assertEquals(5, report.processed() + report.deferred());
        assertTrue(report.deferred() >= 4);
    }

    @Test
    @DisplayName("Records with no counterpart are written to the target system once")
    void testDerivedRecordsDeduplicated() {
        InMemoryDerivedRecordRepository derived = new InMemoryDerivedRecordRepository();
        ResolutionPipeline pipeline = ResolutionPipeline.builder(store, keys)
                .options(options().derivedTargetSystem("erp").build())
                .dedupWriter(new DedupWriter(derived, keys.getNormalizer()))
                .build();
        SourceRecord record = SourceRecord.of("crm-8", "crm", "Zebra Logistics", "CS12345678");

        RunReport first = pipeline.run("run-1", List.of(record));
        RunReport second = pipeline.run("run-2", List.of(record));

        assertEquals(1, first.derivedInserted());
        assertEquals(0, second.derivedInserted());
        assertEquals(1, derived.count("erp"));
    }

    @Test
    @DisplayName("Single records can be processed outside a run")
    void testProcessSingle() {
        MatchResult result = pipeline(options().build()).process("run-9", SourceRecord.of("crm-1", "crm", "WA Health"));

        assertTrue(result.isMatched());
        assertEquals("run-9", result.runId());
        assertTrue(store.findMatchResult("crm-1", "run-9").isPresent());
    }

    @Test
    @DisplayName("Invalid options are rejected")
    void testOptionsValidation() {
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().workerThreads(0).build());
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().autoAliasThreshold(1.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> PipelineOptions.builder().batchTimeout(Duration.ZERO).build());
    }
}
