package com.identity.resolution.store;

import com.identity.resolution.core.model.Alias;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.core.model.EntityStatus;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchResult;
import com.identity.resolution.core.model.MatchStrategy;
import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.core.model.UnresolvedReason;
import com.identity.resolution.core.model.UnresolvedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCanonicalStoreTest {

    private InMemoryCanonicalStore store;
    private CanonicalEntity waHealth;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
        waHealth = store.createEntity("Western Australia Department Of Health", EntityType.CLIENT, Map.of());
    }

    @Nested
    @DisplayName("Entities")
    class EntityTests {

        @Test
        @DisplayName("Creating with a known id is idempotent")
        void testCreateWithIdIdempotent() {
            CanonicalEntity seeded = CanonicalEntity.builder()
                    .id("client-barwon").canonicalName("Barwon Health").type(EntityType.CLIENT).build();
            store.createEntity(seeded);
            CanonicalEntity again = store.createEntity(CanonicalEntity.builder()
                    .id("client-barwon").canonicalName("Other Name").type(EntityType.CLIENT).build());

            assertEquals("Barwon Health", again.getCanonicalName());
            assertEquals(2, store.findActiveEntities(EntityType.CLIENT).size());
        }

        @Test
        @DisplayName("Retired ids are never reused")
        void testRetiredIdNotReused() {
            store.retireEntity(waHealth.getId());
            assertThrows(IllegalStateException.class, () -> store.createEntity(CanonicalEntity.builder()
                    .id(waHealth.getId()).canonicalName("Anything").type(EntityType.CLIENT).build()));
        }

        @Test
        @DisplayName("A name aliased to another entity cannot be created or renamed to")
        void testNameTakenByAlias() {
            store.insertAlias("WA Health", waHealth.getId(), AliasScope.NAME);
            CanonicalEntity other = store.createEntity("Western Health", EntityType.CLIENT, Map.of());

            DuplicateAliasException created = assertThrows(DuplicateAliasException.class,
                    () -> store.createEntity("WA Health", EntityType.CLIENT, Map.of()));
            assertEquals(waHealth.getId(), created.getExistingCanonicalId());
            assertThrows(DuplicateAliasException.class, () -> store.createEntity(CanonicalEntity.builder()
                    .id("client-wa").canonicalName("wa  health").type(EntityType.CLIENT).build()));
            assertThrows(DuplicateAliasException.class, () -> store.renameEntity(other.getId(), "W.A. Health"));

            assertEquals("Western Health", store.findEntity(other.getId()).orElseThrow().getCanonicalName());
            assertTrue(store.findEntity("client-wa").isEmpty());
            assertEquals(2, store.findActiveEntities(EntityType.CLIENT).size());
            assertEquals("WA Health", store.renameEntity(waHealth.getId(), "WA Health").getCanonicalName());
        }

        @Test
        @DisplayName("A canonical name shared by two entities resolves to neither")
        void testSharedCanonicalName() {
            store.createEntity(CanonicalEntity.builder()
                    .id("client-b").canonicalName("Western Health").type(EntityType.CLIENT).build());
            store.createEntity(CanonicalEntity.builder()
                    .id("client-a").canonicalName("WESTERN HEALTH").type(EntityType.CLIENT).build());

            assertTrue(store.resolveAlias("western health", AliasScope.NAME).isEmpty());
            assertEquals(List.of("client-a", "client-b"), store.findNameOwners("Western  Health"));

            store.retireEntity("client-a");
            assertEquals(Optional.of("client-b"), store.resolveAlias("western health", AliasScope.NAME));
            assertEquals(List.of("client-b"), store.findNameOwners("western health"));
        }

        @Test
        @DisplayName("Rename keeps the id and moves the self-alias")
        void testRename() {
            CanonicalEntity renamed = store.renameEntity(waHealth.getId(), "WA Department of Health");

            assertEquals(waHealth.getId(), renamed.getId());
            assertEquals(Optional.of(waHealth.getId()), store.resolveAlias("wa department of health", AliasScope.NAME));
            assertTrue(store.resolveAlias("Western Australia Department Of Health", AliasScope.NAME).isEmpty());
        }

        @Test
        @DisplayName("Unknown or retired entities cannot be renamed")
        void testRenameUnknown() {
            assertThrows(EntityNotFoundException.class, () -> store.renameEntity("nope", "X"));
            store.retireEntity(waHealth.getId());
            assertThrows(EntityNotFoundException.class, () -> store.renameEntity(waHealth.getId(), "X"));
        }
    }

    @Nested
    @DisplayName("Alias registry")
    class AliasTests {

        @Test
        @DisplayName("Exact alias resolves through normalization")
        void testResolveAlias() {
            store.insertAlias("wa health", waHealth.getId(), AliasScope.NAME);

            assertEquals(Optional.of(waHealth.getId()), store.resolveAlias("  WA  Health ", AliasScope.NAME));
        }

        @Test
        @DisplayName("Canonical names resolve as self-aliases")
        void testSelfAlias() {
            assertEquals(Optional.of(waHealth.getId()),
                    store.resolveAlias("western australia department of health", AliasScope.NAME));
        }

        @Test
        @DisplayName("Name and reference-number scopes never collide")
        void testScopesSeparate() {
            store.insertAlias("Q-1001", waHealth.getId(), AliasScope.REFERENCE_NUMBER);

            assertEquals(Optional.of(waHealth.getId()), store.resolveAlias(" q-1001 ", AliasScope.REFERENCE_NUMBER));
            assertTrue(store.resolveAlias("Q-1001", AliasScope.NAME).isEmpty());
        }

        @Test
        @DisplayName("Re-inserting the same mapping is a no-op")
        void testInsertIdempotent() {
            Alias first = store.insertAlias("WA Health", waHealth.getId(), AliasScope.NAME);
            Alias second = store.insertAlias("wa health", waHealth.getId(), AliasScope.NAME);

            assertEquals(first, second);
            assertEquals(1, store.findAliases(waHealth.getId()).size());
        }

        @Test
        @DisplayName("Mapping the same text to another entity fails")
        void testDuplicateAlias() {
            CanonicalEntity other = store.createEntity("Western Health", EntityType.CLIENT, Map.of());
            store.insertAlias("WA Health", waHealth.getId(), AliasScope.NAME);

            DuplicateAliasException e = assertThrows(DuplicateAliasException.class,
                    () -> store.insertAlias("wa health", other.getId(), AliasScope.NAME));
            assertEquals(waHealth.getId(), e.getExistingCanonicalId());
            assertEquals(other.getId(), e.getRequestedCanonicalId());
            assertEquals(Optional.of(waHealth.getId()), store.resolveAlias("wa health", AliasScope.NAME));
        }

        @Test
        @DisplayName("An alias cannot shadow another entity's canonical name")
        void testAliasShadowingCanonicalName() {
            CanonicalEntity other = store.createEntity("Western Health", EntityType.CLIENT, Map.of());

            assertThrows(DuplicateAliasException.class,
                    () -> store.insertAlias("western health", waHealth.getId(), AliasScope.NAME));
            assertEquals(Optional.of(other.getId()), store.resolveAlias("western health", AliasScope.NAME));
        }

        @Test
        @DisplayName("Aliases of unknown entities are rejected")
        void testAliasUnknownEntity() {
            assertThrows(EntityNotFoundException.class,
                    () -> store.insertAlias("x y z", "missing", AliasScope.NAME));
        }

        @Test
        @DisplayName("Deactivated aliases stop resolving and free the text")
        void testDeactivate() {
            CanonicalEntity other = store.createEntity("Western Health", EntityType.CLIENT, Map.of());
            store.insertAlias("WA Health", waHealth.getId(), AliasScope.NAME);

            assertTrue(store.deactivateAlias("wa health", AliasScope.NAME));
            assertFalse(store.deactivateAlias("wa health", AliasScope.NAME));
            assertTrue(store.resolveAlias("wa health", AliasScope.NAME).isEmpty());

            store.insertAlias("WA Health", other.getId(), AliasScope.NAME);
            assertEquals(Optional.of(other.getId()), store.resolveAlias("wa health", AliasScope.NAME));
        }

        @Test
        @DisplayName("Two concurrent inserts of the same new text cannot both succeed")
        void testConcurrentInsert() throws Exception {
            CanonicalEntity other = store.createEntity("Western Health", EntityType.CLIENT, Map.of());
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                List<Callable<Boolean>> tasks = new ArrayList<>();
                for (String id : List.of(waHealth.getId(), other.getId())) {
                    tasks.add(() -> {
                        start.await();
                        try {
                            store.insertAlias("WH Group", id, AliasScope.NAME);
                            return true;
                        } catch (DuplicateAliasException e) {
                            return false;
                        }
                    });
                }
                List<Future<Boolean>> futures = new ArrayList<>();
                for (Callable<Boolean> task : tasks) {
                    futures.add(executor.submit(task));
                }
                start.countDown();
                int successes = 0;
                for (Future<Boolean> f : futures) {
                    successes += f.get() ? 1 : 0;
                }
                assertEquals(1, successes);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Candidates are found through shared blocking keys")
        void testFindCandidates() {
            CanonicalEntity gha = store.createEntity("Gippsland Health Alliance - Imaging Upgrade",
                    EntityType.OPPORTUNITY, Map.of());

            Collection<AliasCandidate> candidates = store.findCandidates(Set.of("tok:imaging"));

            assertEquals(1, candidates.size());
            AliasCandidate candidate = candidates.iterator().next();
            assertEquals(gha.getId(), candidate.canonicalId());
            assertEquals("gippsland health alliance imaging upgrade", candidate.normalizedText());
        }
    }

    @Nested
    @DisplayName("Merge")
    class MergeTests {

        private CanonicalEntity duplicate;

        @BeforeEach
        void setUpDuplicate() {
            duplicate = store.createEntity("Dept of Health WA", EntityType.CLIENT, Map.of());
            store.insertAlias("WA Health", duplicate.getId(), AliasScope.NAME);
            store.insertAlias("Q-1001", duplicate.getId(), AliasScope.REFERENCE_NUMBER);
            store.upsertMatchResult(MatchResult.matched("crm-1", duplicate.getId(), MatchStrategy.EXACT_NAME,
                    0.95, "exact_name", "wa health").withRunId("run-1"));
        }

        @Test
        @DisplayName("Every alias and result of the loser resolves to the winner")
        void testMergeRepoints() {
            MergeSummary summary = store.merge(waHealth.getId(), duplicate.getId());

            assertEquals(2, summary.aliasesRepointed());
            assertEquals(1, summary.matchResultsRepointed());
            assertTrue(summary.formerNameAliased());
            assertEquals(Optional.of(waHealth.getId()), store.resolveAlias("wa health", AliasScope.NAME));
            assertEquals(Optional.of(waHealth.getId()), store.resolveAlias("Q-1001", AliasScope.REFERENCE_NUMBER));
            assertEquals(Optional.of(waHealth.getId()), store.resolveAlias("Dept of Health WA", AliasScope.NAME));
            assertEquals(waHealth.getId(), store.findMatchResult("crm-1", "run-1").orElseThrow().canonicalId());
        }

        @Test
        @DisplayName("Ambiguous results follow the merge as candidates only")
        void testAmbiguousResultRepointed() {
            store.upsertMatchResult(MatchResult.ambiguous("crm-3", duplicate.getId(), MatchStrategy.FUZZY,
                    0.9, "wa health dept").withRunId("run-1"));
            assertEquals(1, store.findMatchResultsByCanonical(duplicate.getId()).size());

            MergeSummary summary = store.merge(waHealth.getId(), duplicate.getId());

            MatchResult ambiguous = store.findMatchResult("crm-3", "run-1").orElseThrow();
            assertEquals(waHealth.getId(), ambiguous.candidateId());
            assertNull(ambiguous.canonicalId());
            assertEquals(1, summary.matchResultsRepointed());
            assertEquals(List.of("crm-1"), store.findMatchResultsByCanonical(waHealth.getId()).stream()
                    .map(MatchResult::sourceId).toList());
        }

        @Test
        @DisplayName("The loser is retired into the winner")
        void testLoserRetired() {
            store.merge(waHealth.getId(), duplicate.getId());

            CanonicalEntity loser = store.findEntity(duplicate.getId()).orElseThrow();
            assertEquals(EntityStatus.RETIRED, loser.getStatus());
            assertEquals(waHealth.getId(), loser.getRetiredInto());
            assertTrue(store.findAliases(duplicate.getId()).isEmpty());
            assertTrue(store.checkIntegrity().isEmpty());
        }

        @Test
        @DisplayName("Unresolved candidates follow the winner")
        void testUnresolvedRepointed() {
            store.recordUnresolved(SourceRecord.of("crm-2", "crm", "WA Hlth Dept"),
                    UnresolvedReason.AMBIGUOUS, duplicate.getId(), "run-1");

            MergeSummary summary = store.merge(waHealth.getId(), duplicate.getId());

            assertEquals(1, summary.unresolvedRepointed());
            assertEquals(waHealth.getId(), store.findUnresolved("crm-2").orElseThrow().getCandidateId());
        }

        @Test
        @DisplayName("A conflicting alias aborts the merge with nothing repointed")
        void testMergeConflict() {
            CanonicalEntity twin = store.createEntity("Dept of Health WA", EntityType.CLIENT, Map.of());

            MergeConflictException e = assertThrows(MergeConflictException.class,
                    () -> store.merge(waHealth.getId(), duplicate.getId()));

            assertEquals(List.of("name:dept of health wa"), e.getConflictingAliases());
            assertTrue(store.findEntity(duplicate.getId()).orElseThrow().isActive());
            assertEquals(Optional.of(duplicate.getId()), store.resolveAlias("wa health", AliasScope.NAME));
            assertEquals(duplicate.getId(), store.findMatchResult("crm-1", "run-1").orElseThrow().canonicalId());
            assertEquals(List.of(duplicate.getId(), twin.getId()).stream().sorted().toList(),
                    store.findNameOwners("Dept of Health WA"));
        }

        @Test
        @DisplayName("Invalid merges are rejected")
        void testInvalidMerges() {
            CanonicalEntity opportunity = store.createEntity("Imaging Upgrade", EntityType.OPPORTUNITY, Map.of());

            assertThrows(IllegalArgumentException.class, () -> store.merge(waHealth.getId(), waHealth.getId()));
            assertThrows(IllegalArgumentException.class, () -> store.merge(waHealth.getId(), opportunity.getId()));
            assertThrows(EntityNotFoundException.class, () -> store.merge(waHealth.getId(), "missing"));
        }
    }

    @Nested
    @DisplayName("Integrity")
    class IntegrityTests {

        @Test
        @DisplayName("Aliases of a retired entity are reported and kept")
        void testOrphanedAliases() {
            store.insertAlias("WA Health", waHealth.getId(), AliasScope.NAME);
            store.retireEntity(waHealth.getId());

            Set<Alias> orphaned = store.checkIntegrity();

            assertEquals(1, orphaned.size());
            assertEquals("wa health", orphaned.iterator().next().getLookupKey());
            assertTrue(store.resolveAlias("wa health", AliasScope.NAME).isEmpty());
            assertEquals(1, store.status().activeAliases());
        }
    }

    @Nested
    @DisplayName("Results and unresolved records")
    class ResultTests {

        @Test
        @DisplayName("Match results are keyed by source id and run")
        void testUpsertOverwrites() {
            MatchResult first = MatchResult.unresolved("crm-1", UnresolvedReason.NO_MATCH).withRunId("run-1");
            MatchResult second = MatchResult.matched("crm-1", waHealth.getId(), MatchStrategy.EXACT_NAME,
                    0.95, "exact_name", "wa health").withRunId("run-1");

            store.upsertMatchResult(first);
            store.upsertMatchResult(second);
            store.upsertMatchResult(first.withRunId("run-2"));

            assertEquals(second, store.findMatchResult("crm-1", "run-1").orElseThrow());
            assertEquals(2, store.status().matchResults());
        }

        @Test
        @DisplayName("Occurrences count runs, not re-runs")
        void testOccurrences() {
            SourceRecord record = SourceRecord.of("crm-9", "crm", "Unknown Clinic");
            store.recordUnresolved(record, UnresolvedReason.NO_MATCH, null, "run-1");
            store.recordUnresolved(record, UnresolvedReason.NO_MATCH, null, "run-1");
            UnresolvedRecord seen = store.recordUnresolved(record, UnresolvedReason.NO_MATCH, null, "run-2");

            assertEquals(2, seen.getOccurrences());
            assertEquals("run-2", seen.getLastRunId());
        }

        @Test
        @DisplayName("Cleared records leave the pending list")
        void testClearUnresolved() {
            store.recordUnresolved(SourceRecord.of("crm-9", "crm", "Unknown Clinic"),
                    UnresolvedReason.NO_MATCH, null, "run-1");

            Optional<UnresolvedRecord> cleared = store.clearUnresolved("crm-9", waHealth.getId());

            assertTrue(cleared.orElseThrow().isResolved());
            assertTrue(store.findPendingUnresolved().isEmpty());
            assertTrue(store.clearUnresolved("crm-9", waHealth.getId()).isEmpty());
        }

        @Test
        @DisplayName("Pending records are ordered by occurrences then source id")
        void testPendingOrder() {
            store.recordUnresolved(SourceRecord.of("b", "crm", "B"), UnresolvedReason.NO_MATCH, null, "run-1");
            store.recordUnresolved(SourceRecord.of("a", "crm", "A"), UnresolvedReason.NO_MATCH, null, "run-1");
            store.recordUnresolved(SourceRecord.of("c", "crm", "C"), UnresolvedReason.NO_MATCH, null, "run-1");
            store.recordUnresolved(SourceRecord.of("c", "crm", "C"), UnresolvedReason.NO_MATCH, null, "run-2");

            List<String> order = store.findPendingUnresolved().stream().map(UnresolvedRecord::getSourceId).toList();
            assertEquals(List.of("c", "a", "b"), order);
        }

        @Test
        @DisplayName("Status counts every table")
        void testStatus() {
            store.insertAlias("WA Health", waHealth.getId(), AliasScope.NAME, AliasSource.SEED, 1.0);
            store.recordUnresolved(SourceRecord.of("x", "crm", "X Y"), UnresolvedReason.NO_MATCH, null, "run-1");

            StoreStatus status = store.status();
            assertEquals(1, status.activeEntities());
            assertEquals(0, status.retiredEntities());
            assertEquals(1, status.activeAliases());
            assertEquals(1, status.pendingUnresolved());
        }
    }
}
