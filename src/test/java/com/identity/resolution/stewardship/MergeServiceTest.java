package com.identity.resolution.stewardship;

import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.audit.AuditService;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.core.model.EntityStatus;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.metrics.MicrometerMetricsService;
import com.identity.resolution.store.InMemoryCanonicalStore;
import com.identity.resolution.store.MergeConflictException;
import com.identity.resolution.store.RetryPolicy;
import com.identity.resolution.tracing.NoOpTracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MergeServiceTest {

    private InMemoryCanonicalStore store;
    private AuditService audit;
    private SimpleMeterRegistry registry;
    private MergeService service;
    private CanonicalEntity winner;
    private CanonicalEntity loser;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
        audit = new AuditService();
        registry = new SimpleMeterRegistry();
        service = new MergeService(store, audit, new MicrometerMetricsService(registry),
                new NoOpTracingService(), RetryPolicy.noRetry());
        winner = store.createEntity("Barwon Health", EntityType.CLIENT, Map.of());
        loser = store.createEntity("Barwon Health Services", EntityType.CLIENT, Map.of());
        store.insertAlias("University Hospital Geelong", loser.getId(), AliasScope.NAME);
    }

    @Test
    @DisplayName("A successful merge is audited on both entities")
    void testMerge() {
        MergeResult result = service.merge(winner.getId(), loser.getId(), "steward");

        assertTrue(result.isSuccess());
        assertEquals(1, result.summary().aliasesRepointed());
        assertEquals(Optional.of(winner.getId()),
                store.resolveAlias("University Hospital Geelong", AliasScope.NAME));
        assertEquals(Optional.of(winner.getId()), store.resolveAlias("Barwon Health Services", AliasScope.NAME));
        assertEquals(EntityStatus.RETIRED, store.findEntity(loser.getId()).orElseThrow().getStatus());
        assertEquals(1, audit.getEntriesByAction(AuditAction.ENTITY_MERGED).size());
        assertEquals(winner.getId(), audit.getEntriesFor(loser.getId()).get(0).details().get("retiredInto"));
        assertEquals(1.0, registry.find("resolution.entity.merged").tag("entityType", "CLIENT").counter().count());
    }

    @Test
    @DisplayName("Invalid merges are reported as failures, not exceptions")
    void testValidationFailures() {
        CanonicalEntity opportunity = store.createEntity("Imaging Upgrade", EntityType.OPPORTUNITY, Map.of());

        assertTrue(service.merge(winner.getId(), winner.getId(), "steward").isFailure());
        assertTrue(service.merge(winner.getId(), "missing", "steward").isFailure());
        MergeResult typeMismatch = service.merge(winner.getId(), opportunity.getId(), "steward");
        assertTrue(typeMismatch.isFailure());
        assertTrue(typeMismatch.errorMessage().contains("types differ"));

        service.merge(winner.getId(), loser.getId(), "steward");
        assertTrue(service.merge(winner.getId(), loser.getId(), "steward").isFailure());
        assertEquals(1, audit.getEntriesByAction(AuditAction.ENTITY_MERGED).size());
    }

    @Test
    @DisplayName("Conflicting aliases abort the merge")
    void testConflict() {
        store.createEntity("Barwon Health Services", EntityType.CLIENT, Map.of());

        assertThrows(MergeConflictException.class, () -> service.merge(winner.getId(), loser.getId(), "steward"));
        assertTrue(store.findEntity(loser.getId()).orElseThrow().isActive());
        assertEquals(0, audit.getEntriesByAction(AuditAction.ENTITY_MERGED).size());
    }

    @Test
    @DisplayName("Rename and retire are audited")
    void testRenameAndRetire() {
        service.rename(winner.getId(), "Barwon Health Victoria", "steward");
        service.retire(loser.getId(), "steward");

        assertEquals("Barwon Health",
                audit.getEntriesByAction(AuditAction.ENTITY_RENAMED).get(0).details().get("from"));
        assertEquals(1, audit.getEntriesByAction(AuditAction.ENTITY_RETIRED).size());
        assertEquals(1, store.checkIntegrity().size());
    }
}
