package com.identity.resolution.cdi;

import com.identity.resolution.audit.AuditService;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.MicrometerMetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.pipeline.PipelineOptions;
import com.identity.resolution.pipeline.ResolutionPipeline;
import com.identity.resolution.pipeline.RunReport;
import com.identity.resolution.store.AliasKeys;
import com.identity.resolution.store.CanonicalStore;
import com.identity.resolution.store.InMemoryCanonicalStore;
import com.identity.resolution.tracing.NoOpTracingService;
import com.identity.resolution.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class UnificationProducerTest {

    private UnificationProducer producer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        producer = new UnificationProducer();
        producer.fuzzyThreshold = 0.85;
        producer.overlapThreshold = 0.6;
        producer.ambiguityMargin = 0.03;
        producer.autoAliasThreshold = 0.95;
        producer.autoCreateCanonical = false;
        producer.workerThreads = Optional.of(2);
        producer.derivedTargetSystem = Optional.empty();
        producer.storeBackend = "memory";
        producer.cacheMaxSize = 100;
        producer.cacheTtlSeconds = 60;
        producer.aliasSeed = Optional.of("alias-seed.json");
        producer.meterRegistry = mock(Instance.class);
        producer.openTelemetry = mock(Instance.class);
    }

    @Test
    @DisplayName("Wires a seeded in-memory engine from configuration")
    void testMemoryBackend() {
        AliasKeys keys = producer.aliasKeys();
        MetricsService metrics = producer.metricsService();
        TracingService tracing = producer.tracingService();
        CanonicalStore store = producer.canonicalStore(keys, metrics);
        PipelineOptions options = producer.pipelineOptions();

        assertInstanceOf(InMemoryCanonicalStore.class, store);
        assertInstanceOf(NoOpMetricsService.class, metrics);
        assertInstanceOf(NoOpTracingService.class, tracing);
        assertEquals(2, options.getWorkerThreads());
        assertTrue(store.resolveAlias("WA Health", AliasScope.NAME).isPresent());

        ResolutionPipeline pipeline = producer.resolutionPipeline(store, keys, options, new AuditService(),
                metrics, tracing);
        RunReport report = pipeline.run("run-1", List.of(SourceRecord.of("s1", "crm", "WA Health")));
        assertEquals(1, report.matched());

        producer.closeStore(store);
    }

    @Test
    @DisplayName("Uses Micrometer when a registry is available")
    void testMicrometer() {
        MeterRegistry registry = new SimpleMeterRegistry();
        when(producer.meterRegistry.isResolvable()).thenReturn(true);
        when(producer.meterRegistry.get()).thenReturn(registry);

        assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
    }

    @Test
    @DisplayName("Unknown seed resources fail fast")
    void testMissingSeed() {
        producer.aliasSeed = Optional.of("missing-seed.json");
        AliasKeys keys = producer.aliasKeys();

        assertThrows(UncheckedIOException.class,
                () -> producer.canonicalStore(keys, new NoOpMetricsService()));
    }
}
