package com.identity.resolution.cdi;

import com.identity.resolution.audit.AuditService;
import com.identity.resolution.cache.CacheConfig;
import com.identity.resolution.dedup.DedupWriter;
import com.identity.resolution.dedup.InMemoryDerivedRecordRepository;
import com.identity.resolution.graph.FalkorDBConnection;
import com.identity.resolution.graph.GraphCanonicalStore;
import com.identity.resolution.graph.GraphConnection;
import com.identity.resolution.io.AliasSeedLoader;
import com.identity.resolution.match.MatcherConfig;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.MicrometerMetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.pipeline.PipelineOptions;
import com.identity.resolution.pipeline.ResolutionPipeline;
import com.identity.resolution.rules.DefaultNormalizationRules;
import com.identity.resolution.similarity.DefaultBlockingKeyStrategy;
import com.identity.resolution.stewardship.MergeService;
import com.identity.resolution.stewardship.UnresolvedReviewService;
import com.identity.resolution.store.AliasKeys;
import com.identity.resolution.store.CanonicalStore;
import com.identity.resolution.store.InMemoryCanonicalStore;
import com.identity.resolution.tracing.NoOpTracingService;
import com.identity.resolution.tracing.OpenTelemetryTracingService;
import com.identity.resolution.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the resolution engine from MicroProfile Config properties.
 *
 * <pre>
 * identity-resolution:
 *   store:
 *     backend: falkordb
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: identity-resolution
 *   alias-seed: seed/aliases.json
 * </pre>
 */
@ApplicationScoped
public class UnificationProducer {

    private static final Logger log = LoggerFactory.getLogger(UnificationProducer.class);

    static final String INSTRUMENTATION_NAME = "client-identity-resolution";

    // ── Matcher ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-resolution.matcher.fuzzy-threshold", defaultValue = "0.85")
    double fuzzyThreshold;

    @Inject
    @ConfigProperty(name = "identity-resolution.matcher.overlap-threshold", defaultValue = "0.6")
    double overlapThreshold;

    @Inject
    @ConfigProperty(name = "identity-resolution.matcher.ambiguity-margin", defaultValue = "0.03")
    double ambiguityMargin;

    // ── Pipeline ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-resolution.pipeline.auto-alias-threshold", defaultValue = "0.95")
    double autoAliasThreshold;

    @Inject
    @ConfigProperty(name = "identity-resolution.pipeline.auto-create-canonical", defaultValue = "false")
    boolean autoCreateCanonical;

    @Inject
    @ConfigProperty(name = "identity-resolution.pipeline.worker-threads")
    Optional<Integer> workerThreads;

    @Inject
    @ConfigProperty(name = "identity-resolution.pipeline.derived-target-system")
    Optional<String> derivedTargetSystem;

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-resolution.store.backend", defaultValue = "memory")
    String storeBackend;

    @Inject
    @ConfigProperty(name = "identity-resolution.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "identity-resolution.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "identity-resolution.falkordb.graph-name", defaultValue = "identity-resolution")
    String falkordbGraphName;

    @Inject
    @ConfigProperty(name = "identity-resolution.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "identity-resolution.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    @Inject
    @ConfigProperty(name = "identity-resolution.alias-seed")
    Optional<String> aliasSeed;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<OpenTelemetry> openTelemetry;

    private GraphConnection graphConnection;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public AliasKeys aliasKeys() {
        return new AliasKeys(DefaultNormalizationRules.createDefaultNormalizer(), new DefaultBlockingKeyStrategy());
    }

    /**
     * Micrometer-backed when the application provides a {@link MeterRegistry}.
     */
    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Producing MicrometerMetricsService");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        if (openTelemetry != null && openTelemetry.isResolvable()) {
            log.info("Producing OpenTelemetryTracingService");
            return new OpenTelemetryTracingService(openTelemetry.get().getTracer(INSTRUMENTATION_NAME));
        }
        return new NoOpTracingService();
    }

    @Produces
    @ApplicationScoped
    public CanonicalStore canonicalStore(AliasKeys keys, MetricsService metrics) {
        CanonicalStore store;
        if ("falkordb".equals(storeBackend.toLowerCase(Locale.ROOT))) {
            log.info("Producing GraphCanonicalStore: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
            graphConnection = new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
            graphConnection.createIndexes();
            store = new GraphCanonicalStore(graphConnection, keys,
                    new CacheConfig(cacheMaxSize, cacheTtlSeconds, true).create(),
                    metrics, Clock.systemUTC());
        } else {
            log.info("Producing InMemoryCanonicalStore");
            store = new InMemoryCanonicalStore(keys, Clock.systemUTC());
        }

        if (aliasSeed.isPresent()) {
            try {
                new AliasSeedLoader(store).loadResource(aliasSeed.get());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load alias seed " + aliasSeed.get(), e);
            }
        }
        return store;
    }

    public void closeStore(@Disposes CanonicalStore store) {
        if (graphConnection != null) {
            log.info("Closing graph connection");
            graphConnection.close();
        }
    }

    @Produces
    @ApplicationScoped
    public AuditService auditService() {
        return new AuditService();
    }

    @Produces
    @ApplicationScoped
    public PipelineOptions pipelineOptions() {
        PipelineOptions.Builder builder = PipelineOptions.builder()
                .matcherConfig(MatcherConfig.builder()
                        .fuzzyThreshold(fuzzyThreshold)
                        .overlapThreshold(overlapThreshold)
                        .ambiguityMargin(ambiguityMargin)
                        .build())
                .autoAliasThreshold(autoAliasThreshold)
                .autoCreateCanonical(autoCreateCanonical);
        workerThreads.ifPresent(builder::workerThreads);
        derivedTargetSystem.ifPresent(builder::derivedTargetSystem);
        return builder.build();
    }

    @Produces
    @ApplicationScoped
    public ResolutionPipeline resolutionPipeline(CanonicalStore store, AliasKeys keys, PipelineOptions options,
                                                 AuditService auditService, MetricsService metrics,
                                                 TracingService tracing) {
        log.info("Producing ResolutionPipeline: autoAliasThreshold={} autoCreateCanonical={}",
                options.getAutoAliasThreshold(), options.isAutoCreateCanonical());
        ResolutionPipeline.Builder builder = ResolutionPipeline.builder(store, keys)
                .options(options)
                .auditService(auditService)
                .metricsService(metrics)
                .tracingService(tracing);
        if (options.getDerivedTargetSystem() != null) {
            builder.dedupWriter(new DedupWriter(new InMemoryDerivedRecordRepository(), keys.getNormalizer()));
        }
        return builder.build();
    }

    @Produces
    @ApplicationScoped
    public UnresolvedReviewService unresolvedReviewService(CanonicalStore store, AliasKeys keys,
                                                           AuditService auditService, MetricsService metrics) {
        return new UnresolvedReviewService(store, keys.getNormalizer(), auditService, metrics);
    }

    @Produces
    @ApplicationScoped
    public MergeService mergeService(CanonicalStore store, AuditService auditService,
                                     MetricsService metrics, TracingService tracing, PipelineOptions options) {
        return new MergeService(store, auditService, metrics, tracing, options.getRetryPolicy());
    }
}
