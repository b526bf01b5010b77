package com.identity.resolution.metrics;

import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchOutcome;
import com.identity.resolution.core.model.MatchStrategy;
import com.identity.resolution.core.model.UnresolvedReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}. Needs {@code micrometer-core} on the classpath.
 *
 * <ul>
 *   <li>{@code resolution.match.duration} timer, tags {@code strategy}, {@code outcome}</li>
 *   <li>{@code resolution.alias.created} counter, tag {@code source}</li>
 *   <li>{@code resolution.entity.created} / {@code resolution.entity.merged} counters, tag {@code entityType}</li>
 *   <li>{@code resolution.unresolved} counter, tag {@code reason}</li>
 *   <li>{@code resolution.similarity.score} and {@code resolution.run.records} summaries</li>
 *   <li>{@code resolution.cache.hit} / {@code resolution.cache.miss} counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScores;
    private final DistributionSummary runSizes;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScores = DistributionSummary.builder("resolution.similarity.score")
                .description("Scores of accepted approximate matches")
                .register(registry);
        this.runSizes = DistributionSummary.builder("resolution.run.records")
                .description("Records submitted per pipeline run")
                .register(registry);
        this.cacheHits = Counter.builder("resolution.cache.hit")
                .description("Alias lookups served from cache")
                .register(registry);
        this.cacheMisses = Counter.builder("resolution.cache.miss")
                .description("Alias lookups that went to the store")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(MatchStrategy strategy, MatchOutcome outcome, Duration duration) {
        timers.computeIfAbsent(strategy.getCode() + ":" + outcome.name(), k ->
                Timer.builder("resolution.match.duration")
                        .description("Time spent matching one source record")
                        .tag("strategy", strategy.getCode())
                        .tag("outcome", outcome.name())
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementAliasCreated(AliasSource source) {
        counter("resolution.alias.created", "source", source.name(), "Aliases added to the registry")
                .increment();
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
        counter("resolution.entity.created", "entityType", type.name(), "Canonical entities created")
                .increment();
    }

    @Override
    public void incrementEntityMerged(EntityType type) {
        counter("resolution.entity.merged", "entityType", type.name(), "Canonical entities merged away")
                .increment();
    }

    @Override
    public void incrementUnresolved(UnresolvedReason reason) {
        counter("resolution.unresolved", "reason", reason.getCode(), "Records left for stewardship")
                .increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScores.record(score);
    }

    @Override
    public void recordRunSize(int records) {
        runSizes.record(records);
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    private Counter counter(String name, String tag, String value, String description) {
        return counters.computeIfAbsent(name + ":" + value, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}
