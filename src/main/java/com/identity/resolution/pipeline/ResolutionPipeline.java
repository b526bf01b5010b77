package com.identity.resolution.pipeline;

import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.audit.AuditService;
import com.identity.resolution.core.ResolutionException;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchResult;
import com.identity.resolution.core.model.MatchStrategy;
import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.core.model.UnresolvedReason;
import com.identity.resolution.dedup.DedupWriter;
import com.identity.resolution.dedup.WriteOutcome;
import com.identity.resolution.lock.DistributedLock;
import com.identity.resolution.lock.LocalDistributedLock;
import com.identity.resolution.logging.LogContext;
import com.identity.resolution.match.Matcher;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.similarity.LevenshteinSimilarity;
import com.identity.resolution.store.AliasKeys;
import com.identity.resolution.store.CanonicalStore;
import com.identity.resolution.store.DuplicateAliasException;
import com.identity.resolution.store.StoreRetrier;
import com.identity.resolution.tracing.NoOpTracingService;
import com.identity.resolution.tracing.Span;
import com.identity.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch entry point. For every source record of a run: match, persist the result under
 * {@code (sourceId, runId)}, then create or clear the record's unresolved entry.
 *
 * <p>High-confidence fuzzy and keyword matches are written back as aliases so later
 * runs resolve them on the exact-name path. Ambiguous results never are.</p>
 *
 * <p>Records are processed by a fixed worker pool. A store failure on one record is
 * logged and reported, and the run goes on. When the batch timeout expires workers
 * stop taking records; the remainder is reported as deferred.</p>
 */
public class ResolutionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPipeline.class);

    static final String ENTITY_TYPE_ATTRIBUTE = "entity_type";

    private final CanonicalStore store;
    private final AliasKeys keys;
    private final PipelineOptions options;
    private final Matcher matcher;
    private final StoreRetrier retrier;
    private final DistributedLock creationLock;
    private final DedupWriter dedupWriter;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private ResolutionPipeline(Builder builder) {
        this.store = builder.store;
        this.keys = builder.keys;
        this.options = builder.options;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.auditService = builder.auditService;
        this.creationLock = builder.creationLock;
        this.dedupWriter = builder.dedupWriter;
        this.matcher = builder.matcher != null
                ? builder.matcher
                : new Matcher(store, keys, options.getMatcherConfig(), new LevenshteinSimilarity(), metricsService);
        this.retrier = new StoreRetrier(options.getRetryPolicy());
    }

    public RunReport run(String runId, Iterable<SourceRecord> records) {
        Objects.requireNonNull(runId, "runId is required");
        Queue<SourceRecord> queue = new ConcurrentLinkedQueue<>();
        records.forEach(queue::add);
        int total = queue.size();

        long start = System.nanoTime();
        long deadline = options.getBatchTimeout() != null
                ? start + options.getBatchTimeout().toNanos()
                : Long.MAX_VALUE;
        Tally tally = new Tally();

        try (LogContext ctx = LogContext.forRun(runId);
             Span span = tracingService.startSpan(TracingService.RUN_SPAN, Map.of("runId", runId))) {
            log.info("pipeline.started runId={} records={} workers={}", runId, total, options.getWorkerThreads());
            span.setAttribute("records", total);

            int workers = Math.max(1, Math.min(options.getWorkerThreads(), total));
            ExecutorService executor = Executors.newFixedThreadPool(workers);
            try {
                for (int i = 0; i < workers; i++) {
                    executor.execute(() -> drain(runId, queue, deadline, tally));
                }
                executor.shutdown();
                awaitWorkers(executor);
            } finally {
                executor.shutdownNow();
            }

            RunReport report = tally.toReport(runId, queue.size(), Duration.ofNanos(System.nanoTime() - start));
            metricsService.recordRunSize(report.processed());
            span.setAttribute("matched", report.matched());
            span.setAttribute("unresolved", report.totalUnresolved());
            span.setAttribute("failures", report.failures().size());
            span.setStatus(report.hasFailures() ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);

            if (report.deferred() > 0) {
                log.warn("pipeline.timeout runId={} deferred={}", runId, report.deferred());
            }
            log.info("pipeline.completed runId={} processed={} matched={} unresolved={} autoAliased={} "
                            + "autoCreated={} failures={} deferred={} durationMs={}",
                    runId, report.processed(), report.matched(), report.unresolved(), report.autoAliased(),
                    report.autoCreated(), report.failures().size(), report.deferred(),
                    report.duration().toMillis());
            return report;
        }
    }

    /**
     * Matches and persists one record outside of a run's worker pool.
     */
    public MatchResult process(String runId, SourceRecord record) {
        Tally tally = new Tally();
        return processRecord(runId, record, tally);
    }

    private void drain(String runId, Queue<SourceRecord> queue, long deadline, Tally tally) {
        while (System.nanoTime() < deadline && !Thread.currentThread().isInterrupted()) {
            SourceRecord record = queue.poll();
            if (record == null) {
                return;
            }
            try {
                processRecord(runId, record, tally);
            } catch (RuntimeException e) {
                log.error("pipeline.record.crashed runId={} sourceId={}", runId, record.sourceId(), e);
                tally.fail(record.sourceId(), e);
            }
        }
    }

    private void awaitWorkers(ExecutorService executor) {
        // workers stop taking records at the deadline; records already taken are finished
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.debug("pipeline.waiting for in-flight records");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("pipeline.interrupted remaining records deferred");
        }
    }

    private MatchResult processRecord(String runId, SourceRecord record, Tally tally) {
        try (LogContext ctx = LogContext.forRecord(runId, record.sourceId())) {
            tally.processed.incrementAndGet();
            MatchResult result = matcher.match(record).withRunId(runId);
            try {
                if (isAutoAliasCandidate(result)) {
                    result = autoAlias(record, result, tally);
                }
                if (options.isAutoCreateCanonical()
                        && result.unresolvedReason().orElse(null) == UnresolvedReason.NO_MATCH) {
                    result = autoCreate(runId, record, result, tally);
                }

                MatchResult persisted = result;
                retrier.run("upsertMatchResult", () -> store.upsertMatchResult(persisted));

                Optional<UnresolvedReason> reason = result.unresolvedReason();
                if (reason.isEmpty()) {
                    retrier.call("clearUnresolved", () -> store.clearUnresolved(record.sourceId(), persisted.canonicalId()));
                    tally.matched.incrementAndGet();
                    log.debug("pipeline.record.matched canonicalId={} strategy={} confidence={}",
                            result.canonicalId(), result.strategy().getCode(), result.confidence());
                } else {
                    String candidateId = result.candidateId();
                    retrier.call("recordUnresolved",
                            () -> store.recordUnresolved(record, reason.get(), candidateId, runId));
                    metricsService.incrementUnresolved(reason.get());
                    tally.unresolved(reason.get());
                    log.debug("pipeline.record.unresolved reason={} candidateId={}", reason.get().getCode(), candidateId);
                    if (reason.get() == UnresolvedReason.NO_MATCH) {
                        writeDerived(record, tally);
                    }
                }
            } catch (ResolutionException e) {
                log.error("pipeline.record.failed error={}", e.getMessage(), e);
                tally.fail(record.sourceId(), e);
            }
            return result;
        }
    }

    private boolean isAutoAliasCandidate(MatchResult result) {
        return result.isMatched()
                && result.strategy().isApproximate()
                && result.confidence() >= options.getAutoAliasThreshold();
    }

    private MatchResult autoAlias(SourceRecord record, MatchResult result, Tally tally) {
        try {
            retrier.call("insertAlias", () -> store.insertAlias(record.rawName(), result.canonicalId(),
                    AliasScope.NAME, AliasSource.AUTO, result.confidence()));
        } catch (DuplicateAliasException e) {
            log.warn("pipeline.alias.conflict text='{}' existingId={} requestedId={}",
                    record.rawName(), e.getExistingCanonicalId(), result.canonicalId());
            return result.asAmbiguous();
        }
        tally.autoAliased.incrementAndGet();
        metricsService.incrementAliasCreated(AliasSource.AUTO);
        auditService.record(AuditAction.ALIAS_CREATED, result.canonicalId(), AuditService.SYSTEM_ACTOR,
                Map.of("alias", record.rawName(), "source", AliasSource.AUTO.name(),
                        "strategy", result.strategy().getCode(), "confidence", result.confidence()));
        log.info("pipeline.alias.created canonicalId={} alias='{}' strategy={} confidence={}",
                result.canonicalId(), record.rawName(), result.strategy().getCode(), result.confidence());
        return result;
    }

    private MatchResult autoCreate(String runId, SourceRecord record, MatchResult result, Tally tally) {
        EntityType type = entityTypeOf(record);
        String normalized = keys.lookupKey(record.rawName(), AliasScope.NAME);
        String lockKey = DistributedLock.key(normalized, type);
        creationLock.lock(lockKey);
        try {
            // another worker may have created it while this one waited
            List<String> existing = store.findNameOwners(record.rawName());
            if (existing.size() == 1) {
                return MatchResult.matched(record.sourceId(), existing.get(0), MatchStrategy.EXACT_NAME,
                        0.95, MatchStrategy.EXACT_NAME.getCode(), normalized).withRunId(runId);
            }
            if (existing.size() > 1) {
                return MatchResult.ambiguous(record.sourceId(), existing.get(0), MatchStrategy.EXACT_NAME,
                        0.95, normalized).withRunId(runId);
            }
            CanonicalEntity entity = retrier.call("createEntity", () -> store.createEntity(
                    record.rawName().trim(), type, Map.of("createdBy", "pipeline", "runId", runId)));
            tally.autoCreated.incrementAndGet();
            metricsService.incrementEntityCreated(type);
            auditService.record(AuditAction.ENTITY_AUTO_CREATED, entity.getId(), AuditService.SYSTEM_ACTOR,
                    Map.of("canonicalName", entity.getCanonicalName(), "type", type.name(), "runId", runId));
            log.warn("pipeline.entity.auto-created canonicalId={} name='{}' type={}",
                    entity.getId(), entity.getCanonicalName(), type);
            return MatchResult.matched(record.sourceId(), entity.getId(), MatchStrategy.AUTO_CREATED, 1.0,
                    MatchStrategy.AUTO_CREATED.getCode(), record.rawName()).withRunId(runId);
        } finally {
            creationLock.unlock(lockKey);
        }
    }

    private EntityType entityTypeOf(SourceRecord record) {
        Optional<String> declared = record.attribute(ENTITY_TYPE_ATTRIBUTE);
        if (declared.isPresent()) {
            try {
                return EntityType.fromCode(declared.get());
            } catch (IllegalArgumentException e) {
                log.warn("pipeline.entity-type.unknown value='{}' fallback={}",
                        declared.get(), options.getAutoCreateEntityType());
            }
        }
        return options.getAutoCreateEntityType();
    }

    private void writeDerived(SourceRecord record, Tally tally) {
        if (dedupWriter == null || options.getDerivedTargetSystem() == null) {
            return;
        }
        WriteOutcome outcome = dedupWriter.write(record, options.getDerivedTargetSystem());
        if (outcome == WriteOutcome.INSERTED) {
            tally.derivedInserted.incrementAndGet();
        }
    }

    private static final class Tally {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger matched = new AtomicInteger();
        final AtomicInteger autoAliased = new AtomicInteger();
        final AtomicInteger autoCreated = new AtomicInteger();
        final AtomicInteger derivedInserted = new AtomicInteger();
        final Map<UnresolvedReason, AtomicInteger> unresolved = new EnumMap<>(UnresolvedReason.class);
        final List<RunReport.RecordFailure> failures = Collections.synchronizedList(new ArrayList<>());

        Tally() {
            for (UnresolvedReason reason : UnresolvedReason.values()) {
                unresolved.put(reason, new AtomicInteger());
            }
        }

        void unresolved(UnresolvedReason reason) {
            unresolved.get(reason).incrementAndGet();
        }

        void fail(String sourceId, Exception e) {
            failures.add(new RunReport.RecordFailure(sourceId, e.getMessage()));
        }

        RunReport toReport(String runId, int deferred, Duration duration) {
            Map<UnresolvedReason, Integer> counts = new EnumMap<>(UnresolvedReason.class);
            unresolved.forEach((reason, count) -> {
                if (count.get() > 0) {
                    counts.put(reason, count.get());
                }
            });
            List<RunReport.RecordFailure> failed;
            synchronized (failures) {
                failed = new ArrayList<>(failures);
            }
            return new RunReport(runId, processed.get(), matched.get(), counts, autoAliased.get(),
                    autoCreated.get(), derivedInserted.get(), failed, deferred, duration);
        }
    }

    public static Builder builder(CanonicalStore store, AliasKeys keys) {
        return new Builder(store, keys);
    }

    public static class Builder {
        private final CanonicalStore store;
        private final AliasKeys keys;
        private PipelineOptions options = PipelineOptions.defaults();
        private Matcher matcher;
        private DistributedLock creationLock = new LocalDistributedLock();
        private DedupWriter dedupWriter;
        private AuditService auditService = new AuditService();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();

        private Builder(CanonicalStore store, AliasKeys keys) {
            this.store = Objects.requireNonNull(store, "store is required");
            this.keys = Objects.requireNonNull(keys, "keys is required");
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Overrides the matcher built from {@link PipelineOptions#getMatcherConfig()}.
         */
        public Builder matcher(Matcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder creationLock(DistributedLock creationLock) {
            this.creationLock = creationLock;
            return this;
        }

        public Builder dedupWriter(DedupWriter dedupWriter) {
            this.dedupWriter = dedupWriter;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public ResolutionPipeline build() {
            Objects.requireNonNull(options, "options is required");
            return new ResolutionPipeline(this);
        }
    }
}
