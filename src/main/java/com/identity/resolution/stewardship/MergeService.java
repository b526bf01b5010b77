package com.identity.resolution.stewardship;

import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.audit.AuditService;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.logging.LogContext;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.store.CanonicalStore;
import com.identity.resolution.store.MergeConflictException;
import com.identity.resolution.store.MergeSummary;
import com.identity.resolution.store.RetryPolicy;
import com.identity.resolution.store.StoreRetrier;
import com.identity.resolution.tracing.NoOpTracingService;
import com.identity.resolution.tracing.Span;
import com.identity.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Steward operations on canonical entities: merge duplicates, rename, retire.
 */
public class MergeService {
    private static final Logger log = LoggerFactory.getLogger(MergeService.class);

    private final CanonicalStore store;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final StoreRetrier retrier;

    public MergeService(CanonicalStore store, AuditService auditService) {
        this(store, auditService, new NoOpMetricsService(), new NoOpTracingService(), RetryPolicy.defaults());
    }

    public MergeService(CanonicalStore store, AuditService auditService, MetricsService metricsService,
                        TracingService tracingService, RetryPolicy retryPolicy) {
        this.store = store;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.retrier = new StoreRetrier(retryPolicy);
    }

    /**
     * Merges {@code loserId} into {@code winnerId}. Unknown, retired or mismatched entities
     * are reported as a failed result.
     *
     * @throws MergeConflictException if repointing would duplicate an active alias; the
     *                                steward must deactivate the conflicting alias first
     */
    public MergeResult merge(String winnerId, String loserId, String actor) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forMerge(correlationId, winnerId, loserId);
             Span span = tracingService.startSpan(TracingService.MERGE_SPAN,
                     Map.of("winnerId", winnerId, "loserId", loserId))) {

            Optional<String> rejection = validate(winnerId, loserId);
            if (rejection.isPresent()) {
                log.warn("merge.rejected reason={}", rejection.get());
                span.setStatus(Span.SpanStatus.ERROR);
                return MergeResult.failure(rejection.get());
            }
            CanonicalEntity winner = store.findEntity(winnerId).orElseThrow();

            MergeSummary summary;
            try {
                summary = retrier.call("merge", () -> store.merge(winnerId, loserId));
            } catch (MergeConflictException e) {
                log.warn("merge.conflict conflictingAliases={}", e.getConflictingAliases());
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }

            metricsService.incrementEntityMerged(winner.getType());
            auditService.record(AuditAction.ENTITY_MERGED, winnerId, actor, Map.of(
                    "loserId", loserId,
                    "correlationId", correlationId,
                    "aliasesRepointed", summary.aliasesRepointed(),
                    "matchResultsRepointed", summary.matchResultsRepointed()));
            auditService.record(AuditAction.ENTITY_RETIRED, loserId, actor, Map.of("retiredInto", winnerId));
            span.setAttribute("aliasesRepointed", summary.aliasesRepointed());
            span.setAttribute("matchResultsRepointed", summary.matchResultsRepointed());
            span.setStatus(Span.SpanStatus.OK);
            log.info("merge.completed aliases={} matchResults={} unresolved={} formerNameAliased={}",
                    summary.aliasesRepointed(), summary.matchResultsRepointed(),
                    summary.unresolvedRepointed(), summary.formerNameAliased());
            return MergeResult.success(summary);
        }
    }

    public CanonicalEntity rename(String canonicalId, String newCanonicalName, String actor) {
        String previous = store.findEntity(canonicalId).map(CanonicalEntity::getCanonicalName).orElse(null);
        CanonicalEntity renamed = retrier.call("renameEntity", () -> store.renameEntity(canonicalId, newCanonicalName));
        auditService.record(AuditAction.ENTITY_RENAMED, canonicalId, actor, Map.of(
                "from", previous != null ? previous : "",
                "to", renamed.getCanonicalName()));
        log.info("entity.renamed canonicalId={} from='{}' to='{}'", canonicalId, previous, renamed.getCanonicalName());
        return renamed;
    }

    /**
     * Retires an entity without merging it. Aliases still pointing at it are reported by
     * {@link CanonicalStore#checkIntegrity()}.
     */
    public CanonicalEntity retire(String canonicalId, String actor) {
        CanonicalEntity retired = retrier.call("retireEntity", () -> store.retireEntity(canonicalId));
        auditService.record(AuditAction.ENTITY_RETIRED, canonicalId, actor);
        log.info("entity.retired canonicalId={} orphanedAliases={}",
                canonicalId, store.findAliases(canonicalId).size());
        return retired;
    }

    private Optional<String> validate(String winnerId, String loserId) {
        if (winnerId.equals(loserId)) {
            return Optional.of("Cannot merge an entity into itself: " + winnerId);
        }
        Optional<CanonicalEntity> winner = store.findEntity(winnerId);
        Optional<CanonicalEntity> loser = store.findEntity(loserId);
        if (winner.isEmpty()) {
            return Optional.of("Entity not found: " + winnerId);
        }
        if (loser.isEmpty()) {
            return Optional.of("Entity not found: " + loserId);
        }
        if (!winner.get().isActive()) {
            return Optional.of("Entity not active: " + winnerId);
        }
        if (!loser.get().isActive()) {
            return Optional.of("Entity not active: " + loserId);
        }
        if (winner.get().getType() != loser.get().getType()) {
            return Optional.of("Entity types differ: " + winner.get().getType() + " vs " + loser.get().getType());
        }
        return Optional.empty();
    }
}
