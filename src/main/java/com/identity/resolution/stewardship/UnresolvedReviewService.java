package com.identity.resolution.stewardship;

import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.audit.AuditService;
import com.identity.resolution.core.model.Alias;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.core.model.UnresolvedReason;
import com.identity.resolution.core.model.UnresolvedRecord;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.rules.InputValidator;
import com.identity.resolution.rules.InvalidInputException;
import com.identity.resolution.rules.NameNormalizer;
import com.identity.resolution.store.CanonicalStore;
import com.identity.resolution.store.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manual review of the unresolved-record queue.
 *
 * <p>Resolving a record attaches its raw name as a steward alias of the chosen entity,
 * so the next pipeline run matches it on the exact-name path.</p>
 */
public class UnresolvedReviewService {
    private static final Logger log = LoggerFactory.getLogger(UnresolvedReviewService.class);

    private final CanonicalStore store;
    private final NameNormalizer normalizer;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public UnresolvedReviewService(CanonicalStore store, NameNormalizer normalizer, AuditService auditService) {
        this(store, normalizer, auditService, new NoOpMetricsService());
    }

    public UnresolvedReviewService(CanonicalStore store, NameNormalizer normalizer,
                                   AuditService auditService, MetricsService metricsService) {
        this.store = store;
        this.normalizer = normalizer;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    /**
     * Pending records, most frequently seen first.
     */
    public Page<UnresolvedRecord> listPending(PageRequest request) {
        return Page.of(store.findPendingUnresolved(), request);
    }

    public Page<UnresolvedRecord> listPending(UnresolvedReason reason, PageRequest request) {
        List<UnresolvedRecord> filtered = store.findPendingUnresolved().stream()
                .filter(r -> r.getReason() == reason)
                .toList();
        return Page.of(filtered, request);
    }

    /**
     * Resolves a pending record to {@code canonicalId}. The record's raw name becomes a
     * manual name alias unless it has no comparable characters.
     *
     * @throws IllegalArgumentException if no pending record exists for {@code sourceId}
     * @throws com.identity.resolution.store.DuplicateAliasException if the raw name is
     *         already an alias of a different entity
     * @throws EntityNotFoundException if the entity is unknown or retired
     */
    public UnresolvedRecord resolve(String sourceId, String canonicalId, String actor) {
        UnresolvedRecord pending = requirePending(sourceId);
        String aliasText = null;
        if (isAliasable(pending.getRawName())) {
            Alias alias = store.insertAlias(pending.getRawName(), canonicalId, AliasScope.NAME,
                    AliasSource.MANUAL, 1.0);
            aliasText = alias.getAliasText();
            metricsService.incrementAliasCreated(AliasSource.MANUAL);
        } else if (store.findEntity(canonicalId).filter(CanonicalEntity::isActive).isEmpty()) {
            throw EntityNotFoundException.missing(canonicalId);
        }

        UnresolvedRecord resolved = store.clearUnresolved(sourceId, canonicalId)
                .orElseThrow(() -> new IllegalArgumentException("No pending unresolved record: " + sourceId));
        auditService.record(AuditAction.RECORD_RESOLVED_MANUALLY, sourceId, actor, aliasText != null
                ? Map.of("canonicalId", canonicalId, "alias", aliasText, "reason", pending.getReason().getCode())
                : Map.of("canonicalId", canonicalId, "reason", pending.getReason().getCode()));
        log.info("stewardship.resolved sourceId={} canonicalId={} alias='{}' actor={}",
                sourceId, canonicalId, aliasText, actor);
        return resolved;
    }

    /**
     * Takes a record off the queue without resolving it, e.g. test data or a record
     * that has no counterpart anywhere. It returns if a later run leaves it unresolved again.
     */
    public UnresolvedRecord dismiss(String sourceId, String actor, String note) {
        UnresolvedRecord pending = requirePending(sourceId);
        UnresolvedRecord dismissed = store.clearUnresolved(sourceId, null)
                .orElseThrow(() -> new IllegalArgumentException("No pending unresolved record: " + sourceId));
        auditService.record(AuditAction.RECORD_DISMISSED, sourceId, actor,
                Map.of("reason", pending.getReason().getCode(), "note", note != null ? note : ""));
        log.info("stewardship.dismissed sourceId={} actor={}", sourceId, actor);
        return dismissed;
    }

    /**
     * Adds a steward alias for an entity outside of the review queue.
     */
    public Alias addAlias(String text, String canonicalId, AliasScope scope, String actor) {
        Alias alias = store.insertAlias(text, canonicalId, scope, AliasSource.MANUAL, 1.0);
        metricsService.incrementAliasCreated(AliasSource.MANUAL);
        auditService.record(AuditAction.ALIAS_CREATED, canonicalId, actor,
                Map.of("alias", text, "scope", scope.name(), "source", AliasSource.MANUAL.name()));
        return alias;
    }

    public boolean deactivateAlias(String text, AliasScope scope, String actor) {
        Optional<String> owner = store.resolveAlias(text, scope);
        boolean deactivated = store.deactivateAlias(text, scope);
        if (deactivated) {
            auditService.record(AuditAction.ALIAS_DEACTIVATED, owner.orElse(text), actor,
                    Map.of("alias", text, "scope", scope.name()));
            log.info("stewardship.alias.deactivated alias='{}' scope={} actor={}", text, scope, actor);
        }
        return deactivated;
    }

    private UnresolvedRecord requirePending(String sourceId) {
        return store.findUnresolved(sourceId)
                .filter(r -> !r.isResolved())
                .orElseThrow(() -> new IllegalArgumentException("No pending unresolved record: " + sourceId));
    }

    private boolean isAliasable(String rawName) {
        try {
            InputValidator.requireMatchable(rawName, normalizer);
            return true;
        } catch (InvalidInputException e) {
            return false;
        }
    }
}
