package com.identity.resolution.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.resolution.cache.AliasCache;
import com.identity.resolution.cache.NoOpAliasCache;
import com.identity.resolution.core.model.Alias;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.core.model.EntityStatus;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchOutcome;
import com.identity.resolution.core.model.MatchResult;
import com.identity.resolution.core.model.MatchStrategy;
import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.core.model.UnresolvedReason;
import com.identity.resolution.core.model.UnresolvedRecord;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.store.AliasCandidate;
import com.identity.resolution.store.AliasKeys;
import com.identity.resolution.store.CanonicalStore;
import com.identity.resolution.store.DuplicateAliasException;
import com.identity.resolution.store.EntityNotFoundException;
import com.identity.resolution.store.MergeConflictException;
import com.identity.resolution.store.MergeSummary;
import com.identity.resolution.store.StoreException;
import com.identity.resolution.store.StoreStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link CanonicalStore} persisted in FalkorDB.
 *
 * <p>Writes from this process are serialized by a single lock; merges run as a
 * {@link StoreTransaction} so a failing step rolls back the steps before it.
 * Successful exact lookups are cached in an {@link AliasCache} that is invalidated on
 * merge, rename, retirement and alias deactivation.</p>
 */
public class GraphCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(GraphCanonicalStore.class);
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final CypherExecutor cypher;
    private final AliasKeys keys;
    private final AliasCache cache;
    private final MetricsService metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReentrantLock writeLock = new ReentrantLock();

    public GraphCanonicalStore(GraphConnection connection, AliasKeys keys) {
        this(connection, keys, new NoOpAliasCache(), new NoOpMetricsService(), Clock.systemUTC());
    }

    public GraphCanonicalStore(GraphConnection connection, AliasKeys keys, AliasCache cache,
                               MetricsService metrics, Clock clock) {
        this.cypher = new CypherExecutor(connection);
        this.keys = keys;
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========== Canonical entities ==========

    @Override
    public CanonicalEntity createEntity(String canonicalName, EntityType type, Map<String, String> metadata) {
        return createEntity(CanonicalEntity.builder()
                .canonicalName(canonicalName)
                .type(type)
                .metadata(metadata)
                .createdAt(clock.instant())
                .build());
    }

    @Override
    public CanonicalEntity createEntity(CanonicalEntity entity) {
        return write(() -> {
            Optional<CanonicalEntity> existing = findEntity(entity.getId());
            if (existing.isPresent()) {
                if (!existing.get().isActive()) {
                    throw new IllegalStateException("Canonical id " + entity.getId() + " is retired and cannot be reused");
                }
                return existing.get();
            }
            if (entity.isActive()) {
                requireNameFree(entity.getCanonicalName(), entity.getId());
            }
            Map<String, Object> props = new HashMap<>();
            props.put("id", entity.getId());
            props.put("canonicalName", entity.getCanonicalName());
            props.put("normalizedName", nameKey(entity.getCanonicalName()));
            props.put("type", entity.getType().name());
            props.put("status", entity.getStatus().name());
            props.put("metadata", writeMetadata(entity.getMetadata()));
            props.put("createdAt", entity.getCreatedAt().toString());
            props.put("updatedAt", entity.getUpdatedAt().toString());
            cypher.createEntity(props);
            if (entity.isActive()) {
                cypher.linkEntityKeys(entity.getId(), keys.indexKeys(entity.getCanonicalName(), entity.getType()));
            }
            log.debug("store.entity.created id={} name='{}' type={}",
                    entity.getId(), entity.getCanonicalName(), entity.getType());
            return entity;
        });
    }

    @Override
    public Optional<CanonicalEntity> findEntity(String id) {
        return cypher.findEntityById(id).stream().findFirst().map(this::toEntity);
    }

    @Override
    public List<CanonicalEntity> findActiveEntities(EntityType type) {
        return cypher.findActiveEntities(type != null ? type.name() : null).stream()
                .map(this::toEntity)
                .toList();
    }

    @Override
    public CanonicalEntity renameEntity(String id, String newCanonicalName) {
        return write(() -> {
            CanonicalEntity current = requireActive(id);
            requireNameFree(newCanonicalName, id);
            CanonicalEntity renamed = current.withCanonicalName(newCanonicalName);
            cypher.renameEntity(id, renamed.getCanonicalName(), nameKey(renamed.getCanonicalName()),
                    renamed.getUpdatedAt().toString());
            cypher.unlinkEntityKeys(id);
            cypher.linkEntityKeys(id, keys.indexKeys(renamed.getCanonicalName(), renamed.getType()));
            cache.invalidate(id);
            return renamed;
        });
    }

    @Override
    public CanonicalEntity retireEntity(String id) {
        return write(() -> {
            CanonicalEntity retired = requireActive(id).retired(null);
            cypher.setEntityStatus(id, EntityStatus.RETIRED.name(), null, retired.getUpdatedAt().toString());
            cache.invalidate(id);
            log.info("store.entity.retired id={}", id);
            return retired;
        });
    }

    // ========== Alias registry ==========

    @Override
    public Optional<String> resolveAlias(String text, AliasScope scope) {
        String key = keys.lookupKey(text, scope);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> cached = cache.get(scope, key);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        Optional<String> resolved = firstId(cypher.resolveAlias(key, scope.name()));
        if (resolved.isEmpty() && scope == AliasScope.NAME) {
            List<String> owners = column(cypher.resolveCanonicalName(key), "id");
            resolved = owners.size() == 1 ? Optional.of(owners.get(0)) : Optional.empty();
        }
        resolved.ifPresent(id -> cache.put(scope, key, id));
        return resolved;
    }

    @Override
    public List<String> findNameOwners(String text) {
        String key = nameKey(text);
        if (key.isEmpty()) {
            return List.of();
        }
        Optional<String> aliased = firstId(cypher.resolveAlias(key, AliasScope.NAME.name()));
        if (aliased.isPresent()) {
            return List.of(aliased.get());
        }
        return column(cypher.resolveCanonicalName(key), "id");
    }

    @Override
    public Alias insertAlias(String text, String canonicalId, AliasScope scope, AliasSource source, double confidence) {
        String key = keys.lookupKey(text, scope);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Alias text has no comparable characters: '" + text + "'");
        }
        return write(() -> {
            CanonicalEntity target = requireActive(canonicalId);
            Optional<Alias> existing = cypher.findActiveAlias(key, scope.name()).stream()
                    .findFirst().map(this::toAlias);
            if (existing.isPresent()) {
                if (existing.get().getCanonicalId().equals(canonicalId)) {
                    return existing.get();
                }
                throw new DuplicateAliasException(text, scope, existing.get().getCanonicalId(), canonicalId);
            }
            if (scope == AliasScope.NAME) {
                Optional<String> owner = firstId(cypher.findCanonicalNameOwners(List.of(key), List.of(canonicalId)));
                if (owner.isPresent()) {
                    throw new DuplicateAliasException(text, scope, owner.get(), canonicalId);
                }
            }
            Alias alias = Alias.builder()
                    .aliasText(text.trim())
                    .lookupKey(key)
                    .canonicalId(canonicalId)
                    .scope(scope)
                    .source(source)
                    .confidence(confidence)
                    .createdAt(clock.instant())
                    .build();
            String aliasId = createAliasNode(alias);
            if (scope == AliasScope.NAME) {
                cypher.linkAliasKeys(aliasId, keys.indexKeys(alias.getAliasText(), target.getType()));
            }
            log.debug("store.alias.created text='{}' scope={} canonicalId={} source={}",
                    text, scope.getCode(), canonicalId, source);
            return alias;
        });
    }

    @Override
    public boolean deactivateAlias(String text, AliasScope scope) {
        String key = keys.lookupKey(text, scope);
        return write(() -> {
            List<Map<String, Object>> rows = cypher.findActiveAlias(key, scope.name());
            if (rows.isEmpty()) {
                return false;
            }
            cypher.deactivateAlias((String) rows.get(0).get("id"));
            cache.invalidateKey(scope, key);
            return true;
        });
    }

    @Override
    public List<Alias> findAliases(String canonicalId) {
        return cypher.findAliasesFor(canonicalId).stream().map(this::toAlias).toList();
    }

    @Override
    public Collection<AliasCandidate> findCandidates(Set<String> blockingKeys) {
        if (blockingKeys.isEmpty()) {
            return List.of();
        }
        Map<String, AliasCandidate> candidates = new LinkedHashMap<>();
        List<Map<String, Object>> rows = new ArrayList<>(cypher.findEntityCandidates(blockingKeys));
        rows.addAll(cypher.findAliasCandidates(blockingKeys));
        for (Map<String, Object> row : rows) {
            AliasCandidate candidate = new AliasCandidate(
                    (String) row.get("text"),
                    (String) row.get("normalizedText"),
                    (String) row.get("canonicalId"),
                    EntityType.valueOf((String) row.get("type")));
            candidates.putIfAbsent(candidate.normalizedText() + "|" + candidate.canonicalId(), candidate);
        }
        return List.copyOf(candidates.values());
    }

    @Override
    public Set<Alias> checkIntegrity() {
        Set<Alias> orphaned = new LinkedHashSet<>();
        cypher.findOrphanedAliases().forEach(row -> orphaned.add(toAlias(row)));
        if (!orphaned.isEmpty()) {
            log.warn("store.integrity.orphaned count={}", orphaned.size());
        }
        return orphaned;
    }

    @Override
    public MergeSummary merge(String winnerId, String loserId) {
        if (Objects.equals(winnerId, loserId)) {
            throw new IllegalArgumentException("Cannot merge an entity into itself: " + winnerId);
        }
        return write(() -> {
            CanonicalEntity winner = requireActive(winnerId);
            CanonicalEntity loser = requireActive(loserId);
            if (winner.getType() != loser.getType()) {
                throw new IllegalArgumentException("Cannot merge " + loser.getType() + " "
                        + loserId + " into " + winner.getType() + " " + winnerId);
            }

            List<Map<String, Object>> loserAliases = cypher.findAliasesFor(loserId);
            List<String> aliasIds = loserAliases.stream().map(r -> (String) r.get("id")).toList();
            Set<String> nameKeys = new LinkedHashSet<>();
            loserAliases.stream()
                    .filter(r -> AliasScope.NAME.name().equals(r.get("scope")))
                    .forEach(r -> nameKeys.add((String) r.get("lookupKey")));

            String formerKey = nameKey(loser.getCanonicalName());
            boolean aliasFormerName = !formerKey.equals(nameKey(winner.getCanonicalName()))
                    && cypher.findActiveAlias(formerKey, AliasScope.NAME.name()).isEmpty();
            if (aliasFormerName) {
                nameKeys.add(formerKey);
            }
            List<String> conflicts = new ArrayList<>();
            if (!nameKeys.isEmpty()) {
                cypher.findCanonicalNameOwners(nameKeys, List.of(winnerId, loserId))
                        .forEach(r -> conflicts.add(AliasScope.NAME.getCode() + ":" + r.get("normalizedName")));
            }
            if (!conflicts.isEmpty()) {
                throw new MergeConflictException(winnerId, loserId, conflicts.stream().distinct().toList());
            }

            String now = clock.instant().toString();
            int results;
            int unresolvedMoved;
            try (StoreTransaction tx = new StoreTransaction("merge " + loserId + "->" + winnerId)) {
                if (!aliasIds.isEmpty()) {
                    tx.execute("repoint aliases",
                            () -> cypher.repointAliases(aliasIds, winnerId),
                            () -> cypher.repointAliases(aliasIds, loserId));
                }
                tx.execute("retire loser",
                        () -> cypher.setEntityStatus(loserId, EntityStatus.RETIRED.name(), winnerId, now),
                        () -> cypher.setEntityStatus(loserId, EntityStatus.ACTIVE.name(), null, now));
                if (aliasFormerName) {
                    Alias former = Alias.builder()
                            .aliasText(loser.getCanonicalName())
                            .lookupKey(formerKey)
                            .canonicalId(winnerId)
                            .source(AliasSource.MERGE)
                            .createdAt(clock.instant())
                            .build();
                    String formerId = tx.call("alias former name", () -> {
                        String id = createAliasNode(former);
                        cypher.linkAliasKeys(id, keys.indexKeys(former.getAliasText(), winner.getType()));
                        return id;
                    }, cypher::deleteAlias);
                    log.debug("store.merge.former-name aliasId={} text='{}'", formerId, former.getAliasText());
                }
                List<String> resultKeys = tx.call("repoint match results",
                        () -> column(cypher.repointMatchResults("canonicalId", loserId, winnerId), "key"),
                        moved -> cypher.setMatchResultProperty("canonicalId", moved, loserId));
                tx.call("repoint match result candidates",
                        () -> column(cypher.repointMatchResults("candidateId", loserId, winnerId), "key"),
                        moved -> cypher.setMatchResultProperty("candidateId", moved, loserId));
                List<String> candidates = tx.call("repoint unresolved candidates",
                        () -> column(cypher.repointUnresolved("candidateId", loserId, winnerId), "sourceId"),
                        moved -> cypher.setUnresolvedProperty("candidateId", moved, loserId));
                List<String> resolutions = tx.call("repoint unresolved resolutions",
                        () -> column(cypher.repointUnresolved("resolvedCanonicalId", loserId, winnerId), "sourceId"),
                        moved -> cypher.setUnresolvedProperty("resolvedCanonicalId", moved, loserId));
                tx.markSuccess();
                results = resultKeys.size();
                Set<String> touched = new LinkedHashSet<>(candidates);
                touched.addAll(resolutions);
                unresolvedMoved = touched.size();
            }
            cache.onMerge(winnerId, loserId);
            log.info("store.merged winnerId={} loserId={} aliases={} matchResults={}",
                    winnerId, loserId, aliasIds.size(), results);
            return new MergeSummary(winnerId, loserId, aliasIds.size(), results, unresolvedMoved, aliasFormerName);
        });
    }

    // ========== Match results ==========

    @Override
    public void upsertMatchResult(MatchResult result) {
        Map<String, Object> props = new HashMap<>();
        props.put("key", resultKey(result.sourceId(), result.runId()));
        props.put("sourceId", result.sourceId());
        props.put("runId", result.runId());
        props.put("canonicalId", result.canonicalId());
        props.put("candidateId", result.candidateId());
        props.put("strategy", result.strategy().name());
        props.put("outcome", result.outcome().name());
        props.put("confidence", result.confidence());
        props.put("reason", result.reason());
        props.put("matchedAlias", result.matchedAlias());
        props.put("matchedAt", result.matchedAt().toString());
        write(() -> {
            cypher.upsertMatchResult(props);
            return null;
        });
    }

    @Override
    public Optional<MatchResult> findMatchResult(String sourceId, String runId) {
        return cypher.findMatchResult(resultKey(sourceId, runId)).stream().findFirst().map(this::toMatchResult);
    }

    @Override
    public List<MatchResult> findMatchResultsByCanonical(String canonicalId) {
        return cypher.findMatchResultsByCanonical(canonicalId).stream().map(this::toMatchResult).toList();
    }

    // ========== Unresolved records ==========

    @Override
    public UnresolvedRecord recordUnresolved(SourceRecord record, UnresolvedReason reason,
                                             String candidateId, String runId) {
        return write(() -> {
            Optional<UnresolvedRecord> existing = findUnresolved(record.sourceId());
            UnresolvedRecord updated = existing
                    .map(u -> u.seenAgain(reason, candidateId, record.rawName(), runId, clock.instant()))
                    .orElseGet(() -> UnresolvedRecord.firstSeen(record, reason, candidateId, runId, clock.instant()));
            saveUnresolved(updated);
            return updated;
        });
    }

    @Override
    public Optional<UnresolvedRecord> clearUnresolved(String sourceId, String canonicalId) {
        return write(() -> {
            Optional<UnresolvedRecord> existing = findUnresolved(sourceId);
            if (existing.isEmpty() || existing.get().isResolved()) {
                return Optional.empty();
            }
            UnresolvedRecord cleared = existing.get().markResolved(canonicalId);
            saveUnresolved(cleared);
            return Optional.of(cleared);
        });
    }

    @Override
    public Optional<UnresolvedRecord> findUnresolved(String sourceId) {
        return cypher.findUnresolved(sourceId).stream().findFirst().map(this::toUnresolved);
    }

    @Override
    public List<UnresolvedRecord> findPendingUnresolved() {
        return cypher.findPendingUnresolved().stream().map(this::toUnresolved).toList();
    }

    @Override
    public StoreStatus status() {
        List<Map<String, Object>> rows = cypher.countStatus();
        if (rows.isEmpty()) {
            return new StoreStatus(0, 0, 0, 0, 0);
        }
        Map<String, Object> row = rows.get(0);
        return new StoreStatus(asLong(row.get("activeEntities")), asLong(row.get("retiredEntities")),
                asLong(row.get("activeAliases")), asLong(row.get("matchResults")),
                asLong(row.get("pendingUnresolved")));
    }

    // ========== Internals ==========

    private <T> T write(Supplier<T> action) {
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    private CanonicalEntity requireActive(String id) {
        CanonicalEntity entity = id != null ? findEntity(id).orElse(null) : null;
        if (entity == null) {
            throw EntityNotFoundException.missing(id);
        }
        if (!entity.isActive()) {
            throw EntityNotFoundException.retired(id);
        }
        return entity;
    }

    private String createAliasNode(Alias alias) {
        String id = UUID.randomUUID().toString();
        Map<String, Object> props = new HashMap<>();
        props.put("id", id);
        props.put("aliasText", alias.getAliasText());
        props.put("lookupKey", alias.getLookupKey());
        props.put("canonicalId", alias.getCanonicalId());
        props.put("scope", alias.getScope().name());
        props.put("source", alias.getSource().name());
        props.put("confidence", alias.getConfidence());
        props.put("createdAt", alias.getCreatedAt().toString());
        cypher.createAlias(props);
        return id;
    }

    private void saveUnresolved(UnresolvedRecord r) {
        Map<String, Object> props = new HashMap<>();
        props.put("sourceId", r.getSourceId());
        props.put("sourceSystem", r.getSourceSystem());
        props.put("rawName", r.getRawName());
        props.put("reason", r.getReason().name());
        props.put("candidateId", r.getCandidateId());
        props.put("firstSeen", r.getFirstSeen().toString());
        props.put("lastSeen", r.getLastSeen().toString());
        props.put("lastRunId", r.getLastRunId());
        props.put("occurrences", r.getOccurrences());
        props.put("resolved", r.isResolved());
        props.put("resolvedCanonicalId", r.getResolvedCanonicalId());
        cypher.upsertUnresolved(props);
    }

    private void requireNameFree(String canonicalName, String id) {
        Optional<String> owner = firstId(cypher.resolveAlias(nameKey(canonicalName), AliasScope.NAME.name()));
        if (owner.isPresent() && !owner.get().equals(id)) {
            throw new DuplicateAliasException(canonicalName, AliasScope.NAME, owner.get(), id);
        }
    }

    private String nameKey(String name) {
        return keys.lookupKey(name, AliasScope.NAME);
    }

    private static String resultKey(String sourceId, String runId) {
        return sourceId + "|" + Objects.toString(runId, "");
    }

    private static Optional<String> firstId(List<Map<String, Object>> rows) {
        return rows.stream().map(r -> (String) r.get("id")).filter(Objects::nonNull).findFirst();
    }

    private static List<String> column(List<Map<String, Object>> rows, String name) {
        return rows.stream().map(r -> (String) r.get(name)).toList();
    }

    private String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize entity metadata", e);
        }
    }

    private Map<String, String> readMetadata(Object value) {
        if (value == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(value.toString(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt entity metadata: " + value, e);
        }
    }

    private CanonicalEntity toEntity(Map<String, Object> row) {
        return CanonicalEntity.builder()
                .id((String) row.get("id"))
                .canonicalName((String) row.get("canonicalName"))
                .type(EntityType.valueOf((String) row.get("type")))
                .status(EntityStatus.valueOf((String) row.get("status")))
                .retiredInto((String) row.get("retiredInto"))
                .metadata(readMetadata(row.get("metadata")))
                .createdAt(asInstant(row.get("createdAt")))
                .updatedAt(asInstant(row.get("updatedAt")))
                .build();
    }

    private Alias toAlias(Map<String, Object> row) {
        return Alias.builder()
                .aliasText((String) row.get("aliasText"))
                .lookupKey((String) row.get("lookupKey"))
                .canonicalId((String) row.get("canonicalId"))
                .scope(AliasScope.valueOf((String) row.get("scope")))
                .source(AliasSource.valueOf((String) row.get("source")))
                .confidence(asDouble(row.get("confidence")))
                .active(Boolean.TRUE.equals(row.get("active")))
                .createdAt(asInstant(row.get("createdAt")))
                .build();
    }

    private MatchResult toMatchResult(Map<String, Object> row) {
        return new MatchResult(
                (String) row.get("sourceId"),
                (String) row.get("runId"),
                (String) row.get("canonicalId"),
                (String) row.get("candidateId"),
                MatchStrategy.valueOf((String) row.get("strategy")),
                MatchOutcome.valueOf((String) row.get("outcome")),
                asDouble(row.get("confidence")),
                (String) row.get("reason"),
                (String) row.get("matchedAlias"),
                asInstant(row.get("matchedAt")));
    }

    private UnresolvedRecord toUnresolved(Map<String, Object> row) {
        return UnresolvedRecord.builder()
                .sourceId((String) row.get("sourceId"))
                .sourceSystem((String) row.get("sourceSystem"))
                .rawName((String) row.get("rawName"))
                .reason(UnresolvedReason.valueOf((String) row.get("reason")))
                .candidateId((String) row.get("candidateId"))
                .firstSeen(asInstant(row.get("firstSeen")))
                .lastSeen(asInstant(row.get("lastSeen")))
                .lastRunId((String) row.get("lastRunId"))
                .occurrences(asLong(row.get("occurrences")))
                .resolved(Boolean.TRUE.equals(row.get("resolved")))
                .resolvedCanonicalId((String) row.get("resolvedCanonicalId"))
                .build();
    }

    private static Instant asInstant(Object value) {
        return value != null ? Instant.parse(value.toString()) : null;
    }

    private static double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
