package com.identity.resolution.store;

import com.identity.resolution.core.model.Alias;
import com.identity.resolution.core.model.AliasScope;
import com.identity.resolution.core.model.AliasSource;
import com.identity.resolution.core.model.CanonicalEntity;
import com.identity.resolution.core.model.EntityType;
import com.identity.resolution.core.model.MatchResult;
import com.identity.resolution.core.model.SourceRecord;
import com.identity.resolution.core.model.UnresolvedReason;
import com.identity.resolution.core.model.UnresolvedRecord;
import com.identity.resolution.rules.DefaultNormalizationRules;
import com.identity.resolution.similarity.DefaultBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Thread-safe in-memory {@link CanonicalStore}.
 * Reads share a read lock; every write holds the single write lock, which makes
 * merges atomic with respect to readers.
 */
public class InMemoryCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCanonicalStore.class);

    private final AliasKeys keys;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, CanonicalEntity> entities = new ConcurrentHashMap<>();
    // normalized canonical name -> ids of active entities carrying it
    private final Map<String, Set<String>> canonicalNames = new ConcurrentHashMap<>();
    private final Map<AliasKey, Alias> activeAliases = new ConcurrentHashMap<>();
    private final List<Alias> inactiveAliases = new ArrayList<>();
    // blocking key -> names indexed under it
    private final Map<String, Set<CandidateRef>> blockingIndex = new ConcurrentHashMap<>();
    private final Map<ResultKey, MatchResult> matchResults = new ConcurrentHashMap<>();
    private final Map<String, UnresolvedRecord> unresolved = new ConcurrentHashMap<>();

    public InMemoryCanonicalStore() {
        this(new AliasKeys(DefaultNormalizationRules.createDefaultNormalizer(), new DefaultBlockingKeyStrategy()),
                Clock.systemUTC());
    }

    public InMemoryCanonicalStore(AliasKeys keys, Clock clock) {
        this.keys = keys;
        this.clock = clock;
    }

    // ========== Canonical entities ==========

    @Override
    public CanonicalEntity createEntity(String canonicalName, EntityType type, Map<String, String> metadata) {
        CanonicalEntity entity = CanonicalEntity.builder()
                .canonicalName(canonicalName)
                .type(type)
                .metadata(metadata)
                .createdAt(clock.instant())
                .build();
        return createEntity(entity);
    }

    @Override
    public CanonicalEntity createEntity(CanonicalEntity entity) {
        return write(() -> {
            CanonicalEntity existing = entities.get(entity.getId());
            if (existing != null) {
                if (!existing.isActive()) {
                    throw new IllegalStateException("Canonical id " + entity.getId() + " is retired and cannot be reused");
                }
                return existing;
            }
            if (entity.isActive()) {
                requireNameFree(entity.getCanonicalName(), entity.getId());
            }
            entities.put(entity.getId(), entity);
            if (entity.isActive()) {
                indexEntity(entity);
            }
            log.debug("store.entity.created id={} name='{}' type={}",
                    entity.getId(), entity.getCanonicalName(), entity.getType());
            return entity;
        });
    }

    @Override
    public Optional<CanonicalEntity> findEntity(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    @Override
    public List<CanonicalEntity> findActiveEntities(EntityType type) {
        return read(() -> entities.values().stream()
                .filter(CanonicalEntity::isActive)
                .filter(e -> type == null || e.getType() == type)
                .sorted(Comparator.comparing(CanonicalEntity::getId))
                .toList());
    }

    @Override
    public CanonicalEntity renameEntity(String id, String newCanonicalName) {
        return write(() -> {
            CanonicalEntity current = requireActive(id);
            requireNameFree(newCanonicalName, id);
            CanonicalEntity renamed = current.withCanonicalName(newCanonicalName);
            unindexEntity(current);
            entities.put(id, renamed);
            indexEntity(renamed);
            return renamed;
        });
    }

    @Override
    public CanonicalEntity retireEntity(String id) {
        return write(() -> {
            CanonicalEntity current = requireActive(id);
            unindexEntity(current);
            CanonicalEntity retired = current.retired(null);
            entities.put(id, retired);
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
        return read(() -> {
            Alias alias = activeAliases.get(new AliasKey(scope, key));
            if (alias != null && isActive(alias.getCanonicalId())) {
                return Optional.of(alias.getCanonicalId());
            }
            if (scope == AliasScope.NAME) {
                Set<String> owners = canonicalNameOwners(key);
                return owners.size() == 1 ? Optional.of(owners.iterator().next()) : Optional.empty();
            }
            return Optional.empty();
        });
    }

    @Override
    public List<String> findNameOwners(String text) {
        String key = keys.lookupKey(text, AliasScope.NAME);
        if (key.isEmpty()) {
            return List.of();
        }
        return read(() -> {
            Alias alias = activeAliases.get(new AliasKey(AliasScope.NAME, key));
            if (alias != null && isActive(alias.getCanonicalId())) {
                return List.of(alias.getCanonicalId());
            }
            return canonicalNameOwners(key).stream().sorted().toList();
        });
    }

    @Override
    public Alias insertAlias(String text, String canonicalId, AliasScope scope, AliasSource source, double confidence) {
        String key = keys.lookupKey(text, scope);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Alias text has no comparable characters: '" + text + "'");
        }
        return write(() -> {
            CanonicalEntity target = requireActive(canonicalId);
            AliasKey aliasKey = new AliasKey(scope, key);
            Alias existing = activeAliases.get(aliasKey);
            if (existing != null) {
                if (existing.getCanonicalId().equals(canonicalId)) {
                    return existing;
                }
                throw new DuplicateAliasException(text, scope, existing.getCanonicalId(), canonicalId);
            }
            if (scope == AliasScope.NAME) {
                Optional<String> otherOwner = canonicalNameOwners(key).stream()
                        .filter(id -> !id.equals(canonicalId))
                        .min(Comparator.naturalOrder());
                if (otherOwner.isPresent()) {
                    throw new DuplicateAliasException(text, scope, otherOwner.get(), canonicalId);
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
            activeAliases.put(aliasKey, alias);
            if (scope == AliasScope.NAME) {
                index(CandidateRef.alias(aliasKey), alias.getAliasText(), target.getType());
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
            AliasKey aliasKey = new AliasKey(scope, key);
            Alias alias = activeAliases.remove(aliasKey);
            if (alias == null) {
                return false;
            }
            inactiveAliases.add(alias.deactivated());
            if (scope == AliasScope.NAME) {
                CanonicalEntity owner = entities.get(alias.getCanonicalId());
                unindex(CandidateRef.alias(aliasKey), alias.getAliasText(),
                        owner != null ? owner.getType() : null);
            }
            return true;
        });
    }

    @Override
    public List<Alias> findAliases(String canonicalId) {
        return read(() -> activeAliases.values().stream()
                .filter(a -> a.getCanonicalId().equals(canonicalId))
                .sorted(Comparator.comparing(Alias::getScope).thenComparing(Alias::getLookupKey))
                .toList());
    }

    @Override
    public Collection<AliasCandidate> findCandidates(Set<String> blockingKeys) {
        return read(() -> {
            Set<CandidateRef> refs = new LinkedHashSet<>();
            for (String key : blockingKeys) {
                Set<CandidateRef> bucket = blockingIndex.get(key);
                if (bucket != null) {
                    refs.addAll(bucket);
                }
            }
            Map<String, AliasCandidate> candidates = new LinkedHashMap<>();
            for (CandidateRef ref : refs) {
                AliasCandidate candidate = toCandidate(ref);
                if (candidate != null) {
                    candidates.putIfAbsent(candidate.normalizedText() + "|" + candidate.canonicalId(), candidate);
                }
            }
            return List.copyOf(candidates.values());
        });
    }

    @Override
    public Set<Alias> checkIntegrity() {
        return read(() -> {
            Set<Alias> orphaned = new LinkedHashSet<>();
            activeAliases.values().stream()
                    .filter(a -> !isActive(a.getCanonicalId()))
                    .sorted(Comparator.comparing(Alias::getLookupKey))
                    .forEach(orphaned::add);
            if (!orphaned.isEmpty()) {
                log.warn("store.integrity.orphaned count={}", orphaned.size());
            }
            return orphaned;
        });
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

            // Plan first; nothing is touched until the plan is known to be conflict-free
            List<Map.Entry<AliasKey, Alias>> toRepoint = activeAliases.entrySet().stream()
                    .filter(e -> e.getValue().getCanonicalId().equals(loserId))
                    .toList();
            List<String> conflicts = new ArrayList<>();
            for (Map.Entry<AliasKey, Alias> entry : toRepoint) {
                if (entry.getKey().scope() == AliasScope.NAME
                        && hasThirdPartyOwner(entry.getKey().lookupKey(), winnerId, loserId)) {
                    conflicts.add(entry.getKey().describe());
                }
            }
            String formerKey = keys.lookupKey(loser.getCanonicalName(), AliasScope.NAME);
            AliasKey formerAliasKey = new AliasKey(AliasScope.NAME, formerKey);
            boolean aliasFormerName = !formerKey.equals(keys.lookupKey(winner.getCanonicalName(), AliasScope.NAME))
                    && !activeAliases.containsKey(formerAliasKey);
            if (aliasFormerName && hasThirdPartyOwner(formerKey, winnerId, loserId)) {
                conflicts.add(formerAliasKey.describe());
            }
            if (!conflicts.isEmpty()) {
                throw new MergeConflictException(winnerId, loserId, conflicts);
            }

            for (Map.Entry<AliasKey, Alias> entry : toRepoint) {
                activeAliases.put(entry.getKey(), entry.getValue().repointedTo(winnerId));
            }
            unindexEntity(loser);
            entities.put(loserId, loser.retired(winnerId));
            if (aliasFormerName) {
                Alias former = Alias.builder()
                        .aliasText(loser.getCanonicalName())
                        .lookupKey(formerKey)
                        .canonicalId(winnerId)
                        .scope(AliasScope.NAME)
                        .source(AliasSource.MERGE)
                        .createdAt(clock.instant())
                        .build();
                activeAliases.put(formerAliasKey, former);
                index(CandidateRef.alias(formerAliasKey), former.getAliasText(), winner.getType());
            }

            int resultsRepointed = 0;
            for (Map.Entry<ResultKey, MatchResult> entry : matchResults.entrySet()) {
                MatchResult r = entry.getValue();
                if (loserId.equals(r.canonicalId()) || loserId.equals(r.candidateId())) {
                    entry.setValue(r.repointed(loserId, winnerId));
                    if (loserId.equals(r.canonicalId())) {
                        resultsRepointed++;
                    }
                }
            }
            int unresolvedRepointed = 0;
            for (Map.Entry<String, UnresolvedRecord> entry : unresolved.entrySet()) {
                UnresolvedRecord r = entry.getValue();
                boolean candidate = loserId.equals(r.getCandidateId());
                boolean resolution = loserId.equals(r.getResolvedCanonicalId());
                if (candidate || resolution) {
                    entry.setValue(UnresolvedRecord.builder(r)
                            .candidateId(candidate ? winnerId : r.getCandidateId())
                            .resolvedCanonicalId(resolution ? winnerId : r.getResolvedCanonicalId())
                            .build());
                    unresolvedRepointed++;
                }
            }

            log.info("store.merged winnerId={} loserId={} aliases={} matchResults={}",
                    winnerId, loserId, toRepoint.size(), resultsRepointed);
            return new MergeSummary(winnerId, loserId, toRepoint.size(), resultsRepointed,
                    unresolvedRepointed, aliasFormerName);
        });
    }

    // ========== Match results ==========

    @Override
    public void upsertMatchResult(MatchResult result) {
        write(() -> matchResults.put(new ResultKey(result.sourceId(), result.runId()), result));
    }

    @Override
    public Optional<MatchResult> findMatchResult(String sourceId, String runId) {
        return Optional.ofNullable(matchResults.get(new ResultKey(sourceId, runId)));
    }

    @Override
    public List<MatchResult> findMatchResultsByCanonical(String canonicalId) {
        return read(() -> matchResults.values().stream()
                .filter(r -> canonicalId.equals(r.canonicalId()))
                .sorted(Comparator.comparing(MatchResult::sourceId)
                        .thenComparing(r -> Objects.toString(r.runId(), "")))
                .toList());
    }

    // ========== Unresolved records ==========

    @Override
    public UnresolvedRecord recordUnresolved(SourceRecord record, UnresolvedReason reason,
                                             String candidateId, String runId) {
        return write(() -> {
            UnresolvedRecord existing = unresolved.get(record.sourceId());
            UnresolvedRecord updated = existing == null
                    ? UnresolvedRecord.firstSeen(record, reason, candidateId, runId, clock.instant())
                    : existing.seenAgain(reason, candidateId, record.rawName(), runId, clock.instant());
            unresolved.put(record.sourceId(), updated);
            return updated;
        });
    }

    @Override
    public Optional<UnresolvedRecord> clearUnresolved(String sourceId, String canonicalId) {
        return write(() -> {
            UnresolvedRecord existing = unresolved.get(sourceId);
            if (existing == null || existing.isResolved()) {
                return Optional.empty();
            }
            UnresolvedRecord cleared = existing.markResolved(canonicalId);
            unresolved.put(sourceId, cleared);
            return Optional.of(cleared);
        });
    }

    @Override
    public Optional<UnresolvedRecord> findUnresolved(String sourceId) {
        return Optional.ofNullable(unresolved.get(sourceId));
    }

    @Override
    public List<UnresolvedRecord> findPendingUnresolved() {
        return read(() -> unresolved.values().stream()
                .filter(r -> !r.isResolved())
                .sorted(Comparator.comparingLong(UnresolvedRecord::getOccurrences).reversed()
                        .thenComparing(UnresolvedRecord::getSourceId))
                .toList());
    }

    @Override
    public StoreStatus status() {
        return read(() -> {
            long active = entities.values().stream().filter(CanonicalEntity::isActive).count();
            long pending = unresolved.values().stream().filter(r -> !r.isResolved()).count();
            return new StoreStatus(active, entities.size() - active, activeAliases.size(),
                    matchResults.size(), pending);
        });
    }

    // ========== Internals ==========

    private CanonicalEntity requireActive(String id) {
        CanonicalEntity entity = id != null ? entities.get(id) : null;
        if (entity == null) {
            throw EntityNotFoundException.missing(id);
        }
        if (!entity.isActive()) {
            throw EntityNotFoundException.retired(id);
        }
        return entity;
    }

    private boolean isActive(String id) {
        CanonicalEntity entity = entities.get(id);
        return entity != null && entity.isActive();
    }

    private void requireNameFree(String canonicalName, String id) {
        Alias alias = activeAliases.get(new AliasKey(AliasScope.NAME, keys.lookupKey(canonicalName, AliasScope.NAME)));
        if (alias != null && !alias.getCanonicalId().equals(id) && isActive(alias.getCanonicalId())) {
            throw new DuplicateAliasException(canonicalName, AliasScope.NAME, alias.getCanonicalId(), id);
        }
    }

    private Set<String> canonicalNameOwners(String normalizedName) {
        return canonicalNames.getOrDefault(normalizedName, Set.of());
    }

    private boolean hasThirdPartyOwner(String normalizedName, String winnerId, String loserId) {
        return canonicalNameOwners(normalizedName).stream()
                .anyMatch(id -> !id.equals(winnerId) && !id.equals(loserId));
    }

    private void indexEntity(CanonicalEntity entity) {
        String key = keys.lookupKey(entity.getCanonicalName(), AliasScope.NAME);
        canonicalNames.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(entity.getId());
        index(CandidateRef.entity(entity.getId()), entity.getCanonicalName(), entity.getType());
    }

    private void unindexEntity(CanonicalEntity entity) {
        String key = keys.lookupKey(entity.getCanonicalName(), AliasScope.NAME);
        Set<String> owners = canonicalNames.get(key);
        if (owners != null) {
            owners.remove(entity.getId());
            if (owners.isEmpty()) {
                canonicalNames.remove(key);
            }
        }
        unindex(CandidateRef.entity(entity.getId()), entity.getCanonicalName(), entity.getType());
    }

    private void index(CandidateRef ref, String text, EntityType type) {
        for (String key : keys.indexKeys(text, type)) {
            blockingIndex.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(ref);
        }
    }

    private void unindex(CandidateRef ref, String text, EntityType type) {
        for (String key : keys.indexKeys(text, type)) {
            Set<CandidateRef> bucket = blockingIndex.get(key);
            if (bucket != null) {
                bucket.remove(ref);
            }
        }
    }

    private AliasCandidate toCandidate(CandidateRef ref) {
        if (ref.aliasKey() != null) {
            Alias alias = activeAliases.get(ref.aliasKey());
            if (alias == null) {
                return null;
            }
            CanonicalEntity owner = entities.get(alias.getCanonicalId());
            if (owner == null || !owner.isActive()) {
                return null;
            }
            return new AliasCandidate(alias.getAliasText(), alias.getLookupKey(), owner.getId(), owner.getType());
        }
        CanonicalEntity entity = entities.get(ref.entityId());
        if (entity == null || !entity.isActive()) {
            return null;
        }
        return new AliasCandidate(entity.getCanonicalName(),
                keys.lookupKey(entity.getCanonicalName(), AliasScope.NAME), entity.getId(), entity.getType());
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private record AliasKey(AliasScope scope, String lookupKey) {
        String describe() {
            return scope.getCode() + ":" + lookupKey;
        }
    }

    private record ResultKey(String sourceId, String runId) {}

    private record CandidateRef(AliasKey aliasKey, String entityId) {
        static CandidateRef alias(AliasKey key) {
            return new CandidateRef(key, null);
        }

        static CandidateRef entity(String id) {
            return new CandidateRef(null, id);
        }
    }
}
