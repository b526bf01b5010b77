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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical store and alias registry: the four logical tables
 * {@code canonical_entities}, {@code aliases}, {@code match_results} and
 * {@code unresolved_records} behind one write path.
 *
 * <p>Reads may run concurrently. Writes are serialized by the implementation so that
 * two concurrent alias insertions for the same text cannot both succeed with
 * different targets.</p>
 *
 * <p>Any method may throw {@link TransientStoreException} when the backing storage
 * is unreachable.</p>
 */
public interface CanonicalStore {

    // ========== Canonical entities ==========

    /**
     * Creates a canonical entity with a generated id.
     *
     * @throws DuplicateAliasException if the name is an active alias of another entity
     */
    CanonicalEntity createEntity(String canonicalName, EntityType type, Map<String, String> metadata);

    /**
     * Stores an entity with a caller-chosen id (seed files, migrations).
     * Idempotent when an entity with the same id already exists; retired ids are never reused.
     *
     * @throws IllegalStateException if the id belongs to a retired entity
     * @throws DuplicateAliasException if the name is an active alias of another entity
     */
    CanonicalEntity createEntity(CanonicalEntity entity);

    Optional<CanonicalEntity> findEntity(String id);

    List<CanonicalEntity> findActiveEntities(EntityType type);

    /**
     * Edits the display name. The id, the join key, does not change.
     *
     * @throws EntityNotFoundException if the entity is unknown or retired
     * @throws DuplicateAliasException if the new name is an active alias of another entity
     */
    CanonicalEntity renameEntity(String id, String newCanonicalName);

    /**
     * Retires an entity without merging it. Its aliases are left in place and are
     * reported by {@link #checkIntegrity()}.
     *
     * @throws EntityNotFoundException if the entity is unknown or already retired
     */
    CanonicalEntity retireEntity(String id);

    // ========== Alias registry ==========

    /**
     * Exact lookup of an active entity id. Name lookups compare normalized text and
     * also match the canonical name of an entity (self-alias). A canonical name shared
     * by several active entities resolves to none of them; see {@link #findNameOwners(String)}.
     */
    Optional<String> resolveAlias(String text, AliasScope scope);

    /**
     * Every active entity a name resolves to, smallest id first. An active alias has a
     * single owner; without one, every entity whose canonical name normalizes to the
     * text is returned.
     */
    List<String> findNameOwners(String text);

    /**
     * Maps {@code text} to {@code canonicalId} within {@code scope}.
     * A no-op returning the existing alias when the mapping is already present.
     *
     * @throws DuplicateAliasException if the text already maps to a different entity
     * @throws EntityNotFoundException if the target entity is unknown or retired
     */
    Alias insertAlias(String text, String canonicalId, AliasScope scope, AliasSource source, double confidence);

    /**
     * Steward-entered alias with implicit confidence 1.0.
     */
    default Alias insertAlias(String text, String canonicalId, AliasScope scope) {
        return insertAlias(text, canonicalId, scope, AliasSource.MANUAL, 1.0);
    }

    /**
     * @return true if an active alias was deactivated
     */
    boolean deactivateAlias(String text, AliasScope scope);

    /**
     * Active aliases of an entity, for display (canonical -> aliases direction).
     */
    List<Alias> findAliases(String canonicalId);

    /**
     * Name candidates sharing at least one blocking key, for fuzzy and keyword scoring.
     */
    Collection<AliasCandidate> findCandidates(Set<String> blockingKeys);

    /**
     * Aliases whose canonical entity no longer exists or is retired. Never deletes anything.
     */
    Set<Alias> checkIntegrity();

    /**
     * Repoints every alias, match result and unresolved record of {@code loserId} to
     * {@code winnerId} and retires the loser. All or nothing.
     *
     * @throws MergeConflictException  if repointing would duplicate an active alias
     * @throws EntityNotFoundException if either entity is unknown or retired
     * @throws IllegalArgumentException if the ids are equal or the entity types differ
     */
    MergeSummary merge(String winnerId, String loserId);

    // ========== Match results ==========

    /**
     * Inserts or overwrites the result keyed by {@code (sourceId, runId)}.
     */
    void upsertMatchResult(MatchResult result);

    Optional<MatchResult> findMatchResult(String sourceId, String runId);

    List<MatchResult> findMatchResultsByCanonical(String canonicalId);

    // ========== Unresolved records ==========

    /**
     * Creates the unresolved entry for a record or records another sighting of it.
     */
    UnresolvedRecord recordUnresolved(SourceRecord record, UnresolvedReason reason,
                                      String candidateId, String runId);

    /**
     * Marks the record's unresolved entry as resolved, if one exists and is pending.
     */
    Optional<UnresolvedRecord> clearUnresolved(String sourceId, String canonicalId);

    Optional<UnresolvedRecord> findUnresolved(String sourceId);

    /**
     * Pending entries, most frequently seen first, then by source id.
     */
    List<UnresolvedRecord> findPendingUnresolved();

    StoreStatus status();
}
