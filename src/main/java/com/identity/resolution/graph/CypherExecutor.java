package com.identity.resolution.graph;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cypher statements behind {@link GraphCanonicalStore}.
 *
 * <p>Graph layout: {@code (:CanonicalEntity)}, {@code (:Alias)-[:ALIAS_OF]->(:CanonicalEntity)},
 * {@code (:CanonicalEntity|:Alias)-[:HAS_KEY]->(:BlockingKey)}, {@code (:MatchResult)} keyed by
 * {@code sourceId|runId} and {@code (:Unresolved)} keyed by source id.</p>
 */
public class CypherExecutor {

    private static final String ENTITY_FIELDS = """
            e.id as id, e.canonicalName as canonicalName, e.normalizedName as normalizedName,
            e.type as type, e.status as status, e.retiredInto as retiredInto, e.metadata as metadata,
            e.createdAt as createdAt, e.updatedAt as updatedAt""";

    private static final String ALIAS_FIELDS = """
            a.id as id, a.aliasText as aliasText, a.lookupKey as lookupKey, a.canonicalId as canonicalId,
            a.scope as scope, a.source as source, a.confidence as confidence, a.active as active,
            a.createdAt as createdAt""";

    private static final String RESULT_FIELDS = """
            m.sourceId as sourceId, m.runId as runId, m.canonicalId as canonicalId,
            m.candidateId as candidateId, m.strategy as strategy,
            m.outcome as outcome, m.confidence as confidence, m.reason as reason,
            m.matchedAlias as matchedAlias, m.matchedAt as matchedAt""";

    private static final String UNRESOLVED_FIELDS = """
            u.sourceId as sourceId, u.sourceSystem as sourceSystem, u.rawName as rawName, u.reason as reason,
            u.candidateId as candidateId, u.firstSeen as firstSeen, u.lastSeen as lastSeen,
            u.lastRunId as lastRunId, u.occurrences as occurrences, u.resolved as resolved,
            u.resolvedCanonicalId as resolvedCanonicalId""";

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    // ========== Canonical entities ==========

    public void createEntity(Map<String, Object> props) {
        connection.execute("""
                CREATE (e:CanonicalEntity {
                    id: $id, canonicalName: $canonicalName, normalizedName: $normalizedName,
                    type: $type, status: $status, metadata: $metadata,
                    createdAt: $createdAt, updatedAt: $updatedAt
                })
                """, props);
    }

    public List<Map<String, Object>> findEntityById(String id) {
        return connection.query("MATCH (e:CanonicalEntity {id: $id}) RETURN " + ENTITY_FIELDS,
                Map.of("id", id));
    }

    public List<Map<String, Object>> findActiveEntities(String type) {
        if (type == null) {
            return connection.query("""
                    MATCH (e:CanonicalEntity {status: 'ACTIVE'})
                    RETURN %s ORDER BY e.id
                    """.formatted(ENTITY_FIELDS));
        }
        return connection.query("""
                MATCH (e:CanonicalEntity {status: 'ACTIVE', type: $type})
                RETURN %s ORDER BY e.id
                """.formatted(ENTITY_FIELDS), Map.of("type", type));
    }

    public void renameEntity(String id, String canonicalName, String normalizedName, String updatedAt) {
        connection.execute("""
                MATCH (e:CanonicalEntity {id: $id})
                SET e.canonicalName = $canonicalName, e.normalizedName = $normalizedName, e.updatedAt = $updatedAt
                """, Map.of("id", id, "canonicalName", canonicalName,
                "normalizedName", normalizedName, "updatedAt", updatedAt));
    }

    public void setEntityStatus(String id, String status, String retiredInto, String updatedAt) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", id);
        params.put("status", status);
        params.put("retiredInto", retiredInto);
        params.put("updatedAt", updatedAt);
        connection.execute("""
                MATCH (e:CanonicalEntity {id: $id})
                SET e.status = $status, e.retiredInto = $retiredInto, e.updatedAt = $updatedAt
                """, params);
    }

    /**
     * Active entities other than {@code excludedIds} whose normalized canonical name is in {@code names}.
     */
    public List<Map<String, Object>> findCanonicalNameOwners(Collection<String> names, Collection<String> excludedIds) {
        return connection.query("""
                MATCH (e:CanonicalEntity {status: 'ACTIVE'})
                WHERE e.normalizedName IN $names AND NOT e.id IN $excluded
                RETURN e.id as id, e.normalizedName as normalizedName
                ORDER BY e.id
                """, Map.of("names", List.copyOf(names), "excluded", List.copyOf(excludedIds)));
    }

    // ========== Blocking keys ==========

    public void linkEntityKeys(String entityId, Collection<String> keys) {
        connection.execute("""
                MATCH (e:CanonicalEntity {id: $id})
                UNWIND $keys AS k
                MERGE (b:BlockingKey {key: k})
                MERGE (e)-[:HAS_KEY]->(b)
                """, Map.of("id", entityId, "keys", List.copyOf(keys)));
    }

    public void unlinkEntityKeys(String entityId) {
        connection.execute("MATCH (e:CanonicalEntity {id: $id})-[r:HAS_KEY]->() DELETE r",
                Map.of("id", entityId));
    }

    public void linkAliasKeys(String aliasId, Collection<String> keys) {
        connection.execute("""
                MATCH (a:Alias {id: $id})
                UNWIND $keys AS k
                MERGE (b:BlockingKey {key: k})
                MERGE (a)-[:HAS_KEY]->(b)
                """, Map.of("id", aliasId, "keys", List.copyOf(keys)));
    }

    public List<Map<String, Object>> findAliasCandidates(Collection<String> keys) {
        return connection.query("""
                MATCH (b:BlockingKey)<-[:HAS_KEY]-(a:Alias {active: true, scope: 'NAME'})-[:ALIAS_OF]->(e:CanonicalEntity {status: 'ACTIVE'})
                WHERE b.key IN $keys
                RETURN DISTINCT a.aliasText as text, a.lookupKey as normalizedText, e.id as canonicalId, e.type as type
                """, Map.of("keys", List.copyOf(keys)));
    }

    public List<Map<String, Object>> findEntityCandidates(Collection<String> keys) {
        return connection.query("""
                MATCH (b:BlockingKey)<-[:HAS_KEY]-(e:CanonicalEntity {status: 'ACTIVE'})
                WHERE b.key IN $keys
                RETURN DISTINCT e.canonicalName as text, e.normalizedName as normalizedText, e.id as canonicalId, e.type as type
                """, Map.of("keys", List.copyOf(keys)));
    }

    // ========== Aliases ==========

    public List<Map<String, Object>> findActiveAlias(String lookupKey, String scope) {
        return connection.query("""
                MATCH (a:Alias {lookupKey: $lookupKey, scope: $scope, active: true})
                RETURN %s
                """.formatted(ALIAS_FIELDS), Map.of("lookupKey", lookupKey, "scope", scope));
    }

    public List<Map<String, Object>> resolveAlias(String lookupKey, String scope) {
        return connection.query("""
                MATCH (a:Alias {lookupKey: $lookupKey, scope: $scope, active: true})-[:ALIAS_OF]->(e:CanonicalEntity {status: 'ACTIVE'})
                RETURN e.id as id
                """, Map.of("lookupKey", lookupKey, "scope", scope));
    }

    public List<Map<String, Object>> resolveCanonicalName(String normalizedName) {
        return connection.query("""
                MATCH (e:CanonicalEntity {normalizedName: $normalizedName, status: 'ACTIVE'})
                RETURN e.id as id ORDER BY e.id
                """, Map.of("normalizedName", normalizedName));
    }

    public void createAlias(Map<String, Object> props) {
        connection.execute("""
                MATCH (e:CanonicalEntity {id: $canonicalId})
                CREATE (a:Alias {
                    id: $id, aliasText: $aliasText, lookupKey: $lookupKey, canonicalId: $canonicalId,
                    scope: $scope, source: $source, confidence: $confidence, active: true, createdAt: $createdAt
                })-[:ALIAS_OF]->(e)
                """, props);
    }

    public void deleteAlias(String aliasId) {
        connection.execute("MATCH (a:Alias {id: $id}) DETACH DELETE a", Map.of("id", aliasId));
    }

    public void deactivateAlias(String aliasId) {
        connection.execute("""
                MATCH (a:Alias {id: $id})
                OPTIONAL MATCH (a)-[r:HAS_KEY]->()
                SET a.active = false
                DELETE r
                """, Map.of("id", aliasId));
    }

    public List<Map<String, Object>> findAliasesFor(String canonicalId) {
        return connection.query("""
                MATCH (a:Alias {canonicalId: $canonicalId, active: true})
                RETURN %s ORDER BY a.scope, a.lookupKey
                """.formatted(ALIAS_FIELDS), Map.of("canonicalId", canonicalId));
    }

    public List<Map<String, Object>> findOrphanedAliases() {
        return connection.query("""
                MATCH (a:Alias {active: true})
                OPTIONAL MATCH (a)-[:ALIAS_OF]->(e:CanonicalEntity)
                WITH a, e
                WHERE e IS NULL OR e.status <> 'ACTIVE'
                RETURN %s ORDER BY a.lookupKey
                """.formatted(ALIAS_FIELDS));
    }

    /**
     * Moves the given aliases to {@code toId}, replacing their ALIAS_OF edge.
     */
    public void repointAliases(Collection<String> aliasIds, String toId) {
        connection.execute("""
                MATCH (a:Alias)-[r:ALIAS_OF]->(:CanonicalEntity)
                WHERE a.id IN $ids
                MATCH (target:CanonicalEntity {id: $toId})
                DELETE r
                CREATE (a)-[:ALIAS_OF]->(target)
                SET a.canonicalId = $toId
                """, Map.of("ids", List.copyOf(aliasIds), "toId", toId));
    }

    // ========== Match results ==========

    public void upsertMatchResult(Map<String, Object> props) {
        connection.execute("""
                MERGE (m:MatchResult {key: $key})
                SET m.sourceId = $sourceId, m.runId = $runId, m.canonicalId = $canonicalId,
                    m.candidateId = $candidateId, m.strategy = $strategy, m.outcome = $outcome, m.confidence = $confidence,
                    m.reason = $reason, m.matchedAlias = $matchedAlias, m.matchedAt = $matchedAt
                """, props);
    }

    public List<Map<String, Object>> findMatchResult(String key) {
        return connection.query("MATCH (m:MatchResult {key: $key}) RETURN " + RESULT_FIELDS,
                Map.of("key", key));
    }

    public List<Map<String, Object>> findMatchResultsByCanonical(String canonicalId) {
        return connection.query("""
                MATCH (m:MatchResult {canonicalId: $canonicalId})
                RETURN %s ORDER BY m.sourceId, m.runId
                """.formatted(RESULT_FIELDS), Map.of("canonicalId", canonicalId));
    }

    /**
     * @return keys of the match results whose {@code property} was moved
     */
    public List<Map<String, Object>> repointMatchResults(String property, String fromId, String toId) {
        return connection.query("""
                MATCH (m:MatchResult) WHERE m.%1$s = $fromId
                SET m.%1$s = $toId
                RETURN m.key as key
                """.formatted(property), Map.of("fromId", fromId, "toId", toId));
    }

    public void setMatchResultProperty(String property, Collection<String> keys, String value) {
        connection.execute("""
                MATCH (m:MatchResult) WHERE m.key IN $keys
                SET m.%s = $value
                """.formatted(property), Map.of("keys", List.copyOf(keys), "value", value));
    }

    // ========== Unresolved records ==========

    public void upsertUnresolved(Map<String, Object> props) {
        connection.execute("""
                MERGE (u:Unresolved {sourceId: $sourceId})
                SET u.sourceSystem = $sourceSystem, u.rawName = $rawName, u.reason = $reason,
                    u.candidateId = $candidateId, u.firstSeen = $firstSeen, u.lastSeen = $lastSeen,
                    u.lastRunId = $lastRunId, u.occurrences = $occurrences, u.resolved = $resolved,
                    u.resolvedCanonicalId = $resolvedCanonicalId
                """, props);
    }

    public List<Map<String, Object>> findUnresolved(String sourceId) {
        return connection.query("MATCH (u:Unresolved {sourceId: $sourceId}) RETURN " + UNRESOLVED_FIELDS,
                Map.of("sourceId", sourceId));
    }

    public List<Map<String, Object>> findPendingUnresolved() {
        return connection.query("""
                MATCH (u:Unresolved {resolved: false})
                RETURN %s ORDER BY u.occurrences DESC, u.sourceId
                """.formatted(UNRESOLVED_FIELDS));
    }

    /**
     * @return source ids whose {@code property} was moved
     */
    public List<Map<String, Object>> repointUnresolved(String property, String fromId, String toId) {
        return connection.query("""
                MATCH (u:Unresolved) WHERE u.%1$s = $fromId
                SET u.%1$s = $toId
                RETURN u.sourceId as sourceId
                """.formatted(property), Map.of("fromId", fromId, "toId", toId));
    }

    public void setUnresolvedProperty(String property, Collection<String> sourceIds, String value) {
        connection.execute("""
                MATCH (u:Unresolved) WHERE u.sourceId IN $ids
                SET u.%s = $value
                """.formatted(property), Map.of("ids", List.copyOf(sourceIds), "value", value));
    }

    // ========== Status ==========

    public List<Map<String, Object>> countStatus() {
        return connection.query("""
                OPTIONAL MATCH (e:CanonicalEntity)
                WITH sum(CASE WHEN e.status = 'ACTIVE' THEN 1 ELSE 0 END) as activeEntities,
                     sum(CASE WHEN e.status = 'RETIRED' THEN 1 ELSE 0 END) as retiredEntities
                OPTIONAL MATCH (a:Alias {active: true})
                WITH activeEntities, retiredEntities, count(a) as activeAliases
                OPTIONAL MATCH (m:MatchResult)
                WITH activeEntities, retiredEntities, activeAliases, count(m) as matchResults
                OPTIONAL MATCH (u:Unresolved {resolved: false})
                RETURN activeEntities, retiredEntities, activeAliases, matchResults, count(u) as pendingUnresolved
                """);
    }
}
