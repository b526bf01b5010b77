package com.identity.resolution.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import com.identity.resolution.store.StoreException;
import com.identity.resolution.store.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link GraphConnection} over the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String cypher = inlineParams(query, params);
        log.trace("falkordb.execute {}", cypher);
        run(cypher);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String cypher = inlineParams(query, params);
        log.trace("falkordb.query {}", cypher);
        ResultSet resultSet = run(cypher);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("falkordb.ping.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        createIndex("CREATE INDEX FOR (e:CanonicalEntity) ON (e.id)");
        createIndex("CREATE INDEX FOR (e:CanonicalEntity) ON (e.normalizedName)");
        createIndex("CREATE INDEX FOR (a:Alias) ON (a.lookupKey)");
        createIndex("CREATE INDEX FOR (a:Alias) ON (a.canonicalId)");
        createIndex("CREATE INDEX FOR (b:BlockingKey) ON (b.key)");
        createIndex("CREATE INDEX FOR (m:MatchResult) ON (m.key)");
        createIndex("CREATE INDEX FOR (m:MatchResult) ON (m.canonicalId)");
        createIndex("CREATE INDEX FOR (u:Unresolved) ON (u.sourceId)");
        log.info("falkordb.indexes.ready graph={}", graphName);
    }

    private void createIndex(String query) {
        try {
            graph.query(query);
        } catch (RuntimeException e) {
            // already exists
            log.debug("falkordb.index.skipped query='{}' reason={}", query, e.getMessage());
        }
    }

    private ResultSet run(String cypher) {
        try {
            return graph.query(cypher);
        } catch (RuntimeException e) {
            if (isConnectionFailure(e)) {
                throw new TransientStoreException("FalkorDB unreachable for graph " + graphName, e);
            }
            throw new StoreException("Cypher query failed on graph " + graphName + ": " + e.getMessage(), e);
        }
    }

    static boolean isConnectionFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof IOException || t.getClass().getSimpleName().endsWith("ConnectionException")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Substitutes {@code $name} placeholders with Cypher literals in a single pass over the
     * query text. Inlined values are never rescanned, so a value containing {@code $other}
     * stays a plain string. Placeholders without a parameter are left as they are.
     */
    static String inlineParams(String query, Map<String, Object> params) {
        if (params.isEmpty()) {
            return query;
        }
        Matcher placeholder = PLACEHOLDER.matcher(query);
        StringBuilder result = new StringBuilder(query.length());
        while (placeholder.find()) {
            String name = placeholder.group(1);
            String replacement = params.containsKey(name) ? literal(params.get(name)) : placeholder.group();
            placeholder.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        placeholder.appendTail(result);
        return result.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(FalkorDBConnection::literal).collect(Collectors.joining(", ", "[", "]"));
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("falkordb.close.failed graph={}", graphName, e);
        }
        log.info("falkordb.closed graph={}", graphName);
    }
}
