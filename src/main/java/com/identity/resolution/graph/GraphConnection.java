package com.identity.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Cypher access to the graph holding the canonical store.
 *
 * <p>Implementations report unreachable databases as
 * {@link com.identity.resolution.store.TransientStoreException} and query failures as
 * {@link com.identity.resolution.store.StoreException}.</p>
 */
public interface GraphConnection extends AutoCloseable {

    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * @return result rows keyed by the RETURN aliases
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the lookup indexes used by the store. Safe to call repeatedly.
     */
    void createIndexes();

    @Override
    void close();
}
