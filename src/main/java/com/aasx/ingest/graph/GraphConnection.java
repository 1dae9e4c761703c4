package com.aasx.ingest.graph;

import java.util.List;
import java.util.Map;

/**
 * Access to one named property graph. Queries are Cypher with {@code $name} parameters.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher query that modifies the graph.
     *
     * @param query  the Cypher query
     * @param params query parameters, referenced as {@code $name}
     */
    void execute(String query, Map<String, Object> params);

    /**
     * Executes a Cypher query that modifies the graph without parameters.
     *
     * @param query the Cypher query
     */
    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows.
     *
     * @param query  the Cypher query
     * @param params query parameters, referenced as {@code $name}
     * @return one map per result row, keyed by column alias
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    /**
     * Executes a Cypher query without parameters and returns its rows.
     *
     * @param query the Cypher query
     * @return one map per result row, keyed by column alias
     */
    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    /**
     * Checks whether the store answers a trivial query.
     *
     * @return true if connected
     */
    boolean isConnected();

    /**
     * Gets the name of the graph being used.
     *
     * @return graph name
     */
    String getGraphName();

    /**
     * Ensures the indexes the importer and analytics rely on exist. Safe to call repeatedly.
     */
    void createIndexes();

    /**
     * Releases the underlying client. Does not throw.
     */
    @Override
    void close();
}
