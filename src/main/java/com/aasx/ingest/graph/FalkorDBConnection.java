package com.aasx.ingest.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FalkorDB implementation using the JFalkorDB client. Parameters are rendered into the
 * query text as Cypher literals.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final Pattern PARAMETER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(GraphStoreConfig config) {
        this.driver = config.hasCredentials()
                ? FalkorDB.driver(config.getHost(), config.getPort(), config.getPrincipal(), config.getCredential())
                : FalkorDB.driver(config.getHost(), config.getPort());
        this.graphName = config.getGraphName();
        this.graph = driver.graph(graphName);
        log.info("graphStore.connectionInitialized host={} port={} graph={}",
                config.getHost(), config.getPort(), graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} rows", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("Connection check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("graphStore.indexes.creating graph={}", graphName);
        safeExecute("CREATE INDEX FOR (n:AasNode) ON (n.id)");
        safeExecute("CREATE INDEX FOR (n:AasNode) ON (n.elementType)");
        safeExecute("CREATE INDEX FOR (n:AasNode) ON (n.qualityLevel)");
        safeExecute("CREATE INDEX FOR (n:Shell) ON (n.id)");
        safeExecute("CREATE INDEX FOR (n:Asset) ON (n.id)");
        safeExecute("CREATE INDEX FOR (n:Submodel) ON (n.id)");
        log.info("graphStore.indexes.ready graph={}", graphName);
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (RuntimeException e) {
            // existing index
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Replaces every {@code $name} placeholder that has a parameter with its literal.
     * Single pass, so parameter values containing {@code $} are never re-substituted.
     */
    static String processParams(String query, Map<String, Object> params) {
        if (params.isEmpty()) {
            return query;
        }
        Matcher matcher = PARAMETER.matcher(query);
        StringBuilder result = new StringBuilder(query.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? formatValue(params.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            InputSanitizer.sanitizeForCypher(s);
            return quote(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Enum<?> e) {
            return quote(e.name());
        }
        if (value instanceof Map<?, ?> map) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                InputSanitizer.validatePropertyKey(key);
                joiner.add(key + ": " + formatValue(entry.getValue()));
            }
            return joiner.toString();
        }
        if (value instanceof Collection<?> collection) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object element : collection) {
                joiner.add(formatValue(element));
            }
            return joiner.toString();
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("graphStore.connectionClosed graph={}", graphName);
    }
}
