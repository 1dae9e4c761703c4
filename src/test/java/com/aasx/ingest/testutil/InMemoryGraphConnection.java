package com.aasx.ingest.testutil;

import com.aasx.ingest.graph.GraphConnection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Graph connection stub that records every call and keeps a small node/edge store, enough
 * to answer the importer's lookups and apply its upserts and undo statements.
 */
public class InMemoryGraphConnection implements GraphConnection {

    private static final Pattern EDGE_TYPE = Pattern.compile("-\\[r:([A-Za-z_]+)]->");

    public record Call(String query, Map<String, Object> params, boolean mutating) {
    }

    private final String graphName;
    private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> edges = new LinkedHashMap<>();
    private final List<Call> calls = new ArrayList<>();
    private Function<String, List<Map<String, Object>>> queryResponder = q -> List.of();
    private int failOnExecute = -1;
    private int failFromExecute = -1;
    private int executeCount;
    private boolean closed;
    private boolean connected = true;

    public InMemoryGraphConnection() {
        this("test-graph");
    }

    public InMemoryGraphConnection(String graphName) {
        this.graphName = graphName;
    }

    /**
     * Answers queries the store does not model itself.
     */
    public InMemoryGraphConnection respondWith(Function<String, List<Map<String, Object>>> responder) {
        this.queryResponder = responder;
        return this;
    }

    /**
     * Makes the n-th mutating statement (1-based) throw.
     */
    public InMemoryGraphConnection failOnExecute(int n) {
        this.failOnExecute = n;
        return this;
    }

    /**
     * Makes the n-th and every later {@code execute} call throw, as when the connection drops.
     */
    public InMemoryGraphConnection failFromExecute(int n) {
        this.failFromExecute = n;
        return this;
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        calls.add(new Call(query, params, true));
        executeCount++;
        if (executeCount == failOnExecute) {
            throw new IllegalStateException("simulated store failure on statement " + executeCount);
        }
        if (failFromExecute > 0 && executeCount >= failFromExecute) {
            throw new IllegalStateException("connection lost");
        }
        apply(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        calls.add(new Call(query, params, false));
        if (!connected) {
            throw new IllegalStateException("connection refused");
        }
        if (query.contains("WHERE n.id IN $ids")) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Object id : (Collection<?>) params.get("ids")) {
                Map<String, Object> props = nodes.get(String.valueOf(id));
                if (props != null) {
                    rows.add(row("id", id, "props", new LinkedHashMap<>(props)));
                }
            }
            return rows;
        }
        if (query.contains("WHERE a.id IN $fromIds")) {
            Collection<?> fromIds = (Collection<?>) params.get("fromIds");
            List<Map<String, Object>> rows = new ArrayList<>();
            edges.forEach((key, props) -> {
                String[] parts = key.split("\\|");
                if (fromIds.contains(parts[0])) {
                    Map<String, Object> r = row("fromId", parts[0], "type", parts[1]);
                    r.put("toId", parts[2]);
                    r.put("props", new LinkedHashMap<>(props));
                    rows.add(r);
                }
            });
            return rows;
        }
        if (query.contains("count(n) AS count")) {
            return List.of(row("count", (long) nodes.size(), null, null));
        }
        return queryResponder.apply(query);
    }

    @SuppressWarnings("unchecked")
    private void apply(String query, Map<String, Object> params) {
        if (query.contains("MERGE (n:")) {
            Map<String, Object> props = nodes.computeIfAbsent((String) params.get("id"), k -> new LinkedHashMap<>());
            props.put("id", params.get("id"));
            if (query.contains("n += $properties")) {
                props.putAll((Map<String, Object>) params.get("properties"));
            }
        } else if (query.contains("SET n = $properties")) {
            Map<String, Object> restored = new LinkedHashMap<>((Map<String, Object>) params.get("properties"));
            nodes.put((String) params.get("id"), restored);
        } else if (query.contains("DETACH DELETE n") && params.containsKey("id")) {
            String id = (String) params.get("id");
            nodes.remove(id);
            edges.keySet().removeIf(key -> key.startsWith(id + "|") || key.endsWith("|" + id));
        } else if (query.contains("DETACH DELETE n")) {
            nodes.clear();
            edges.clear();
        } else if (query.contains("MERGE (a)-[r:")) {
            Map<String, Object> props = edges.computeIfAbsent(edgeKey(query, params), k -> new LinkedHashMap<>());
            if (query.contains("SET r += $properties")) {
                props.putAll((Map<String, Object>) params.get("properties"));
            }
        } else if (query.contains("SET r = $properties")) {
            edges.put(edgeKey(query, params), new LinkedHashMap<>((Map<String, Object>) params.get("properties")));
        } else if (query.contains("DELETE r")) {
            edges.remove(edgeKey(query, params));
        }
    }

    private static String edgeKey(String query, Map<String, Object> params) {
        Matcher matcher = EDGE_TYPE.matcher(query);
        String type = matcher.find() ? matcher.group(1) : "?";
        return params.get("fromId") + "|" + type + "|" + params.get("toId");
    }

    private static Map<String, Object> row(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(k1, v1);
        if (k2 != null) {
            row.put(k2, v2);
        }
        return row;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        calls.add(new Call("CREATE INDEX", Map.of(), true));
    }

    @Override
    public void close() {
        closed = true;
    }

    public Map<String, Map<String, Object>> nodes() {
        return nodes;
    }

    public Map<String, Map<String, Object>> edges() {
        return edges;
    }

    public List<Call> calls() {
        return calls;
    }

    public long mutatingCalls() {
        return calls.stream().filter(Call::mutating).count();
    }

    public boolean isClosed() {
        return closed;
    }
}
