package com.aasx.ingest.health;

import com.aasx.ingest.graph.GraphConnection;

/**
 * Round-trips {@code RETURN 1} against the graph store and reports latency.
 */
public class GraphStoreHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public GraphStoreHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "graph-store";
    }

    @Override
    public HealthStatus check() {
        long start = System.nanoTime();
        try {
            connection.query("RETURN 1");
        } catch (RuntimeException e) {
            return HealthStatus.down("Graph store unreachable: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        return HealthStatus.up("OK")
                .withDetail("latencyMs", latencyMs)
                .withDetail("graphName", connection.getGraphName());
    }
}
