package com.aasx.ingest.cdi;

import com.aasx.ingest.analytics.GraphAnalytics;
import com.aasx.ingest.api.AasxExtractor;
import com.aasx.ingest.api.BatchExtractor;
import com.aasx.ingest.graph.FalkorDBConnection;
import com.aasx.ingest.graph.GraphConnection;
import com.aasx.ingest.graph.GraphStoreConfig;
import com.aasx.ingest.graph.StoreReadinessProbe;
import com.aasx.ingest.bulk.GraphImporter;
import com.aasx.ingest.health.GraphStoreHealthCheck;
import com.aasx.ingest.ops.IngestOperations;
import com.aasx.ingest.transform.GraphTransformer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer wiring the ingest engine from MicroProfile Config.
 *
 * <pre>
 * aasx-ingest:
 *   graph:
 *     uri: redis://localhost:6379
 *     principal: ""
 *     credential: ""
 *     name: aasx
 *     readiness-timeout-seconds: 60
 *     initial-backoff-millis: 500
 *     max-backoff-millis: 8000
 *   extract:
 *     max-parallelism: 4
 * </pre>
 */
@ApplicationScoped
public class AasxIngestProducer {

    private static final Logger log = LoggerFactory.getLogger(AasxIngestProducer.class);

    // ── Graph store ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "aasx-ingest.graph.uri", defaultValue = "redis://localhost:6379")
    String graphUri;

    @Inject
    @ConfigProperty(name = "aasx-ingest.graph.principal")
    Optional<String> graphPrincipal;

    @Inject
    @ConfigProperty(name = "aasx-ingest.graph.credential")
    Optional<String> graphCredential;

    @Inject
    @ConfigProperty(name = "aasx-ingest.graph.name", defaultValue = "aasx")
    String graphName;

    @Inject
    @ConfigProperty(name = "aasx-ingest.graph.readiness-timeout-seconds", defaultValue = "60")
    long readinessTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "aasx-ingest.graph.initial-backoff-millis", defaultValue = "500")
    long initialBackoffMillis;

    @Inject
    @ConfigProperty(name = "aasx-ingest.graph.max-backoff-millis", defaultValue = "8000")
    long maxBackoffMillis;

    // ── Extraction ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "aasx-ingest.extract.max-parallelism", defaultValue = "4")
    int extractMaxParallelism;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public GraphStoreConfig graphStoreConfig() {
        GraphStoreConfig config = GraphStoreConfig.builder()
                .uri(graphUri)
                .principal(graphPrincipal.orElse(""))
                .credential(graphCredential.orElse(""))
                .graphName(graphName)
                .readinessTimeout(Duration.ofSeconds(readinessTimeoutSeconds))
                .initialBackoff(Duration.ofMillis(initialBackoffMillis))
                .maxBackoff(Duration.ofMillis(maxBackoffMillis))
                .build();
        log.info("Producing graph store config: {}", config);
        return config;
    }

    @Produces
    @ApplicationScoped
    public GraphConnection graphConnection(GraphStoreConfig config) {
        return new FalkorDBConnection(config);
    }

    public void closeGraphConnection(@Disposes GraphConnection connection) {
        log.info("Closing graph connection");
        connection.close();
    }

    @Produces
    @ApplicationScoped
    public StoreReadinessProbe storeReadinessProbe(GraphConnection connection, GraphStoreConfig config) {
        return new StoreReadinessProbe(new GraphStoreHealthCheck(connection), config);
    }

    @Produces
    @ApplicationScoped
    public AasxExtractor aasxExtractor() {
        return new AasxExtractor();
    }

    @Produces
    @ApplicationScoped
    public BatchExtractor batchExtractor(AasxExtractor extractor) {
        log.info("Producing batch extractor: maxParallelism={}", extractMaxParallelism);
        return new BatchExtractor(extractor, extractMaxParallelism);
    }

    public void closeBatchExtractor(@Disposes BatchExtractor batchExtractor) {
        batchExtractor.close();
    }

    @Produces
    @ApplicationScoped
    public GraphTransformer graphTransformer() {
        return new GraphTransformer();
    }

    @Produces
    @ApplicationScoped
    public GraphImporter graphImporter(GraphConnection connection, StoreReadinessProbe probe) {
        return new GraphImporter(connection, probe);
    }

    @Produces
    @ApplicationScoped
    public GraphAnalytics graphAnalytics(GraphConnection connection) {
        return new GraphAnalytics(connection);
    }

    @Produces
    @ApplicationScoped
    public IngestOperations ingestOperations(AasxExtractor extractor, GraphTransformer transformer,
                                             GraphImporter importer, GraphAnalytics analytics) {
        return new IngestOperations(extractor, transformer, importer, analytics);
    }
}
