package com.aasx.ingest.bulk;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.graph.ConnectionFailureException;
import com.aasx.ingest.graph.GraphConnection;
import com.aasx.ingest.graph.InputSanitizer;
import com.aasx.ingest.graph.StoreReadinessProbe;
import com.aasx.ingest.logging.LogContext;
import com.aasx.ingest.metrics.MetricsService;
import com.aasx.ingest.metrics.NoOpMetricsService;
import com.aasx.ingest.tracing.NoOpTracingService;
import com.aasx.ingest.tracing.Span;
import com.aasx.ingest.tracing.TracingService;
import com.aasx.ingest.transform.GraphEdge;
import com.aasx.ingest.transform.GraphNode;
import com.aasx.ingest.transform.ImportBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Idempotent upsert of graph batches into the store.
 *
 * <p>Nodes are matched by {@code id} and edges by {@code (fromId, toId, type)}; existing
 * elements get their properties overwritten. All writes of one batch run inside an
 * {@link ImportTransaction}, so a failing write undoes what the batch already wrote.
 * When the undo cannot complete either, a {@link PartialImportException} names the
 * writes that may remain.
 * Every write operation first waits for the store through the {@link StoreReadinessProbe}.</p>
 */
public class GraphImporter {
    private static final Logger log = LoggerFactory.getLogger(GraphImporter.class);

    private static final String EXISTING_NODES = """
            MATCH (n:AasNode)
            WHERE n.id IN $ids
            RETURN n.id AS id, properties(n) AS props
            """;

    private static final String EXISTING_EDGES = """
            MATCH (a:AasNode)-[r]->(b:AasNode)
            WHERE a.id IN $fromIds
            RETURN a.id AS fromId, type(r) AS type, b.id AS toId, properties(r) AS props
            """;

    private static final String UPSERT_NODE = """
            MERGE (n:AasNode {id: $id})
            """;

    private static final String RESTORE_NODE = """
            MATCH (n:AasNode {id: $id})
            SET n = $properties
            """;

    private static final String DELETE_NODE = """
            MATCH (n:AasNode {id: $id})
            DETACH DELETE n
            """;

    private static final String UPSERT_EDGE = """
            MATCH (a:AasNode {id: $fromId}), (b:AasNode {id: $toId})
            MERGE (a)-[r:%s]->(b)
            """;

    private static final String DELETE_EDGE = """
            MATCH (a:AasNode {id: $fromId})-[r:%s]->(b:AasNode {id: $toId})
            DELETE r
            """;

    private static final String RESTORE_EDGE = """
            MATCH (a:AasNode {id: $fromId})-[r:%s]->(b:AasNode {id: $toId})
            SET r = $properties
            """;

    private static final String COUNT_NODES = "MATCH (n:AasNode) RETURN count(n) AS count";
    private static final String CLEAR_GRAPH = "MATCH (n:AasNode) DETACH DELETE n";

    private final GraphConnection connection;
    private final StoreReadinessProbe readinessProbe;
    private final GraphBatchFileReader fileReader;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public GraphImporter(GraphConnection connection, StoreReadinessProbe readinessProbe) {
        this(connection, readinessProbe, new GraphBatchFileReader(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public GraphImporter(GraphConnection connection, StoreReadinessProbe readinessProbe,
                         GraphBatchFileReader fileReader, MetricsService metricsService,
                         TracingService tracingService) {
        this.connection = connection;
        this.readinessProbe = readinessProbe;
        this.fileReader = fileReader;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Upserts one batch built in memory.
     *
     * @throws ConnectionFailureException if the store does not become ready; nothing is written
     */
    public ImportResult importBatch(ImportBatch batch) {
        return importBatch(batch, batch.name());
    }

    /**
     * Reads, validates and upserts one batch file.
     *
     * @throws ImportValidationException if the file is malformed; nothing is written
     * @throws PartialImportException    if a write failed and undoing the file's earlier
     *                                   writes failed too
     */
    public ImportResult importFile(Path file) {
        ImportBatch batch = fileReader.read(file);
        return importBatch(batch, file.getFileName().toString());
    }

    /**
     * Imports every {@code *_graph.json} file below {@code directory}. Each file is validated
     * before it touches the store; malformed files are reported in
     * {@link DirectoryImportResult#failures()} and the rest are still imported. In a dry run
     * files are only validated and planned counts reported.
     *
     * @throws ConnectionFailureException if the store does not become ready; files already
     *                                    imported stay imported
     */
    public DirectoryImportResult importDirectory(Path directory, boolean dryRun) {
        return importDirectory(directory, dryRun, ProgressCallback.NOOP);
    }

    public DirectoryImportResult importDirectory(Path directory, boolean dryRun, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<Path> files = findBatchFiles(directory);
        log.info("import.directory.started directory={} files={} dryRun={}", directory, files.size(), dryRun);

        List<ImportResult> imported = new ArrayList<>();
        List<DirectoryImportResult.FileFailure> failures = new ArrayList<>();
        long processed = 0;
        for (Path file : files) {
            String outcome;
            try {
                ImportBatch batch = fileReader.read(file);
                ImportResult result = dryRun
                        ? ImportResult.planned(file.getFileName().toString(), batch.nodes().size(), batch.edges().size())
                        : importBatch(batch, file.getFileName().toString());
                imported.add(result);
                outcome = result.toString();
            } catch (ImportValidationException e) {
                metricsService.incrementImportFilesRejected();
                log.warn("import.fileRejected file={} violations={}", file, e.getViolations());
                failures.add(new DirectoryImportResult.FileFailure(file, e.getMessage(), e.getViolations()));
                outcome = "rejected";
            } catch (ConnectionFailureException e) {
                throw e;
            } catch (PartialImportException e) {
                log.error("import.filePartial file={} failedUndoSteps={}", file, e.getFailedUndoSteps());
                failures.add(new DirectoryImportResult.FileFailure(file, e.getMessage(), e.getFailedUndoSteps(), true));
                outcome = "partially imported";
            } catch (RuntimeException e) {
                log.warn("import.fileFailed file={} error={}", file, e.getMessage());
                failures.add(new DirectoryImportResult.FileFailure(file, e.getMessage(), List.of()));
                outcome = "failed";
            }
            cb.onProgress(++processed, files.size(), file.getFileName() + ": " + outcome);
        }

        DirectoryImportResult result = new DirectoryImportResult(directory, dryRun, imported, failures);
        log.info("import.directory.completed directory={} imported={} failed={} nodesCreated={} nodesUpdated={}",
                directory, imported.size(), failures.size(), result.totalNodesCreated(), result.totalNodesUpdated());
        return result;
    }

    /**
     * Creates the node indexes. Idempotent.
     */
    public void createIndexes() {
        readinessProbe.awaitReady();
        connection.createIndexes();
    }

    /**
     * Deletes every node this engine imported, with its relationships.
     *
     * @return number of nodes removed
     */
    public long clearGraph() {
        readinessProbe.awaitReady();
        List<Map<String, Object>> rows = connection.query(COUNT_NODES);
        long count = rows.isEmpty() ? 0 : toLong(rows.get(0).get("count"));
        connection.execute(CLEAR_GRAPH);
        log.info("graph.cleared graph={} nodes={}", connection.getGraphName(), count);
        return count;
    }

    public static List<Path> findBatchFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(GraphBatchFileReader::isBatchFile).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan " + directory, e);
        }
    }

    ImportResult importBatch(ImportBatch batch, String sourceFile) {
        validate(batch);
        readinessProbe.awaitReady();

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forImport(batch.name(), sourceFile);
             Span span = tracingService.startSpan("aasx.import", Map.of("sourceFile", sourceFile))) {
            try {
                ImportResult result = writeBatch(batch, sourceFile);
                span.attribute("nodes", batch.nodes().size()).attribute("edges", batch.edges().size());
                span.succeeded();
                metricsService.recordImport(Duration.ofNanos(System.nanoTime() - start),
                        result.nodesCreated(), result.nodesUpdated(), result.edgesCreated(), result.edgesUpdated());
                log.info("import.completed result={}", result);
                return result;
            } catch (RuntimeException e) {
                span.failed(e);
                log.error("import.failed sourceFile={} error={}", sourceFile, e.getMessage());
                throw e;
            }
        }
    }

    private ImportResult writeBatch(ImportBatch batch, String sourceFile) {
        Map<String, Map<String, Object>> existingNodes = existingNodes(batch);
        Map<String, Map<String, Object>> existingEdges = existingEdges(batch);
        Set<String> knownIds = new HashSet<>(existingNodes.keySet());
        batch.nodes().forEach(node -> knownIds.add(node.id()));
        knownIds.addAll(existingEndpoints(batch, knownIds));

        int nodesCreated = 0;
        int nodesUpdated = 0;
        int edgesCreated = 0;
        int edgesUpdated = 0;
        int edgesSkipped = 0;

        try (ImportTransaction tx = new ImportTransaction(sourceFile)) {
            for (GraphNode node : batch.nodes()) {
                Map<String, Object> params = Map.of("id", node.id(), "properties", node.properties());
                String upsert = upsertNodeQuery(node);
                Map<String, Object> previous = existingNodes.get(node.id());
                if (previous == null) {
                    tx.execute("create node " + node.id(),
                            () -> connection.execute(upsert, params),
                            () -> connection.execute(DELETE_NODE, Map.of("id", node.id())));
                    nodesCreated++;
                } else {
                    tx.execute("update node " + node.id(),
                            () -> connection.execute(upsert, params),
                            () -> connection.execute(RESTORE_NODE, Map.of("id", node.id(), "properties", previous)));
                    nodesUpdated++;
                }
            }

            for (GraphEdge edge : batch.edges()) {
                if (!knownIds.contains(edge.fromId()) || !knownIds.contains(edge.toId())) {
                    log.debug("import.edgeSkipped edge={}", edge.key());
                    edgesSkipped++;
                    continue;
                }
                String type = edge.type().name();
                Map<String, Object> endpoints = Map.of("fromId", edge.fromId(), "toId", edge.toId());
                String upsert = upsertEdgeQuery(edge);
                Map<String, Object> params = new HashMap<>(endpoints);
                params.put("properties", edge.properties());
                Map<String, Object> previous = existingEdges.get(edge.key());
                if (previous == null) {
                    tx.execute("create edge " + edge.key(),
                            () -> connection.execute(upsert, params),
                            () -> connection.execute(DELETE_EDGE.formatted(type), endpoints));
                    edgesCreated++;
                } else {
                    Map<String, Object> restore = new HashMap<>(endpoints);
                    restore.put("properties", previous);
                    tx.execute("update edge " + edge.key(),
                            () -> connection.execute(upsert, params),
                            () -> connection.execute(RESTORE_EDGE.formatted(type), restore));
                    edgesUpdated++;
                }
            }
            tx.commit();
        }

        return new ImportResult(sourceFile, false, batch.nodes().size(), batch.edges().size(),
                nodesCreated, nodesUpdated, edgesCreated, edgesUpdated, edgesSkipped);
    }

    /**
     * Merges on id alone so an id seen before under another element type keeps a single
     * node; stale element labels are removed and the batch labels set.
     */
    private static String upsertNodeQuery(GraphNode node) {
        StringBuilder query = new StringBuilder(UPSERT_NODE);
        StringBuilder stale = new StringBuilder();
        for (ElementType type : ElementType.values()) {
            if (!node.labels().contains(type.getLabel())) {
                stale.append(':').append(type.getLabel());
            }
        }
        if (stale.length() > 0) {
            query.append("REMOVE n").append(stale).append('\n');
        }
        List<String> assignments = new ArrayList<>();
        for (String label : node.labels()) {
            if (!GraphNode.BASE_LABEL.equals(label)) {
                assignments.add("n:" + label);
            }
        }
        if (!node.properties().isEmpty()) {
            assignments.add("n += $properties");
        }
        if (!assignments.isEmpty()) {
            query.append("SET ").append(String.join(", ", assignments)).append('\n');
        }
        return query.toString();
    }

    private static String upsertEdgeQuery(GraphEdge edge) {
        String query = UPSERT_EDGE.formatted(edge.type().name());
        return edge.properties().isEmpty() ? query : query + "SET r += $properties\n";
    }

    private Map<String, Map<String, Object>> existingNodes(ImportBatch batch) {
        Map<String, Map<String, Object>> existing = new HashMap<>();
        if (batch.nodes().isEmpty()) {
            return existing;
        }
        List<String> ids = batch.nodes().stream().map(GraphNode::id).toList();
        for (Map<String, Object> row : connection.query(EXISTING_NODES, Map.of("ids", ids))) {
            existing.put(String.valueOf(row.get("id")), asProperties(row.get("props")));
        }
        return existing;
    }

    private Map<String, Map<String, Object>> existingEdges(ImportBatch batch) {
        Map<String, Map<String, Object>> existing = new HashMap<>();
        if (batch.edges().isEmpty()) {
            return existing;
        }
        Set<String> fromIds = new LinkedHashSet<>();
        batch.edges().forEach(edge -> fromIds.add(edge.fromId()));
        for (Map<String, Object> row : connection.query(EXISTING_EDGES, Map.of("fromIds", List.copyOf(fromIds)))) {
            String key = row.get("fromId") + "|" + row.get("type") + "|" + row.get("toId");
            existing.put(key, asProperties(row.get("props")));
        }
        return existing;
    }

    /**
     * Edge endpoints outside the batch that already exist in the store.
     */
    private Set<String> existingEndpoints(ImportBatch batch, Set<String> knownIds) {
        Set<String> external = new LinkedHashSet<>();
        for (GraphEdge edge : batch.edges()) {
            if (!knownIds.contains(edge.fromId())) external.add(edge.fromId());
            if (!knownIds.contains(edge.toId())) external.add(edge.toId());
        }
        Set<String> found = new HashSet<>();
        if (external.isEmpty()) {
            return found;
        }
        for (Map<String, Object> row : connection.query(EXISTING_NODES, Map.of("ids", List.copyOf(external)))) {
            found.add(String.valueOf(row.get("id")));
        }
        return found;
    }

    private static void validate(ImportBatch batch) {
        for (GraphNode node : batch.nodes()) {
            InputSanitizer.validateNodeId(node.id());
            node.labels().forEach(InputSanitizer::validateLabel);
            node.properties().keySet().forEach(InputSanitizer::validatePropertyKey);
        }
        for (GraphEdge edge : batch.edges()) {
            InputSanitizer.validateRelationshipType(edge.type().name());
            edge.properties().keySet().forEach(InputSanitizer::validatePropertyKey);
        }
    }

    private static Map<String, Object> asProperties(Object value) {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> properties.put(String.valueOf(k), v));
        }
        return properties;
    }

    private static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
