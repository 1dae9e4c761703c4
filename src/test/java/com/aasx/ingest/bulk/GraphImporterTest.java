package com.aasx.ingest.bulk;

import com.aasx.ingest.core.model.RelationshipType;
import com.aasx.ingest.graph.ConnectionFailureException;
import com.aasx.ingest.graph.StoreReadinessProbe;
import com.aasx.ingest.health.GraphStoreHealthCheck;
import com.aasx.ingest.metrics.MicrometerMetricsService;
import com.aasx.ingest.testutil.InMemoryGraphConnection;
import com.aasx.ingest.tracing.NoOpTracingService;
import com.aasx.ingest.transform.GraphEdge;
import com.aasx.ingest.transform.GraphNode;
import com.aasx.ingest.transform.ImportBatch;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphImporter")
class GraphImporterTest {

    @TempDir
    Path tempDir;

    private InMemoryGraphConnection connection;
    private SimpleMeterRegistry registry;
    private GraphImporter importer;

    @BeforeEach
    void setUp() {
        connection = new InMemoryGraphConnection();
        registry = new SimpleMeterRegistry();
        importer = importer(Duration.ofSeconds(1));
    }

    private GraphImporter importer(Duration readinessTimeout) {
        StoreReadinessProbe probe = new StoreReadinessProbe(new GraphStoreHealthCheck(connection), readinessTimeout,
                Duration.ofMillis(10), Duration.ofMillis(10), Clock.systemUTC(), duration -> { });
        return new GraphImporter(connection, probe, new GraphBatchFileReader(),
                new MicrometerMetricsService(registry), new NoOpTracingService());
    }

    private static GraphNode node(String id, String label, String shortName) {
        return new GraphNode(id, List.of(GraphNode.BASE_LABEL, label), Map.of("shortName", shortName));
    }

    private static ImportBatch motorBatch(String shellName) {
        return new ImportBatch("motor",
                List.of(node("urn:ex:1", "Shell", shellName), node("urn:ex:2", "Submodel", "Specs")),
                List.of(new GraphEdge("urn:ex:1", "urn:ex:2", RelationshipType.HAS_SUBMODEL, Map.of("sourceFile", "m.json"))),
                List.of(), null);
    }

    @Nested
    @DisplayName("Upsert")
    class Upsert {

        @Test
        @DisplayName("First import creates nodes and edges")
        void createsNodesAndEdges() {
            ImportResult result = importer.importBatch(motorBatch("Motor1"));

            assertEquals(2, result.nodesCreated());
            assertEquals(0, result.nodesUpdated());
            assertEquals(1, result.edgesCreated());
            assertFalse(result.dryRun());
            assertEquals(2, connection.nodes().size());
            assertEquals("Motor1", connection.nodes().get("urn:ex:1").get("shortName"));
            assertTrue(connection.edges().containsKey("urn:ex:1|HAS_SUBMODEL|urn:ex:2"));
        }

        @Test
        @DisplayName("Re-importing the same batch updates instead of duplicating")
        void idempotent() {
            importer.importBatch(motorBatch("Motor1"));
            ImportResult second = importer.importBatch(motorBatch("Motor1"));

            assertEquals(0, second.nodesCreated());
            assertEquals(2, second.nodesUpdated());
            assertEquals(0, second.edgesCreated());
            assertEquals(1, second.edgesUpdated());
            assertEquals(2, connection.nodes().size());
            assertEquals(1, connection.edges().size());
        }

        @Test
        @DisplayName("Existing properties are overwritten")
        void overwritesProperties() {
            importer.importBatch(motorBatch("Motor1"));
            importer.importBatch(motorBatch("Motor One"));

            assertEquals("Motor One", connection.nodes().get("urn:ex:1").get("shortName"));
        }

        @Test
        @DisplayName("Node query carries every label and merges on id")
        void nodeQueryShape() {
            importer.importBatch(motorBatch("Motor1"));

            String upsert = connection.calls().stream()
                    .filter(InMemoryGraphConnection.Call::mutating)
                    .map(InMemoryGraphConnection.Call::query)
                    .findFirst().orElseThrow();
            assertTrue(upsert.contains("MERGE (n:AasNode {id: $id})"));
            assertTrue(upsert.contains("REMOVE n:Asset:Submodel"));
            assertTrue(upsert.contains("SET n:Shell, n += $properties"));
        }

        @Test
        @DisplayName("An id imported again under another element type stays one node")
        void elementTypeChangeKeepsOneNode() {
            importer.importBatch(new ImportBatch("first", List.of(node("urn:ex:9", "Asset", "Pump")),
                    List.of(), List.of(), null));

            ImportResult result = importer.importBatch(new ImportBatch("second",
                    List.of(node("urn:ex:9", "Shell", "Pump")), List.of(), List.of(), null));

            assertEquals(0, result.nodesCreated());
            assertEquals(1, result.nodesUpdated());
            assertEquals(1, connection.nodes().size());
            String upsert = connection.calls().stream()
                    .filter(InMemoryGraphConnection.Call::mutating)
                    .map(InMemoryGraphConnection.Call::query)
                    .reduce((first, second) -> second).orElseThrow();
            assertTrue(upsert.startsWith("MERGE (n:AasNode {id: $id})"));
            assertTrue(upsert.contains("REMOVE n:Asset:Submodel"));
            assertTrue(upsert.contains("SET n:Shell"));
        }

        @Test
        @DisplayName("Edges to nodes already in the store are written and unknown endpoints skipped")
        void edgeEndpoints() {
            importer.importBatch(motorBatch("Motor1"));
            ImportBatch second = new ImportBatch("extra",
                    List.of(node("urn:ex:3", "Submodel", "Docs")),
                    List.of(new GraphEdge("urn:ex:1", "urn:ex:3", RelationshipType.HAS_SUBMODEL, Map.of()),
                            new GraphEdge("urn:ex:1", "urn:nowhere", RelationshipType.HAS_SUBMODEL, Map.of())),
                    List.of(), null);

            ImportResult result = importer.importBatch(second);

            assertEquals(1, result.edgesCreated());
            assertEquals(1, result.edgesSkipped());
            assertTrue(connection.edges().containsKey("urn:ex:1|HAS_SUBMODEL|urn:ex:3"));
        }

        @Test
        @DisplayName("Import metrics are recorded")
        void metrics() {
            importer.importBatch(motorBatch("Motor1"));

            assertEquals(2.0, registry.find("aasx.graph.nodes").tag("change", "created").counter().count());
            assertEquals(1, registry.find("aasx.import.duration").timer().count());
        }
    }

    @Nested
    @DisplayName("Atomicity")
    class Atomicity {

        @Test
        @DisplayName("A failing edge write removes the nodes the batch created")
        void rollsBackCreatedNodes() {
            connection.failOnExecute(3);

            assertThrows(IllegalStateException.class, () -> importer.importBatch(motorBatch("Motor1")));

            assertTrue(connection.nodes().isEmpty());
            assertTrue(connection.edges().isEmpty());
        }

        @Test
        @DisplayName("A failing update restores the previous properties")
        void restoresUpdatedNodes() {
            importer.importBatch(motorBatch("Motor1"));
            Map<String, Object> before = Map.copyOf(connection.nodes().get("urn:ex:1"));
            // statements already run: 2 nodes + 1 edge; fail on the second update
            connection.failOnExecute(3 + 2);

            assertThrows(IllegalStateException.class, () -> importer.importBatch(motorBatch("Renamed")));

            assertEquals(before, connection.nodes().get("urn:ex:1"));
        }

        @Test
        @DisplayName("A lost connection that also breaks the undo is reported as a partial import")
        void undoFailureReportsPartialImport() {
            connection.failFromExecute(3);

            PartialImportException e = assertThrows(PartialImportException.class,
                    () -> importer.importBatch(motorBatch("Motor1")));

            assertEquals("connection lost", e.getCause().getMessage());
            assertEquals(List.of("create node urn:ex:2", "create node urn:ex:1"), e.getFailedUndoSteps());
            assertEquals(2, e.getSuppressed().length);
            assertEquals("motor", e.getBatch());
            // the undo could not remove them
            assertEquals(2, connection.nodes().size());
        }

        @Test
        @DisplayName("Invalid node ids are rejected before any write")
        void validatesBeforeWriting() {
            ImportBatch batch = new ImportBatch("bad",
                    List.of(new GraphNode("bad\u0001id", List.of("AasNode"), Map.of())), List.of(), List.of(), null);

            assertThrows(IllegalArgumentException.class, () -> importer.importBatch(batch));
            assertTrue(connection.calls().isEmpty());
        }
    }

    @Nested
    @DisplayName("Readiness")
    class Readiness {

        @Test
        @DisplayName("An unreachable store fails with ConnectionFailureException and nothing is written")
        void unreachableStore() {
            connection.setConnected(false);
            GraphImporter impatient = importer(Duration.ZERO);

            assertThrows(ConnectionFailureException.class, () -> impatient.importBatch(motorBatch("Motor1")));
            assertEquals(0, connection.mutatingCalls());
        }
    }

    @Nested
    @DisplayName("Directory import")
    class DirectoryImport {

        private Path directory;

        @BeforeEach
        void writeFiles() throws IOException {
            directory = Files.createDirectories(tempDir.resolve("graphs"));
            new GraphBatchFileWriter().write(motorBatch("Motor1"), directory);
            Files.writeString(directory.resolve("broken_graph.json"), "{\"format\": \"graph\", \"nodes\": []}");
            Files.writeString(directory.resolve("ignored.json"), "{}");
        }

        @Test
        @DisplayName("Valid files are imported and malformed ones reported")
        void importsValidFiles() {
            List<String> progress = new ArrayList<>();

            DirectoryImportResult result = importer.importDirectory(directory, false,
                    (processed, total, message) -> progress.add(processed + "/" + total));

            assertEquals(1, result.imported().size());
            assertEquals(1, result.failures().size());
            assertEquals("broken_graph.json", result.failures().get(0).file().getFileName().toString());
            assertEquals(List.of("edges must be an array"), result.failures().get(0).violations());
            assertEquals(2, result.totalNodesCreated());
            assertEquals(List.of("1/2", "2/2"), progress);
            assertEquals(1.0, registry.find("aasx.import.rejected").counter().count());
        }

        @Test
        @DisplayName("Dry run validates and plans without touching the store")
        void dryRun() {
            DirectoryImportResult result = importer.importDirectory(directory, true);

            assertTrue(result.dryRun());
            assertEquals(2, result.totalNodesPlanned());
            assertEquals(1, result.totalEdgesPlanned());
            assertEquals(0, result.totalNodesCreated());
            assertEquals(1, result.failures().size());
            assertTrue(connection.calls().isEmpty());
        }

        @Test
        @DisplayName("Store outage aborts the directory import")
        void outageAborts() {
            connection.setConnected(false);
            GraphImporter impatient = importer(Duration.ZERO);

            assertThrows(ConnectionFailureException.class, () -> impatient.importDirectory(directory, false));
        }

        @Test
        @DisplayName("A file that could not be undone is reported as partial")
        void partialFileReported() {
            connection.failFromExecute(3);

            DirectoryImportResult result = importer.importDirectory(directory, false);

            assertEquals(0, result.imported().size());
            assertEquals(2, result.failures().size());
            assertEquals(List.of(directory.resolve("motor_graph.json")), result.partialFiles());
            DirectoryImportResult.FileFailure partial = result.failures().get(1);
            assertTrue(partial.partial());
            assertEquals(2, partial.violations().size());
            assertFalse(result.failures().get(0).partial());
        }

        @Test
        void findBatchFiles() {
            List<Path> files = GraphImporter.findBatchFiles(directory);
            assertEquals(List.of(directory.resolve("broken_graph.json"), directory.resolve("motor_graph.json")), files);
        }
    }

    @Test
    @DisplayName("clearGraph removes every imported node")
    void clearGraph() {
        importer.importBatch(motorBatch("Motor1"));

        assertEquals(2, importer.clearGraph());
        assertTrue(connection.nodes().isEmpty());
    }

    @Test
    void createIndexesDelegates() {
        importer.createIndexes();
        assertTrue(connection.calls().stream().anyMatch(c -> c.query().equals("CREATE INDEX")));
    }
}
