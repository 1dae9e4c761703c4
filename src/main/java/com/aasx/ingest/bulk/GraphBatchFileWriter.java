package com.aasx.ingest.bulk;

import com.aasx.ingest.core.model.DocumentRef;
import com.aasx.ingest.transform.GraphEdge;
import com.aasx.ingest.transform.GraphNode;
import com.aasx.ingest.transform.ImportBatch;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Writes an {@link ImportBatch} as {@code <name>_graph.json}, the file shape
 * {@link GraphBatchFileReader} accepts.
 */
public class GraphBatchFileWriter {
    private static final Logger log = LoggerFactory.getLogger(GraphBatchFileWriter.class);

    public static final String FILE_SUFFIX = "_graph.json";
    public static final String FORMAT = "graph";
    public static final String VERSION = "1.0";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GraphBatchFileWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), Clock.systemUTC());
    }

    public GraphBatchFileWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return the written file
     */
    public Path write(ImportBatch batch, Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        Path target = outputDirectory.resolve(batch.name() + FILE_SUFFIX);
        objectMapper.writeValue(target.toFile(), toJson(batch));
        log.info("graphFile.written file={} nodes={} edges={}", target, batch.nodes().size(), batch.edges().size());
        return target;
    }

    public ObjectNode toJson(ImportBatch batch) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("format", FORMAT);
        root.put("version", VERSION);
        root.put("name", batch.name());

        ArrayNode nodes = root.putArray("nodes");
        for (GraphNode node : batch.nodes()) {
            ObjectNode json = nodes.addObject();
            json.put("id", node.id());
            ArrayNode labels = json.putArray("labels");
            node.labels().forEach(labels::add);
            json.set("properties", objectMapper.valueToTree(node.properties()));
        }

        ArrayNode edges = root.putArray("edges");
        for (GraphEdge edge : batch.edges()) {
            ObjectNode json = edges.addObject();
            json.put("from", edge.fromId());
            json.put("to", edge.toId());
            json.put("type", edge.type().name());
            json.set("properties", objectMapper.valueToTree(edge.properties()));
        }

        ArrayNode documents = root.putArray("documents");
        for (DocumentRef document : batch.documents()) {
            ObjectNode json = documents.addObject();
            json.put("filename", document.filename());
            json.put("sizeBytes", document.sizeBytes());
            json.put("type", document.typeTag());
        }

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("createdAt", DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
        metadata.put("totalNodes", batch.nodes().size());
        metadata.put("totalEdges", batch.edges().size());
        metadata.put("danglingReferences", batch.diagnostics().danglingReferences());
        metadata.put("duplicateEntities", batch.diagnostics().duplicateEntities());
        return root;
    }
}
