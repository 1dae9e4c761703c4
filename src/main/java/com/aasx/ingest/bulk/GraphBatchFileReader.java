package com.aasx.ingest.bulk;

import com.aasx.ingest.core.model.DocumentRef;
import com.aasx.ingest.core.model.RelationshipType;
import com.aasx.ingest.graph.InputSanitizer;
import com.aasx.ingest.transform.GraphEdge;
import com.aasx.ingest.transform.GraphNode;
import com.aasx.ingest.transform.ImportBatch;
import com.aasx.ingest.transform.TransformDiagnostics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and validates graph batch files. The whole file is checked before anything is
 * returned: every violation is collected and reported in one
 * {@link ImportValidationException}.
 *
 * <p>Required: {@code format} equal to {@code "graph"}, a {@code nodes} array and an
 * {@code edges} array. Nodes need a non-blank {@code id}; edges need {@code from},
 * {@code to} and a known {@code type}. Labels and property keys must be identifiers and
 * property values scalars or arrays of scalars.</p>
 */
public class GraphBatchFileReader {

    private final ObjectMapper objectMapper;

    public GraphBatchFileReader() {
        this(new ObjectMapper());
    }

    public GraphBatchFileReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ImportBatch read(Path file) {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new ImportValidationException(file, "not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }

        List<String> violations = new ArrayList<>();
        if (root == null || !root.isObject()) {
            throw new ImportValidationException(file, List.of("root must be a JSON object"));
        }
        if (!GraphBatchFileWriter.FORMAT.equals(root.path("format").asText(null))) {
            violations.add("format must be \"" + GraphBatchFileWriter.FORMAT + "\"");
        }
        JsonNode nodesJson = root.get("nodes");
        JsonNode edgesJson = root.get("edges");
        if (nodesJson == null || !nodesJson.isArray()) {
            violations.add("nodes must be an array");
        }
        if (edgesJson == null || !edgesJson.isArray()) {
            violations.add("edges must be an array");
        }
        if (!violations.isEmpty()) {
            throw new ImportValidationException(file, violations);
        }

        List<GraphNode> nodes = readNodes(nodesJson, violations);
        List<GraphEdge> edges = readEdges(edgesJson, violations);
        List<DocumentRef> documents = readDocuments(root.get("documents"));
        if (!violations.isEmpty()) {
            throw new ImportValidationException(file, violations);
        }

        JsonNode metadata = root.path("metadata");
        TransformDiagnostics diagnostics = new TransformDiagnostics(
                metadata.path("danglingReferences").asInt(0), List.of(),
                metadata.path("duplicateEntities").asInt(0));
        return new ImportBatch(batchName(file), nodes, edges, documents, diagnostics);
    }

    /**
     * File name without the {@code _graph.json} suffix.
     */
    public static String batchName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(GraphBatchFileWriter.FILE_SUFFIX)
                ? name.substring(0, name.length() - GraphBatchFileWriter.FILE_SUFFIX.length())
                : name;
    }

    public static boolean isBatchFile(Path file) {
        return Files.isRegularFile(file) && file.getFileName().toString().endsWith(GraphBatchFileWriter.FILE_SUFFIX);
    }

    private List<GraphNode> readNodes(JsonNode array, List<String> violations) {
        List<GraphNode> nodes = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        int index = 0;
        for (JsonNode json : array) {
            String where = "nodes[" + index++ + "]";
            if (!json.isObject()) {
                violations.add(where + " must be an object");
                continue;
            }
            String id = json.path("id").isTextual() ? json.path("id").asText() : "";
            if (id.isBlank()) {
                violations.add(where + ".id must be a non-blank string");
                continue;
            }
            if (!ids.add(id)) {
                violations.add(where + ".id duplicates " + id);
                continue;
            }
            int before = violations.size();
            List<String> labels = readLabels(json.get("labels"), where, violations);
            Map<String, Object> properties = readProperties(json.get("properties"), where, violations);
            if (violations.size() == before) {
                nodes.add(new GraphNode(id, labels, properties));
            }
        }
        return nodes;
    }

    private List<GraphEdge> readEdges(JsonNode array, List<String> violations) {
        List<GraphEdge> edges = new ArrayList<>();
        int index = 0;
        for (JsonNode json : array) {
            String where = "edges[" + index++ + "]";
            if (!json.isObject()) {
                violations.add(where + " must be an object");
                continue;
            }
            int before = violations.size();
            String from = json.path("from").asText("");
            String to = json.path("to").asText("");
            if (from.isBlank()) {
                violations.add(where + ".from must be a non-blank string");
            }
            if (to.isBlank()) {
                violations.add(where + ".to must be a non-blank string");
            }
            RelationshipType type = null;
            try {
                type = RelationshipType.parse(json.path("type").asText(""));
            } catch (IllegalArgumentException e) {
                violations.add(where + ".type must be one of " + List.of(RelationshipType.values()));
            }
            Map<String, Object> properties = readProperties(json.get("properties"), where, violations);
            if (violations.size() == before) {
                edges.add(new GraphEdge(from, to, type, properties));
            }
        }
        return edges;
    }

    private static List<String> readLabels(JsonNode json, String where, List<String> violations) {
        List<String> labels = new ArrayList<>();
        labels.add(GraphNode.BASE_LABEL);
        if (json == null || json.isNull()) {
            return labels;
        }
        if (!json.isArray()) {
            violations.add(where + ".labels must be an array");
            return labels;
        }
        for (JsonNode label : json) {
            String value = label.asText("");
            try {
                InputSanitizer.validateLabel(value);
            } catch (IllegalArgumentException e) {
                violations.add(where + ".labels: " + e.getMessage());
                continue;
            }
            if (!labels.contains(value)) {
                labels.add(value);
            }
        }
        return labels;
    }

    private static Map<String, Object> readProperties(JsonNode json, String where, List<String> violations) {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (json == null || json.isNull()) {
            return properties;
        }
        if (!json.isObject()) {
            violations.add(where + ".properties must be an object");
            return properties;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                InputSanitizer.validatePropertyKey(field.getKey());
            } catch (IllegalArgumentException e) {
                violations.add(where + ".properties: " + e.getMessage());
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isArray()) {
                List<Object> values = new ArrayList<>();
                for (JsonNode element : value) {
                    if (!element.isValueNode()) {
                        violations.add(where + ".properties." + field.getKey() + " must hold scalars only");
                        break;
                    }
                    values.add(scalar(element));
                }
                properties.put(field.getKey(), values);
            } else if (value.isValueNode()) {
                properties.put(field.getKey(), scalar(value));
            } else {
                violations.add(where + ".properties." + field.getKey() + " must be a scalar or an array");
            }
        }
        return properties;
    }

    private static Object scalar(JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        return value.asText();
    }

    private static List<DocumentRef> readDocuments(JsonNode json) {
        List<DocumentRef> documents = new ArrayList<>();
        if (json == null || !json.isArray()) {
            return documents;
        }
        for (JsonNode document : json) {
            String filename = document.path("filename").asText("");
            if (!filename.isEmpty()) {
                documents.add(new DocumentRef(filename, document.path("sizeBytes").asLong(-1),
                        document.path("type").asText("")));
            }
        }
        return documents;
    }
}
