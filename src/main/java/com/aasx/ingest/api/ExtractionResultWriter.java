package com.aasx.ingest.api;

import com.aasx.ingest.core.model.DocumentRef;
import com.aasx.ingest.core.model.Entity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders an {@link ExtractionResult} as the JSON document handed to callers that
 * consume extraction output directly.
 */
public class ExtractionResultWriter {

    private final ObjectMapper objectMapper;

    public ExtractionResultWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ExtractionResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJson(ExtractionResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("processingMethod", result.processingMethod());
        root.put("sourceFile", result.sourceFile());
        root.put("fileSizeBytes", result.fileSizeBytes());
        root.put("processingTimestamp", result.processingTimestamp());
        writeEntities(root.putArray("assets"), result.assets());
        writeEntities(root.putArray("submodels"), result.submodels());

        ArrayNode documents = root.putArray("documents");
        for (DocumentRef document : result.documents()) {
            ObjectNode node = documents.addObject();
            node.put("filename", document.filename());
            node.put("sizeBytes", document.sizeBytes());
            node.put("type", document.typeTag());
        }

        ObjectNode rawData = root.putObject("rawData");
        result.rawData().jsonFiles().forEach(rawData.putArray("jsonFiles")::add);
        result.rawData().xmlFiles().forEach(rawData.putArray("xmlFiles")::add);

        ArrayNode diagnostics = root.putArray("diagnostics");
        for (ProcessingDiagnostic diagnostic : result.diagnostics()) {
            ObjectNode node = diagnostics.addObject();
            node.put("kind", diagnostic.kind().name());
            node.put("sourceFile", diagnostic.sourceFile());
            node.put("message", diagnostic.message());
        }
        return root;
    }

    public void write(ExtractionResult result, OutputStream out) throws IOException {
        objectMapper.writeValue(out, toJson(result));
    }

    public void write(ExtractionResult result, Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            write(result, out);
        }
    }

    private static void writeEntities(ArrayNode array, List<Entity> entities) {
        for (Entity entity : entities) {
            ObjectNode node = array.addObject();
            node.put("identity", entity.getIdentity());
            node.put("shortName", entity.getShortName());
            node.put("description", entity.getDescription());
            node.put("kind", entity.getKind());
            node.put("source", entity.getSourceFile());
            node.put("format", entity.getOriginFormat().name());
            node.put("elementType", entity.getElementType().getLabel());
        }
    }
}
