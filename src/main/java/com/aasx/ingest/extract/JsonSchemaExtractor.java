package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extractor for the JSON metadata generation. Reads the shell collection
 * ({@code assetAdministrationShells}) and the submodel collection ({@code submodels})
 * by direct key lookup.
 */
public class JsonSchemaExtractor implements SchemaExtractor {
    private static final Logger log = LoggerFactory.getLogger(JsonSchemaExtractor.class);

    static final String SHELLS_KEY = "assetAdministrationShells";
    static final String SUBMODELS_KEY = "submodels";

    private final ObjectMapper objectMapper;

    public JsonSchemaExtractor() {
        this(new ObjectMapper());
    }

    public JsonSchemaExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public OriginFormat format() {
        return OriginFormat.JSON_V3;
    }

    @Override
    public EntryExtraction extract(byte[] content, String sourceFile) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("extract.json.parseFailed entry={} error={}", sourceFile, e.getOriginalMessage());
            return EntryExtraction.failure(sourceFile, format(), "Invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("extract.json.readFailed entry={} error={}", sourceFile, e.getMessage());
            return EntryExtraction.failure(sourceFile, format(), "Unreadable JSON: " + e.getMessage());
        }
        if (root == null || root.isMissingNode()) {
            return EntryExtraction.failure(sourceFile, format(), "Empty JSON document");
        }

        List<RawRecord> records = new ArrayList<>();
        List<ExtractionWarning> warnings = new ArrayList<>();

        if (!root.isObject()) {
            warnings.add(new ExtractionWarning(sourceFile, null, -1, "$",
                    "root is " + root.getNodeType() + ", expected object"));
            return EntryExtraction.success(sourceFile, format(), records, warnings);
        }

        readCollection(root, SHELLS_KEY, ElementType.SHELL, sourceFile, records, warnings);
        readCollection(root, SUBMODELS_KEY, ElementType.SUBMODEL, sourceFile, records, warnings);

        log.debug("extract.json.completed entry={} records={} warnings={}",
                sourceFile, records.size(), warnings.size());
        return EntryExtraction.success(sourceFile, format(), records, warnings);
    }

    private void readCollection(JsonNode root, String key, ElementType type, String sourceFile,
                                List<RawRecord> records, List<ExtractionWarning> warnings) {
        JsonNode collection = root.get(key);
        if (collection == null || collection.isNull()) {
            return;
        }
        if (!collection.isArray()) {
            warnings.add(new ExtractionWarning(sourceFile, type, -1, key, "expected array"));
            return;
        }

        int position = 0;
        for (JsonNode element : collection) {
            if (!element.isObject()) {
                warnings.add(new ExtractionWarning(sourceFile, type, position, key,
                        "element is " + element.getNodeType() + ", skipped"));
                position++;
                continue;
            }
            FieldReader fields = new FieldReader(element, sourceFile, type, position, warnings);
            records.add(new JsonRawRecord(
                    type,
                    sourceFile,
                    position,
                    fields.required("id"),
                    fields.required("idShort"),
                    fields.description("description"),
                    fields.optional("kind"),
                    type == ElementType.SHELL ? fields.submodelRefs("submodels") : List.of()
            ));
            position++;
        }
    }

    /**
     * Field access for one collection element, reporting malformed values as warnings.
     */
    private static final class FieldReader {
        private final JsonNode element;
        private final String sourceFile;
        private final ElementType type;
        private final int position;
        private final List<ExtractionWarning> warnings;

        FieldReader(JsonNode element, String sourceFile, ElementType type, int position,
                    List<ExtractionWarning> warnings) {
            this.element = element;
            this.sourceFile = sourceFile;
            this.type = type;
            this.position = position;
            this.warnings = warnings;
        }

        Optional<String> required(String name) {
            Optional<String> value = optional(name);
            if (value.isEmpty() && !element.has(name)) {
                warn(name, "missing");
            }
            return value;
        }

        Optional<String> optional(String name) {
            JsonNode node = element.get(name);
            if (node == null || node.isNull()) {
                return Optional.empty();
            }
            if (!node.isValueNode()) {
                warn(name, "expected text, found " + node.getNodeType());
                return Optional.empty();
            }
            String text = node.asText();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }

        LocalizedText description(String name) {
            JsonNode node = element.get(name);
            if (node == null || node.isNull()) {
                return LocalizedText.absent();
            }
            if (node.isTextual()) {
                return LocalizedText.plain(node.asText());
            }
            Map<String, String> byLanguage = new LinkedHashMap<>();
            if (node.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    if (entry.getValue().isValueNode()) {
                        byLanguage.put(entry.getKey(), entry.getValue().asText());
                    }
                }
            } else if (node.isArray()) {
                // [{"language": "en", "text": "..."}]
                for (JsonNode langString : node) {
                    JsonNode language = langString.get("language");
                    JsonNode text = langString.get("text");
                    if (language != null && text != null) {
                        byLanguage.putIfAbsent(language.asText(), text.asText());
                    }
                }
            } else {
                warn(name, "unsupported description shape " + node.getNodeType());
            }
            return LocalizedText.of(byLanguage);
        }

        List<String> submodelRefs(String name) {
            JsonNode node = element.get(name);
            if (node == null || node.isNull()) {
                return List.of();
            }
            if (!node.isArray()) {
                warn(name, "expected array of references");
                return List.of();
            }
            List<String> refs = new ArrayList<>();
            for (JsonNode reference : node) {
                if (reference.isTextual()) {
                    refs.add(reference.asText());
                    continue;
                }
                String target = referenceTarget(reference.get("keys"));
                if (target.isEmpty()) {
                    warn(name, "reference without key value");
                } else {
                    refs.add(target);
                }
            }
            return refs;
        }

        private static String referenceTarget(JsonNode keys) {
            if (keys == null || !keys.isArray() || keys.isEmpty()) {
                return "";
            }
            for (JsonNode key : keys) {
                if ("Submodel".equalsIgnoreCase(key.path("type").asText())) {
                    return key.path("value").asText("");
                }
            }
            return keys.get(keys.size() - 1).path("value").asText("");
        }

        private void warn(String field, String message) {
            warnings.add(new ExtractionWarning(sourceFile, type, position, field, message));
        }
    }
}
