package com.aasx.ingest.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node ready for import.
 *
 * @param id         stable id (entity identity or synthetic key)
 * @param labels     the common {@value #BASE_LABEL} label followed by the element label
 * @param properties scalar property values, in insertion order
 */
public record GraphNode(String id, List<String> labels, Map<String, Object> properties) {

    public static final String BASE_LABEL = "AasNode";

    public GraphNode {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        labels = List.copyOf(labels);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * The element label ({@code Shell}, {@code Asset}, {@code Submodel}).
     */
    public String elementLabel() {
        for (String label : labels) {
            if (!BASE_LABEL.equals(label)) {
                return label;
            }
        }
        return BASE_LABEL;
    }

    public String property(String key) {
        Object value = properties.get(key);
        return value != null ? value.toString() : "";
    }
}
