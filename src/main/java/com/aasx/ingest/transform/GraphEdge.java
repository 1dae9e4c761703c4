package com.aasx.ingest.transform;

import com.aasx.ingest.core.model.RelationshipType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed relationship between two nodes of the same batch. Identified by
 * {@code (fromId, toId, type)}.
 */
public record GraphEdge(String fromId, String toId, RelationshipType type, Map<String, Object> properties) {

    public GraphEdge {
        Objects.requireNonNull(fromId, "fromId is required");
        Objects.requireNonNull(toId, "toId is required");
        Objects.requireNonNull(type, "type is required");
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
    }

    public String key() {
        return fromId + "|" + type.name() + "|" + toId;
    }
}
