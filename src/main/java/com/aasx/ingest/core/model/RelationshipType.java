package com.aasx.ingest.core.model;

/**
 * Closed set of relationship types produced by the graph transformer.
 */
public enum RelationshipType {
    /** Shell to one of its submodels. */
    HAS_SUBMODEL,
    /** Shell to the asset it describes. */
    DESCRIBES;

    public static RelationshipType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Relationship type must not be null or blank");
        }
        return RelationshipType.valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
