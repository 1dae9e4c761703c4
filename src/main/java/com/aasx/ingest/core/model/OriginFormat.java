package com.aasx.ingest.core.model;

/**
 * Metadata schema generation an entity was read from.
 */
public enum OriginFormat {
    /** Modern JSON serialization (shell and submodel arrays). */
    JSON_V3,
    /** Legacy namespaced XML serialization. */
    XML_V1
}
