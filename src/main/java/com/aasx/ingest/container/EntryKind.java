package com.aasx.ingest.container;

/**
 * Classification of a container entry, derived purely from its name.
 */
public enum EntryKind {
    DOCUMENT,
    JSON_METADATA,
    XML_METADATA,
    IGNORABLE;

    public boolean isMetadata() {
        return this == JSON_METADATA || this == XML_METADATA;
    }
}
