package com.aasx.ingest.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * An embedded document found next to the metadata in a container.
 *
 * @param filename  file name without the directory part of the entry
 * @param sizeBytes uncompressed size, or -1 when the archive does not record it
 * @param typeTag   lower-case extension without the dot, e.g. {@code pdf}
 */
public record DocumentRef(String filename, long sizeBytes, String typeTag) {

    public DocumentRef {
        Objects.requireNonNull(filename, "filename is required");
        typeTag = typeTag != null ? typeTag : "";
    }

    /**
     * Creates a reference from a full entry name, deriving the file name and type tag.
     */
    public static DocumentRef fromEntryName(String entryName, long sizeBytes) {
        String filename = entryName.substring(entryName.lastIndexOf('/') + 1);
        int dot = filename.lastIndexOf('.');
        String typeTag = dot >= 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        return new DocumentRef(filename, sizeBytes, typeTag);
    }
}
