package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.ElementType;

/**
 * Non-fatal problem met while reading one field or element of a metadata entry.
 *
 * @param sourceFile  entry name
 * @param elementType element being read, or {@code null} for entry-level structure warnings
 * @param position    position of the element within its type, or -1
 * @param field       field name that was missing or malformed
 * @param message     human-readable detail
 */
public record ExtractionWarning(
        String sourceFile,
        ElementType elementType,
        int position,
        String field,
        String message
) {

    @Override
    public String toString() {
        return sourceFile + (elementType != null ? "[" + elementType.getLabel() + "#" + position + "]" : "")
                + " " + field + ": " + message;
    }
}
