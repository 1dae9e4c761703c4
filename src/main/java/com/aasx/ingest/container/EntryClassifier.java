package com.aasx.ingest.container;

import java.util.Locale;
import java.util.Set;

/**
 * Classifies container entries by name without reading their content.
 *
 * <p>Legacy metadata must end in {@code .xml} and contain the {@code aas.xml} marker,
 * which separates it from packaging XML such as {@code [Content_Types].xml}.</p>
 */
public final class EntryClassifier {

    private static final Set<String> DOCUMENT_EXTENSIONS = Set.of(".pdf", ".doc", ".docx", ".txt");
    private static final String XML_METADATA_MARKER = "aas.xml";
    private static final String CONTENT_TYPES_PREFIX = "[content_types]";

    private EntryClassifier() {
    }

    public static EntryKind classify(String entryName) {
        if (entryName == null || entryName.isBlank() || entryName.endsWith("/")) {
            return EntryKind.IGNORABLE;
        }
        String lower = entryName.toLowerCase(Locale.ROOT);
        String fileName = lower.substring(lower.lastIndexOf('/') + 1);

        for (String extension : DOCUMENT_EXTENSIONS) {
            if (fileName.endsWith(extension)) {
                return EntryKind.DOCUMENT;
            }
        }
        if (fileName.endsWith(".json")) {
            return EntryKind.JSON_METADATA;
        }
        if (fileName.endsWith(".xml")
                && !fileName.startsWith(CONTENT_TYPES_PREFIX)
                && fileName.contains(XML_METADATA_MARKER)) {
            return EntryKind.XML_METADATA;
        }
        return EntryKind.IGNORABLE;
    }
}
