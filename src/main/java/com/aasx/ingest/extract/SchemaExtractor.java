package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.OriginFormat;

/**
 * Reads the raw records of one metadata entry under one schema generation.
 * Implementations never throw on malformed content: missing fields become
 * warnings and an unparseable entry becomes a failed {@link EntryExtraction}.
 */
public interface SchemaExtractor {

    /**
     * Gets the schema generation this extractor reads.
     *
     * @return the origin format stamped on every record and diagnostic
     */
    OriginFormat format();

    /**
     * Extracts the shells, assets and submodels of one entry.
     *
     * @param content    raw entry bytes
     * @param sourceFile entry name, stamped on every record
     * @return the records and warnings, or a failure when the entry cannot be parsed at all
     */
    EntryExtraction extract(byte[] content, String sourceFile);
}
