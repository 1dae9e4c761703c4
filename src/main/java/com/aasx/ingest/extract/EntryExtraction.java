package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.OriginFormat;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of extracting one metadata entry: either records plus warnings,
 * or a whole-entry parse failure.
 */
public record EntryExtraction(
        String entryName,
        OriginFormat format,
        List<RawRecord> records,
        List<ExtractionWarning> warnings,
        String failureMessage
) {

    public EntryExtraction {
        Objects.requireNonNull(entryName, "entryName is required");
        records = records != null ? List.copyOf(records) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static EntryExtraction success(String entryName, OriginFormat format,
                                          List<RawRecord> records, List<ExtractionWarning> warnings) {
        return new EntryExtraction(entryName, format, records, warnings, null);
    }

    public static EntryExtraction failure(String entryName, OriginFormat format, String message) {
        return new EntryExtraction(entryName, format, List.of(), List.of(),
                message != null ? message : "unparseable entry");
    }

    public boolean isSuccess() {
        return failureMessage == null;
    }
}
