package com.aasx.ingest.api;

import java.util.Objects;

/**
 * An entry- or container-level failure recovered during extraction and reported
 * alongside the successful results.
 */
public record ProcessingDiagnostic(Kind kind, String sourceFile, String message) {

    public enum Kind {
        /** A metadata entry could not be parsed; the entry was skipped. */
        ENTRY_PARSE_FAILURE,
        /** A metadata entry could not be read from the archive; the entry was skipped. */
        ENTRY_READ_FAILURE,
        /** Batch extraction only: the container path did not exist. */
        CONTAINER_NOT_FOUND,
        /** Batch extraction only: the container was not a readable archive. */
        INVALID_CONTAINER_FORMAT,
        /** Batch extraction only: extraction of the container failed for any other reason. */
        EXTRACTION_FAILURE
    }

    public ProcessingDiagnostic {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(sourceFile, "sourceFile is required");
        message = message != null ? message : "";
    }
}
