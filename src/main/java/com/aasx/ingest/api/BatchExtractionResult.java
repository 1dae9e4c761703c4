package com.aasx.ingest.api;

import java.util.List;

/**
 * Outcome of extracting many containers. Results keep the input order; containers
 * that failed as a whole appear only in {@link #failures()}.
 */
public record BatchExtractionResult(List<ExtractionResult> results, List<ProcessingDiagnostic> failures) {

    public BatchExtractionResult {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public int totalContainers() {
        return results.size() + failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchExtractionResult{succeeded=%d, failed=%d}".formatted(results.size(), failures.size());
    }
}
