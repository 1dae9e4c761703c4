package com.aasx.ingest.api;

import com.aasx.ingest.core.model.DocumentRef;
import com.aasx.ingest.core.model.Entity;
import com.aasx.ingest.extract.ExtractionWarning;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything extracted from one container.
 *
 * @param processingMethod     name of the engine that produced the result
 * @param sourceFile           container path as given by the caller
 * @param fileSizeBytes        container size on disk
 * @param processingTimestamp  UTC ISO-8601 instant the extraction finished
 * @param assets               shells and assets
 * @param submodels            submodels
 * @param documents            embedded documents
 * @param rawData              names of the metadata entries read, per format
 * @param diagnostics          entry-level failures
 * @param warnings             field-level warnings from the extractors
 */
public record ExtractionResult(
        String processingMethod,
        String sourceFile,
        long fileSizeBytes,
        String processingTimestamp,
        List<Entity> assets,
        List<Entity> submodels,
        List<DocumentRef> documents,
        RawData rawData,
        List<ProcessingDiagnostic> diagnostics,
        List<ExtractionWarning> warnings
) {

    public ExtractionResult {
        assets = List.copyOf(assets);
        submodels = List.copyOf(submodels);
        documents = List.copyOf(documents);
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public record RawData(List<String> jsonFiles, List<String> xmlFiles) {
        public RawData {
            jsonFiles = List.copyOf(jsonFiles);
            xmlFiles = List.copyOf(xmlFiles);
        }
    }

    /**
     * Assets followed by submodels.
     */
    public List<Entity> entities() {
        List<Entity> all = new ArrayList<>(assets.size() + submodels.size());
        all.addAll(assets);
        all.addAll(submodels);
        return all;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return "ExtractionResult{sourceFile=%s, assets=%d, submodels=%d, documents=%d, diagnostics=%d}"
                .formatted(sourceFile, assets.size(), submodels.size(), documents.size(), diagnostics.size());
    }
}
