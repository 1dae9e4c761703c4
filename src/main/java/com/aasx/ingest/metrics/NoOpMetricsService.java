package com.aasx.ingest.metrics;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordContainerExtraction(Duration duration, boolean succeeded) {
    }

    @Override
    public void incrementEntriesParsed(OriginFormat format) {
    }

    @Override
    public void incrementEntriesFailed(OriginFormat format) {
    }

    @Override
    public void incrementEntitiesExtracted(ElementType type, int count) {
    }

    @Override
    public void recordDanglingReferences(int count) {
    }

    @Override
    public void recordImport(Duration duration, int nodesCreated, int nodesUpdated,
                             int edgesCreated, int edgesUpdated) {
    }

    @Override
    public void incrementImportFilesRejected() {
    }
}
