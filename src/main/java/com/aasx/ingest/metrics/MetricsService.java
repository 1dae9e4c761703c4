package com.aasx.ingest.metrics;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;

import java.time.Duration;

/**
 * Counters and timers for extraction and import. {@link NoOpMetricsService} is the
 * default so Micrometer stays optional on the classpath.
 */
public interface MetricsService {

    /**
     * Records the extraction of one container.
     *
     * @param duration  time spent on the container
     * @param succeeded false when a container-level failure propagated
     */
    void recordContainerExtraction(Duration duration, boolean succeeded);

    /**
     * Counts a metadata entry that was parsed.
     *
     * @param format schema generation of the entry
     */
    void incrementEntriesParsed(OriginFormat format);

    /**
     * Counts a metadata entry that could not be read or parsed.
     *
     * @param format schema generation of the entry
     */
    void incrementEntriesFailed(OriginFormat format);

    /**
     * Counts normalized entities.
     *
     * @param type  element type of the entities
     * @param count number of entities
     */
    void incrementEntitiesExtracted(ElementType type, int count);

    /**
     * Records how many references of one transformed batch pointed outside it.
     *
     * @param count dangling references in the batch
     */
    void recordDanglingReferences(int count);

    /**
     * Records one completed batch import.
     *
     * @param duration     time spent writing the batch
     * @param nodesCreated nodes that did not exist before
     * @param nodesUpdated existing nodes overwritten
     * @param edgesCreated edges that did not exist before
     * @param edgesUpdated existing edges overwritten
     */
    void recordImport(Duration duration, int nodesCreated, int nodesUpdated, int edgesCreated, int edgesUpdated);

    /**
     * Counts a batch file rejected by validation.
     */
    void incrementImportFilesRejected();
}
