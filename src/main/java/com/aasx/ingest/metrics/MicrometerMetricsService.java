package com.aasx.ingest.metrics;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <ul>
 *   <li>{@code aasx.extraction.duration} Timer (tag: outcome)</li>
 *   <li>{@code aasx.entries.parsed} / {@code aasx.entries.failed} Counters (tag: format)</li>
 *   <li>{@code aasx.entities.extracted} Counter (tag: elementType)</li>
 *   <li>{@code aasx.references.dangling} DistributionSummary</li>
 *   <li>{@code aasx.import.duration} Timer</li>
 *   <li>{@code aasx.graph.nodes} / {@code aasx.graph.edges} Counters (tag: change=created|updated)</li>
 *   <li>{@code aasx.import.rejected} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary danglingSummary;
    private final Timer importTimer;
    private final Counter rejectedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.danglingSummary = DistributionSummary.builder("aasx.references.dangling")
                .description("Dangling references dropped per transformed batch")
                .register(registry);
        this.importTimer = Timer.builder("aasx.import.duration")
                .description("Duration of per-file graph imports")
                .register(registry);
        this.rejectedCounter = Counter.builder("aasx.import.rejected")
                .description("Graph batch files rejected by validation")
                .register(registry);
    }

    @Override
    public void recordContainerExtraction(Duration duration, boolean succeeded) {
        String outcome = succeeded ? "success" : "failure";
        timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("aasx.extraction.duration")
                        .description("Duration of single-container extraction")
                        .tag("outcome", outcome)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementEntriesParsed(OriginFormat format) {
        counter("aasx.entries.parsed", "format", format.name()).increment();
    }

    @Override
    public void incrementEntriesFailed(OriginFormat format) {
        counter("aasx.entries.failed", "format", format.name()).increment();
    }

    @Override
    public void incrementEntitiesExtracted(ElementType type, int count) {
        counter("aasx.entities.extracted", "elementType", type.getLabel()).increment(count);
    }

    @Override
    public void recordDanglingReferences(int count) {
        danglingSummary.record(count);
    }

    @Override
    public void recordImport(Duration duration, int nodesCreated, int nodesUpdated,
                             int edgesCreated, int edgesUpdated) {
        importTimer.record(duration);
        counter("aasx.graph.nodes", "change", "created").increment(nodesCreated);
        counter("aasx.graph.nodes", "change", "updated").increment(nodesUpdated);
        counter("aasx.graph.edges", "change", "created").increment(edgesCreated);
        counter("aasx.graph.edges", "change", "updated").increment(edgesUpdated);
    }

    @Override
    public void incrementImportFilesRejected() {
        rejectedCounter.increment();
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
