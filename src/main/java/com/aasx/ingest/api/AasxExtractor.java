package com.aasx.ingest.api;

import com.aasx.ingest.container.ContainerEntry;
import com.aasx.ingest.container.ContainerReader;
import com.aasx.ingest.core.model.DocumentRef;
import com.aasx.ingest.core.model.Entity;
import com.aasx.ingest.extract.EntryExtraction;
import com.aasx.ingest.extract.ExtractionWarning;
import com.aasx.ingest.extract.JsonSchemaExtractor;
import com.aasx.ingest.extract.SchemaExtractor;
import com.aasx.ingest.extract.XmlSchemaExtractor;
import com.aasx.ingest.logging.LogContext;
import com.aasx.ingest.metrics.MetricsService;
import com.aasx.ingest.metrics.NoOpMetricsService;
import com.aasx.ingest.normalize.EntityNormalizer;
import com.aasx.ingest.tracing.NoOpTracingService;
import com.aasx.ingest.tracing.Span;
import com.aasx.ingest.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Extracts one container: classifies its entries, runs the schema extractor matching
 * each metadata entry and normalizes the records into {@link Entity} values.
 *
 * <p>Entries are processed one at a time. A malformed entry becomes a
 * {@link ProcessingDiagnostic} and the remaining entries are still processed. Only
 * container-level problems ({@code ContainerNotFoundException},
 * {@code InvalidContainerFormatException}) propagate.</p>
 *
 * <p>Instances hold no per-call state and may be shared between threads.</p>
 */
public class AasxExtractor {
    private static final Logger log = LoggerFactory.getLogger(AasxExtractor.class);

    public static final String PROCESSING_METHOD = "aasx-ingest-java";

    private final SchemaExtractor jsonExtractor;
    private final SchemaExtractor xmlExtractor;
    private final EntityNormalizer normalizer;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;

    public AasxExtractor() {
        this(new NoOpMetricsService(), new NoOpTracingService());
    }

    public AasxExtractor(MetricsService metricsService, TracingService tracingService) {
        this(new JsonSchemaExtractor(), new XmlSchemaExtractor(), new EntityNormalizer(),
                metricsService, tracingService, Clock.systemUTC());
    }

    public AasxExtractor(SchemaExtractor jsonExtractor, SchemaExtractor xmlExtractor,
                         EntityNormalizer normalizer, MetricsService metricsService,
                         TracingService tracingService, Clock clock) {
        this.jsonExtractor = jsonExtractor;
        this.xmlExtractor = xmlExtractor;
        this.normalizer = normalizer;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.clock = clock;
    }

    public ExtractionResult extract(Path containerPath) {
        String containerName = containerPath.getFileName().toString();
        Instant start = clock.instant();
        try (LogContext ctx = LogContext.forExtraction(containerName);
             Span span = tracingService.startSpan("aasx.extract", Map.of("container", containerName))) {
            try {
                ExtractionResult result = doExtract(containerPath, containerName);
                span.attribute("entities", result.assets().size() + result.submodels().size());
                span.succeeded();
                metricsService.recordContainerExtraction(Duration.between(start, clock.instant()), true);
                log.info("extraction.completed container={} assets={} submodels={} documents={} diagnostics={}",
                        containerName, result.assets().size(), result.submodels().size(),
                        result.documents().size(), result.diagnostics().size());
                return result;
            } catch (RuntimeException e) {
                span.failed(e);
                metricsService.recordContainerExtraction(Duration.between(start, clock.instant()), false);
                log.error("extraction.failed container={} error={}", containerName, e.getMessage());
                throw e;
            }
        }
    }

    private ExtractionResult doExtract(Path containerPath, String containerName) {
        List<Entity> assets = new ArrayList<>();
        List<Entity> submodels = new ArrayList<>();
        List<DocumentRef> documents = new ArrayList<>();
        List<String> jsonFiles = new ArrayList<>();
        List<String> xmlFiles = new ArrayList<>();
        List<ProcessingDiagnostic> diagnostics = new ArrayList<>();
        List<ExtractionWarning> warnings = new ArrayList<>();
        long sizeBytes;

        try (ContainerReader reader = ContainerReader.open(containerPath)) {
            sizeBytes = reader.sizeBytes();
            for (ContainerEntry entry : reader) {
                switch (entry.kind()) {
                    case DOCUMENT -> documents.add(DocumentRef.fromEntryName(entry.name(), entry.size()));
                    case JSON_METADATA -> {
                        jsonFiles.add(entry.name());
                        processEntry(reader, entry, jsonExtractor, containerName,
                                assets, submodels, diagnostics, warnings);
                    }
                    case XML_METADATA -> {
                        xmlFiles.add(entry.name());
                        processEntry(reader, entry, xmlExtractor, containerName,
                                assets, submodels, diagnostics, warnings);
                    }
                    case IGNORABLE -> log.trace("extraction.entryIgnored entry={}", entry.name());
                }
            }
        }

        return new ExtractionResult(
                PROCESSING_METHOD,
                containerPath.toString(),
                sizeBytes,
                DateTimeFormatter.ISO_INSTANT.format(clock.instant()),
                assets,
                submodels,
                documents,
                new ExtractionResult.RawData(jsonFiles, xmlFiles),
                diagnostics,
                warnings
        );
    }

    private void processEntry(ContainerReader reader, ContainerEntry entry, SchemaExtractor extractor,
                              String containerName, List<Entity> assets, List<Entity> submodels,
                              List<ProcessingDiagnostic> diagnostics, List<ExtractionWarning> warnings) {
        byte[] content;
        try {
            content = reader.read(entry);
        } catch (IOException e) {
            log.warn("extraction.entryReadFailed entry={} error={}", entry.name(), e.getMessage());
            diagnostics.add(new ProcessingDiagnostic(ProcessingDiagnostic.Kind.ENTRY_READ_FAILURE,
                    entry.name(), e.getMessage()));
            metricsService.incrementEntriesFailed(extractor.format());
            return;
        }

        EntryExtraction extraction = extractor.extract(content, entry.name());
        if (!extraction.isSuccess()) {
            diagnostics.add(new ProcessingDiagnostic(ProcessingDiagnostic.Kind.ENTRY_PARSE_FAILURE,
                    entry.name(), extraction.failureMessage()));
            metricsService.incrementEntriesFailed(extractor.format());
            return;
        }

        metricsService.incrementEntriesParsed(extractor.format());
        warnings.addAll(extraction.warnings());
        for (Entity entity : normalizer.normalizeAll(extraction.records(), containerName)) {
            metricsService.incrementEntitiesExtracted(entity.getElementType(), 1);
            if (entity.getElementType().isAssetGroup()) {
                assets.add(entity);
            } else {
                submodels.add(entity);
            }
        }
        log.debug("extraction.entryProcessed entry={} records={} warnings={}",
                entry.name(), extraction.records().size(), extraction.warnings().size());
    }
}
