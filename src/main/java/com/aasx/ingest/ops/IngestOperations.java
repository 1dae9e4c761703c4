package com.aasx.ingest.ops;

import com.aasx.ingest.analytics.AnalysisReport;
import com.aasx.ingest.analytics.CsvAnalysisExporter;
import com.aasx.ingest.analytics.GraphAnalytics;
import com.aasx.ingest.api.AasxExtractor;
import com.aasx.ingest.api.ExtractionResult;
import com.aasx.ingest.bulk.DirectoryImportResult;
import com.aasx.ingest.bulk.GraphBatchFileWriter;
import com.aasx.ingest.bulk.GraphImporter;
import com.aasx.ingest.bulk.ImportResult;
import com.aasx.ingest.transform.GraphTransformer;
import com.aasx.ingest.transform.ImportBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The operations a command line or web layer exposes: import one file, import a
 * directory (optionally dry-run), run the analysis (optionally exported to CSV),
 * run an ad-hoc read query, and turn a container into a graph batch file.
 */
public class IngestOperations {
    private static final Logger log = LoggerFactory.getLogger(IngestOperations.class);

    private final AasxExtractor extractor;
    private final GraphTransformer transformer;
    private final GraphBatchFileWriter fileWriter;
    private final GraphImporter importer;
    private final GraphAnalytics analytics;
    private final CsvAnalysisExporter csvExporter;

    public IngestOperations(AasxExtractor extractor, GraphTransformer transformer, GraphImporter importer,
                            GraphAnalytics analytics) {
        this(extractor, transformer, new GraphBatchFileWriter(), importer, analytics, new CsvAnalysisExporter());
    }

    public IngestOperations(AasxExtractor extractor, GraphTransformer transformer, GraphBatchFileWriter fileWriter,
                            GraphImporter importer, GraphAnalytics analytics, CsvAnalysisExporter csvExporter) {
        this.extractor = extractor;
        this.transformer = transformer;
        this.fileWriter = fileWriter;
        this.importer = importer;
        this.analytics = analytics;
        this.csvExporter = csvExporter;
    }

    public ImportResult importFile(Path graphFile) {
        return importer.importFile(graphFile);
    }

    public DirectoryImportResult importDirectory(Path directory, boolean dryRun) {
        return importer.importDirectory(directory, dryRun);
    }

    public AnalysisReport runAnalysis(Optional<Path> csvExport) {
        AnalysisReport report = analytics.runAnalysis();
        if (csvExport.isPresent()) {
            try {
                csvExporter.export(report, csvExport.get());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write analysis export " + csvExport.get(), e);
            }
        }
        return report;
    }

    public List<Map<String, Object>> executeQuery(String cypher, Map<String, Object> params) {
        return analytics.executeQuery(cypher, params);
    }

    /**
     * Extracts a container and writes its graph batch file into {@code outputDirectory}.
     *
     * @return the written {@code <container>_graph.json}
     */
    public Path extractToGraphFile(Path container, Path outputDirectory) {
        ExtractionResult result = extractor.extract(container);
        ImportBatch batch = transformer.transform(result);
        try {
            Path written = fileWriter.write(batch, outputDirectory);
            log.info("ops.graphFileCreated container={} file={}", container, written);
            return written;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write graph file for " + container, e);
        }
    }

    /**
     * Extracts, transforms and imports one container without an intermediate file.
     */
    public ImportResult ingestContainer(Path container) {
        ExtractionResult result = extractor.extract(container);
        return importer.importBatch(transformer.transform(result));
    }

    public void createIndexes() {
        importer.createIndexes();
    }
}
