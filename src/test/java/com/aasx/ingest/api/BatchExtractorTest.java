package com.aasx.ingest.api;

import com.aasx.ingest.core.model.OriginFormat;
import com.aasx.ingest.extract.EntryExtraction;
import com.aasx.ingest.extract.JsonSchemaExtractor;
import com.aasx.ingest.extract.SchemaExtractor;
import com.aasx.ingest.metrics.NoOpMetricsService;
import com.aasx.ingest.normalize.EntityNormalizer;
import com.aasx.ingest.testutil.ContainerFixtures;
import com.aasx.ingest.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchExtractorTest {

    @TempDir
    Path tempDir;

    private final BatchExtractor batchExtractor = new BatchExtractor(new AasxExtractor(), 2);

    @AfterEach
    void tearDown() {
        batchExtractor.close();
    }

    @Test
    @DisplayName("Results keep input order and container failures become diagnostics")
    void extractAll() throws IOException {
        Path good = ContainerFixtures.container()
                .entry("aasx/model.json", ContainerFixtures.SIMPLE_JSON)
                .writeTo(tempDir.resolve("a.aasx"));
        Path xml = ContainerFixtures.container()
                .entry("aasx/pump.aas.xml", ContainerFixtures.SIMPLE_XML)
                .writeTo(tempDir.resolve("b.aasx"));
        Path broken = Files.writeString(tempDir.resolve("c.aasx"), "garbage");
        Path missing = tempDir.resolve("d.aasx");

        BatchExtractionResult result = batchExtractor.extractAll(List.of(good, xml, broken, missing));

        assertEquals(2, result.results().size());
        assertEquals(good.toString(), result.results().get(0).sourceFile());
        assertEquals(xml.toString(), result.results().get(1).sourceFile());
        assertEquals(2, result.failures().size());
        assertEquals(ProcessingDiagnostic.Kind.INVALID_CONTAINER_FORMAT, result.failures().get(0).kind());
        assertEquals(ProcessingDiagnostic.Kind.CONTAINER_NOT_FOUND, result.failures().get(1).kind());
        assertTrue(result.hasFailures());
    }

    @Test
    @DisplayName("An unexpected extractor failure is recorded for its container only")
    void unexpectedFailureStaysWithItsContainer() throws IOException {
        SchemaExtractor failingXml = new SchemaExtractor() {
            @Override
            public OriginFormat format() {
                return OriginFormat.XML_V1;
            }

            @Override
            public EntryExtraction extract(byte[] content, String sourceFile) {
                throw new IllegalStateException("boom");
            }
        };
        AasxExtractor extractor = new AasxExtractor(new JsonSchemaExtractor(), failingXml, new EntityNormalizer(),
                new NoOpMetricsService(), new NoOpTracingService(), Clock.systemUTC());
        Path first = ContainerFixtures.container()
                .entry("aasx/model.json", ContainerFixtures.SIMPLE_JSON)
                .writeTo(tempDir.resolve("first.aasx"));
        Path failing = ContainerFixtures.container()
                .entry("aasx/pump.aas.xml", ContainerFixtures.SIMPLE_XML)
                .writeTo(tempDir.resolve("failing.aasx"));
        Path last = ContainerFixtures.container()
                .entry("aasx/model.json", ContainerFixtures.SIMPLE_JSON)
                .writeTo(tempDir.resolve("last.aasx"));

        BatchExtractionResult result;
        try (BatchExtractor batch = new BatchExtractor(extractor, 2)) {
            result = batch.extractAll(List.of(first, failing, last));
        }

        assertEquals(2, result.results().size());
        assertEquals(first.toString(), result.results().get(0).sourceFile());
        assertEquals(last.toString(), result.results().get(1).sourceFile());
        assertEquals(1, result.failures().size());
        ProcessingDiagnostic failure = result.failures().get(0);
        assertEquals(ProcessingDiagnostic.Kind.EXTRACTION_FAILURE, failure.kind());
        assertEquals(failing.toString(), failure.sourceFile());
        assertTrue(failure.message().contains("boom"));
    }

    @Test
    @DisplayName("Finds .aasx files recursively in path order")
    void findContainers() throws IOException {
        Files.createDirectories(tempDir.resolve("sub"));
        ContainerFixtures.container().entry("x.json", "{}").writeTo(tempDir.resolve("sub/z.aasx"));
        ContainerFixtures.container().entry("x.json", "{}").writeTo(tempDir.resolve("a.AASX"));
        Files.writeString(tempDir.resolve("notes.txt"), "skip");

        List<Path> found = BatchExtractor.findContainers(tempDir);

        assertEquals(List.of(tempDir.resolve("a.AASX"), tempDir.resolve("sub/z.aasx")), found);
        assertEquals(2, batchExtractor.extractDirectory(tempDir).results().size());
    }

    @Test
    void rejectsNonDirectory() {
        assertThrows(IllegalArgumentException.class, () -> BatchExtractor.findContainers(tempDir.resolve("none")));
    }

    @Test
    void rejectsNonPositiveParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new BatchExtractor(new AasxExtractor(), 0));
    }
}
