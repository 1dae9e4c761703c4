package com.aasx.ingest.api;

import com.aasx.ingest.container.ContainerNotFoundException;
import com.aasx.ingest.container.InvalidContainerFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Extracts many containers with bounded parallelism. Each container is extracted
 * independently by the shared {@link AasxExtractor}. Any failure of one container,
 * including an {@link Error} thrown while extracting it, is captured as a
 * {@link ProcessingDiagnostic} for that file and does not affect the others.
 */
public class BatchExtractor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchExtractor.class);

    public static final String CONTAINER_EXTENSION = ".aasx";

    private final AasxExtractor extractor;
    private final ExecutorService executor;

    public BatchExtractor(AasxExtractor extractor, int maxParallelism) {
        if (maxParallelism <= 0) {
            throw new IllegalArgumentException("maxParallelism must be > 0");
        }
        this.extractor = extractor;
        this.executor = Executors.newFixedThreadPool(maxParallelism);
    }

    public BatchExtractionResult extractAll(List<Path> containers) {
        List<Future<ExtractionResult>> futures = new ArrayList<>(containers.size());
        for (Path container : containers) {
            futures.add(executor.submit(() -> extractor.extract(container)));
        }

        List<ExtractionResult> results = new ArrayList<>();
        List<ProcessingDiagnostic> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String source = containers.get(i).toString();
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                failures.add(toDiagnostic(source, e.getCause()));
            } catch (InterruptedException e) {
                futures.subList(i, futures.size()).forEach(future -> future.cancel(true));
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while extracting " + source, e);
            }
        }

        log.info("batchExtraction.completed containers={} succeeded={} failed={}",
                containers.size(), results.size(), failures.size());
        return new BatchExtractionResult(results, failures);
    }

    /**
     * Extracts every {@code .aasx} file below {@code directory}, in path order.
     */
    public BatchExtractionResult extractDirectory(Path directory) {
        return extractAll(findContainers(directory));
    }

    public static List<Path> findContainers(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(CONTAINER_EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan " + directory, e);
        }
    }

    private static ProcessingDiagnostic toDiagnostic(String source, Throwable cause) {
        if (cause instanceof ContainerNotFoundException) {
            return new ProcessingDiagnostic(ProcessingDiagnostic.Kind.CONTAINER_NOT_FOUND, source, cause.getMessage());
        }
        if (cause instanceof InvalidContainerFormatException) {
            return new ProcessingDiagnostic(ProcessingDiagnostic.Kind.INVALID_CONTAINER_FORMAT, source,
                    cause.getMessage());
        }
        log.warn("batchExtraction.containerFailed container={} error={}", source, cause.toString());
        return new ProcessingDiagnostic(ProcessingDiagnostic.Kind.EXTRACTION_FAILURE, source,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
