package com.aasx.ingest.bulk;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of importing every batch file below a directory.
 */
public record DirectoryImportResult(
        Path directory,
        boolean dryRun,
        List<ImportResult> imported,
        List<FileFailure> failures
) {

    public DirectoryImportResult {
        imported = List.copyOf(imported);
        failures = List.copyOf(failures);
    }

    /**
     * A file that was skipped.
     *
     * @param file       the batch file
     * @param reason     summary
     * @param violations shape violations, or for a partial import the writes whose undo failed
     * @param partial    whether part of the file may have been left in the store
     */
    public record FileFailure(Path file, String reason, List<String> violations, boolean partial) {
        public FileFailure {
            violations = violations != null ? List.copyOf(violations) : List.of();
        }

        public FileFailure(Path file, String reason, List<String> violations) {
            this(file, reason, violations, false);
        }
    }

    public int filesDiscovered() {
        return imported.size() + failures.size();
    }

    public int totalNodesCreated() {
        return imported.stream().mapToInt(ImportResult::nodesCreated).sum();
    }

    public int totalNodesUpdated() {
        return imported.stream().mapToInt(ImportResult::nodesUpdated).sum();
    }

    public int totalEdgesCreated() {
        return imported.stream().mapToInt(ImportResult::edgesCreated).sum();
    }

    public int totalEdgesUpdated() {
        return imported.stream().mapToInt(ImportResult::edgesUpdated).sum();
    }

    public int totalNodesPlanned() {
        return imported.stream().mapToInt(ImportResult::nodesPlanned).sum();
    }

    public int totalEdgesPlanned() {
        return imported.stream().mapToInt(ImportResult::edgesPlanned).sum();
    }

    /**
     * Files that failed and could not be fully undone.
     */
    public List<Path> partialFiles() {
        return failures.stream().filter(FileFailure::partial).map(FileFailure::file).toList();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
