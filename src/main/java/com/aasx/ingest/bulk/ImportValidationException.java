package com.aasx.ingest.bulk;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when a graph batch file does not have the expected shape. Nothing from the
 * file has been written when this is thrown.
 */
public class ImportValidationException extends RuntimeException {

    private final transient Path file;
    private final List<String> violations;

    public ImportValidationException(Path file, List<String> violations) {
        super("Invalid graph batch file " + file + ": " + String.join("; ", violations));
        this.file = file;
        this.violations = List.copyOf(violations);
    }

    public ImportValidationException(Path file, String violation, Throwable cause) {
        super("Invalid graph batch file " + file + ": " + violation, cause);
        this.file = file;
        this.violations = List.of(violation);
    }

    public Path getFile() {
        return file;
    }

    public List<String> getViolations() {
        return violations;
    }
}
