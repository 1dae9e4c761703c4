package com.aasx.ingest.container;

import java.nio.file.Path;

/**
 * Thrown when a container path does not exist or is not a regular file.
 */
public class ContainerNotFoundException extends RuntimeException {

    private final transient Path path;

    public ContainerNotFoundException(Path path) {
        super("Container not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
