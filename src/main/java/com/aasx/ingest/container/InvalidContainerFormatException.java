package com.aasx.ingest.container;

/**
 * Thrown when a container exists but cannot be opened as a ZIP archive.
 */
public class InvalidContainerFormatException extends RuntimeException {

    public InvalidContainerFormatException(String message) {
        super(message);
    }

    public InvalidContainerFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
