package com.aasx.ingest.bulk;

import java.util.List;

/**
 * Thrown when a batch write failed and some of its undo actions failed as well, so part
 * of the batch may still be in the store. The failed write is the cause; each failed
 * undo is attached as a suppressed exception.
 */
public class PartialImportException extends RuntimeException {

    private final String batch;
    private final List<String> failedUndoSteps;

    public PartialImportException(String batch, List<String> failedUndoSteps, Throwable cause) {
        super("Import of " + batch + " failed and could not be fully undone; "
                + failedUndoSteps.size() + " undo step(s) failed: " + String.join(", ", failedUndoSteps), cause);
        this.batch = batch;
        this.failedUndoSteps = List.copyOf(failedUndoSteps);
    }

    public String getBatch() {
        return batch;
    }

    /**
     * Descriptions of the writes whose undo failed; these may still be in the store.
     */
    public List<String> getFailedUndoSteps() {
        return failedUndoSteps;
    }
}
