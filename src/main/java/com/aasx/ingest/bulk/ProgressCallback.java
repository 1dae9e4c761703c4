package com.aasx.ingest.bulk;

/**
 * Progress of a multi-file import.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed files handled so far, including rejected ones
     * @param total     files discovered
     * @param message   file just handled and its outcome
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
