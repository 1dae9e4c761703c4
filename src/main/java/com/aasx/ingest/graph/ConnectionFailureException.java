package com.aasx.ingest.graph;

import java.time.Duration;

/**
 * Thrown when the graph store did not become reachable within the readiness window.
 */
public class ConnectionFailureException extends RuntimeException {

    private final int attempts;
    private final Duration elapsed;

    public ConnectionFailureException(String message, int attempts, Duration elapsed) {
        super(message);
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    public ConnectionFailureException(String message, Throwable cause) {
        super(message, cause);
        this.attempts = 1;
        this.elapsed = Duration.ZERO;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
