package com.aasx.ingest.graph;

import com.aasx.ingest.health.HealthCheck;
import com.aasx.ingest.health.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polls a {@link HealthCheck} with exponential backoff until it reports up or the
 * deadline passes. Never waits unbounded.
 */
public class StoreReadinessProbe {
    private static final Logger log = LoggerFactory.getLogger(StoreReadinessProbe.class);

    /**
     * Pause between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final HealthCheck healthCheck;
    private final Duration timeout;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Clock clock;
    private final Sleeper sleeper;

    public StoreReadinessProbe(HealthCheck healthCheck, GraphStoreConfig config) {
        this(healthCheck, config.getReadinessTimeout(), config.getInitialBackoff(), config.getMaxBackoff(),
                Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()));
    }

    public StoreReadinessProbe(HealthCheck healthCheck, Duration timeout, Duration initialBackoff,
                               Duration maxBackoff, Clock clock, Sleeper sleeper) {
        this.healthCheck = healthCheck;
        this.timeout = timeout;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Waits up to the configured timeout.
     *
     * @return number of attempts it took
     * @throws ConnectionFailureException if the store is still down at the deadline
     */
    public int awaitReady() {
        return awaitReady(timeout);
    }

    public int awaitReady(Duration deadlineAfter) {
        Instant start = clock.instant();
        Instant deadline = start.plus(deadlineAfter);
        Duration backoff = initialBackoff;
        int attempts = 0;
        HealthStatus status;

        while (true) {
            attempts++;
            status = healthCheck.check();
            if (status.up()) {
                if (attempts > 1) {
                    log.info("graphStore.ready attempts={} waited={}", attempts, Duration.between(start, clock.instant()));
                }
                return attempts;
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                break;
            }
            Duration remaining = Duration.between(now, deadline);
            Duration pause = backoff.compareTo(remaining) < 0 ? backoff : remaining;
            log.warn("graphStore.notReady attempt={} retryIn={} reason={}", attempts, pause, status.message());
            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionFailureException("Interrupted while waiting for graph store", e);
            }
            backoff = backoff.multipliedBy(2);
            if (backoff.compareTo(maxBackoff) > 0) {
                backoff = maxBackoff;
            }
        }

        Duration elapsed = Duration.between(start, clock.instant());
        log.error("graphStore.unreachable attempts={} elapsed={} reason={}", attempts, elapsed, status.message());
        throw new ConnectionFailureException(
                "Graph store not ready after " + attempts + " attempts in " + elapsed + ": " + status.message(),
                attempts, elapsed);
    }
}
