package com.fleetdeck.core.report;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle on a running live view. Cancelling stops new rounds from starting;
 * a round already in progress finishes and releases its tunnels normally.
 */
public final class LiveSession {

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger rounds = new AtomicInteger();

    LiveSession(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            scheduler.shutdown();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Rounds that have finished, successfully or not. */
    public int roundsCompleted() {
        return rounds.get();
    }

    /**
     * Waits for the loop to stop after {@link #cancel()} or its round limit.
     *
     * @return true if the loop stopped within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    int roundFinished() {
        return rounds.incrementAndGet();
    }
}
