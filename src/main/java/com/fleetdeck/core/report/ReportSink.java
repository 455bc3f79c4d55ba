package com.fleetdeck.core.report;

/**
 * Receives finished reports, one per round.
 */
public interface ReportSink<T> {

    void accept(Report<T> report);

    /** Called instead of {@link #accept} when a live round could not run at all. */
    default void onRoundFailed(Throwable error) {
    }
}
