package com.fleetdeck.core.report;

import com.fleetdeck.core.model.DispatchResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Folds per-node results into a {@link Report}.
 */
public class ReportAggregator {

    private final Clock clock;

    public ReportAggregator(Clock clock) {
        this.clock = clock;
    }

    public <T> Report<T> summarize(String roundId, Instant startedAt, List<DispatchResult<T>> results) {
        int succeeded = 0;
        int timedOut = 0;
        int connectionFailed = 0;
        int commandFailed = 0;
        int skipped = 0;
        for (DispatchResult<T> result : results) {
            switch (result.status()) {
                case SUCCESS -> succeeded++;
                case TIMEOUT -> timedOut++;
                case CONNECTION_FAILED -> connectionFailed++;
                case COMMAND_FAILED -> commandFailed++;
                case SKIPPED -> skipped++;
            }
        }
        return new Report<>(roundId, startedAt, clock.instant(), results,
                succeeded, timedOut, connectionFailed, commandFailed, skipped);
    }
}
