package com.fleetdeck.core.report;

import com.fleetdeck.core.model.DispatchResult;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Immutable summary of one dispatch round. Results keep node-discovery order.
 */
public record Report<T>(
    String roundId,
    Instant startedAt,
    Instant completedAt,
    List<DispatchResult<T>> results,
    int succeeded,
    int timedOut,
    int connectionFailed,
    int commandFailed,
    int skipped
) implements Serializable {

    public Report {
        results = List.copyOf(results);
    }

    public int total() {
        return results.size();
    }

    /** Nodes that were attempted but did not succeed. */
    public int failed() {
        return timedOut + connectionFailed + commandFailed;
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }
}
