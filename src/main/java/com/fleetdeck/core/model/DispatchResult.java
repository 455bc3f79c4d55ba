package com.fleetdeck.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Outcome of one node in a dispatch round. Written by the dispatcher,
 * read by the report aggregator.
 *
 * @param nodeId        the node this result belongs to
 * @param status        what happened
 * @param payload       unit-of-work result, only for {@link DispatchStatus#SUCCESS}
 * @param reason        human-readable failure or skip reason (null on success)
 * @param partialOutput output captured before a command failed, if any
 * @param elapsed       wall-clock time spent on the node
 */
public record DispatchResult<T>(
    String nodeId,
    DispatchStatus status,
    T payload,
    String reason,
    String partialOutput,
    Duration elapsed
) implements Serializable {

    public static <T> DispatchResult<T> success(String nodeId, T payload, Duration elapsed) {
        return new DispatchResult<>(nodeId, DispatchStatus.SUCCESS, payload, null, null, elapsed);
    }

    public static <T> DispatchResult<T> timeout(String nodeId, String reason, Duration elapsed) {
        return new DispatchResult<>(nodeId, DispatchStatus.TIMEOUT, null, reason, null, elapsed);
    }

    public static <T> DispatchResult<T> connectionFailed(String nodeId, String reason, Duration elapsed) {
        return new DispatchResult<>(nodeId, DispatchStatus.CONNECTION_FAILED, null, reason, null, elapsed);
    }

    public static <T> DispatchResult<T> commandFailed(String nodeId, String reason, String partialOutput,
                                                      Duration elapsed) {
        return new DispatchResult<>(nodeId, DispatchStatus.COMMAND_FAILED, null, reason, partialOutput, elapsed);
    }

    public static <T> DispatchResult<T> skipped(String nodeId, String reason) {
        return new DispatchResult<>(nodeId, DispatchStatus.SKIPPED, null, reason, null, Duration.ZERO);
    }

    public boolean succeeded() {
        return status == DispatchStatus.SUCCESS;
    }
}
