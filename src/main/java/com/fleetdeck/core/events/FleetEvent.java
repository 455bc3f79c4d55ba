package com.fleetdeck.core.events;

import com.fleetdeck.core.model.DispatchStatus;
import com.fleetdeck.core.model.RouteMode;

import java.time.Duration;
import java.time.Instant;

/**
 * Progress of a dispatch round. Node events carry the node id; round events
 * carry the number of nodes in the round.
 *
 * @param type      what happened
 * @param roundId   the round this event belongs to
 * @param nodeId    the node, or null for round events
 * @param route     how the node is reached, set on {@link Type#NODE_STARTED}
 * @param status    the node's outcome, set on {@link Type#NODE_COMPLETED}
 * @param nodeCount nodes in the round, set on round events
 * @param elapsed   time spent so far, set on completion events
 * @param timestamp when the event occurred
 */
public record FleetEvent(
    Type type,
    String roundId,
    String nodeId,
    RouteMode route,
    DispatchStatus status,
    int nodeCount,
    Duration elapsed,
    Instant timestamp
) {

    public enum Type {
        ROUND_STARTED,
        NODE_STARTED,
        NODE_COMPLETED,
        ROUND_COMPLETED
    }

    public static FleetEvent roundStarted(String roundId, int nodeCount) {
        return new FleetEvent(Type.ROUND_STARTED, roundId, null, null, null, nodeCount, null, Instant.now());
    }

    public static FleetEvent nodeStarted(String roundId, String nodeId, RouteMode route) {
        return new FleetEvent(Type.NODE_STARTED, roundId, nodeId, route, null, 0, null, Instant.now());
    }

    public static FleetEvent nodeCompleted(String roundId, String nodeId, DispatchStatus status, Duration elapsed) {
        return new FleetEvent(Type.NODE_COMPLETED, roundId, nodeId, null, status, 0, elapsed, Instant.now());
    }

    public static FleetEvent roundCompleted(String roundId, int nodeCount, Duration elapsed) {
        return new FleetEvent(Type.ROUND_COMPLETED, roundId, null, null, null, nodeCount, elapsed, Instant.now());
    }

    public boolean isNodeEvent() {
        return nodeId != null;
    }
}
