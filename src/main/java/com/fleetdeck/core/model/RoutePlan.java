package com.fleetdeck.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-node connection decision for one dispatch round.
 *
 * <p>{@code RELAYED} plans always carry the relay id of a pooled tunnel and
 * the tunnel's creation time as {@code establishedAt}. {@code DIRECT} and
 * {@code UNREACHABLE} plans carry no timestamp, so resolving an unchanged
 * node twice yields equal plans. {@code UNREACHABLE} plans always carry a
 * reason and never reach a worker.
 */
public record RoutePlan(
    String nodeId,
    RouteMode mode,
    String endpoint,
    String relayId,
    UnreachableReason unreachableReason,
    String reason,
    Instant establishedAt
) implements Serializable {

    public RoutePlan {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(mode, "mode");
        if (mode == RouteMode.RELAYED && (relayId == null || establishedAt == null)) {
            throw new IllegalArgumentException("RELAYED plan for " + nodeId + " has no relay id or creation time");
        }
        if (mode == RouteMode.UNREACHABLE && (unreachableReason == null || reason == null)) {
            throw new IllegalArgumentException("UNREACHABLE plan for " + nodeId + " has no reason");
        }
    }

    public static RoutePlan direct(String nodeId, String endpoint) {
        return new RoutePlan(nodeId, RouteMode.DIRECT, endpoint, null, null, null, null);
    }

    public static RoutePlan relayed(String nodeId, String endpoint, String relayId, Instant at) {
        return new RoutePlan(nodeId, RouteMode.RELAYED, endpoint, relayId, null, null, at);
    }

    public static RoutePlan unreachable(String nodeId, UnreachableReason why, String reason) {
        return new RoutePlan(nodeId, RouteMode.UNREACHABLE, null, null, why, reason, null);
    }

    public boolean dispatchable() {
        return mode != RouteMode.UNREACHABLE;
    }
}
