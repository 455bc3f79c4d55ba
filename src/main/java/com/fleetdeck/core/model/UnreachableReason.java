package com.fleetdeck.core.model;

/**
 * Why a node got no usable route. Only {@link #RELAY_FAILED} counts as an
 * attempted connection; the others are reported as skipped.
 */
public enum UnreachableReason {
    NO_ROUTE,
    NODE_STOPPED,
    RELAY_UNAVAILABLE,
    RELAY_DECLINED,
    RELAY_FAILED;

    public boolean attempted() {
        return this == RELAY_FAILED;
    }
}
