package com.fleetdeck.core.model;

public enum NodeState {
    RUNNING,
    STOPPED,
    UNKNOWN
}
