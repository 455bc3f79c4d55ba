package com.fleetdeck.core.model;

public enum DispatchStatus {
    SUCCESS,
    TIMEOUT,
    CONNECTION_FAILED,
    COMMAND_FAILED,
    SKIPPED
}
