package com.fleetdeck.core.model;

public enum RouteMode {
    DIRECT,
    RELAYED,
    UNREACHABLE
}
