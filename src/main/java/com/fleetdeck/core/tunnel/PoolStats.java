package com.fleetdeck.core.tunnel;

/**
 * Point-in-time counts for the tunnel pool.
 *
 * @param total          entries currently held, including pending ones
 * @param inUse          entries with at least one holder
 * @param idle           established entries nobody holds
 * @param pending        entries still being set up
 * @param backedOffScopes relay scopes currently refusing new tunnels after a failure
 * @param maxTunnels     capacity limit
 */
public record PoolStats(int total, int inUse, int idle, int pending, int backedOffScopes, int maxTunnels) {}
