package com.fleetdeck.core.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers direct addresses that recently failed to connect, so routing can
 * prefer a relay for them until the entry expires.
 */
public class ReachabilityTracker {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityTracker.class);

    private final ConcurrentHashMap<String, Instant> badUntil = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public ReachabilityTracker(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public void markUnreachable(String address) {
        if (address == null || address.isBlank()) {
            return;
        }
        badUntil.put(address, clock.instant().plus(ttl));
        log.debug("Marked {} unreachable for {}s", address, ttl.toSeconds());
    }

    public boolean isKnownBad(String address) {
        Instant until = badUntil.get(address);
        if (until == null) {
            return false;
        }
        if (clock.instant().isBefore(until)) {
            return true;
        }
        badUntil.remove(address, until);
        return false;
    }

    public void clear() {
        badUntil.clear();
    }
}
