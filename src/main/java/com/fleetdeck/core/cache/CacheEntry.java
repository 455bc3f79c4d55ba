package com.fleetdeck.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One immutable cached value. Refetching replaces the whole entry.
 */
public record CacheEntry<T>(String key, T value, Instant fetchedAt, Duration ttl) {

    public boolean isFresh(Instant now) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }
}
