package com.fleetdeck.core.cache;

import com.fleetdeck.core.metrics.FleetMetrics;
import com.fleetdeck.core.metrics.FleetMetrics.CacheLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Per-key TTL cache with single-flight refetch.
 *
 * <p>A read inside the entry's TTL returns the cached value. A read after it
 * runs the fetch function exactly once per key no matter how many callers
 * arrive concurrently; the others wait (bounded by {@code maxWait}) for the
 * same result. Entries are swapped whole, so readers see either the old or the
 * new value. Failed fetches propagate to every waiting caller and leave the
 * previous entry in place; failures are never cached. Lookups are counted as
 * hits, misses, or coalesced when a caller waits on another caller's fetch.
 */
public class SessionCache {

    private static final Logger log = LoggerFactory.getLogger(SessionCache.class);

    private final ConcurrentHashMap<String, CacheEntry<?>> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration maxWait;
    private final FleetMetrics metrics;

    public SessionCache(Clock clock, Duration maxWait) {
        this(clock, maxWait, null);
    }

    public SessionCache(Clock clock, Duration maxWait, FleetMetrics metrics) {
        this.clock = clock;
        this.maxWait = maxWait;
        this.metrics = metrics;
    }

    /**
     * Returns the cached value for {@code key} if it is younger than {@code ttl},
     * otherwise fetches, caches and returns a new one.
     *
     * @param key   cache key
     * @param ttl   how long a fetched value stays fresh
     * @param fetch loads the value; its exceptions propagate unchanged
     * @return the cached or freshly fetched value
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrFetch(String key, Duration ttl, Supplier<T> fetch) {
        CacheEntry<?> cached = entries.get(key);
        if (cached != null && cached.isFresh(clock.instant())) {
            recordLookup(CacheLookup.HIT);
            return (T) cached.value();
        }

        var mine = new CompletableFuture<Object>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            recordLookup(CacheLookup.COALESCED);
            return (T) await(key, existing);
        }

        try {
            // Another flight may have finished between the freshness check and putIfAbsent
            cached = entries.get(key);
            if (cached != null && cached.isFresh(clock.instant())) {
                recordLookup(CacheLookup.HIT);
                mine.complete(cached.value());
                return (T) cached.value();
            }

            recordLookup(CacheLookup.MISS);
            log.debug("Cache miss for {}, fetching", key);
            T value = fetch.get();
            entries.put(key, new CacheEntry<>(key, value, clock.instant(), ttl));
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public void invalidate(String key) {
        entries.remove(key);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private Object await(String key, CompletableFuture<Object> flight) {
        try {
            return flight.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new SessionCacheException("Fetch for " + key + " failed", cause);
        } catch (TimeoutException e) {
            throw new SessionCacheException("Timed out after " + maxWait.toMillis()
                    + "ms waiting for in-flight fetch of " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionCacheException("Interrupted waiting for in-flight fetch of " + key, e);
        }
    }

    private void recordLookup(CacheLookup result) {
        if (metrics != null) {
            metrics.recordCacheLookup(result);
        }
    }
}
