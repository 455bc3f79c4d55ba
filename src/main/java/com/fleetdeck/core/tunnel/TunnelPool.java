package com.fleetdeck.core.tunnel;

import com.fleetdeck.core.metrics.FleetMetrics;
import com.fleetdeck.core.model.RelayScope;
import com.fleetdeck.core.model.TunnelHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every relay tunnel the process opens.
 *
 * <p>There is at most one live tunnel per {@code (nodeId, scope)}. Concurrent
 * {@link #acquire} calls for the same key coalesce onto one in-flight creation.
 * {@link #release} only drops a reference; idle tunnels are closed later by
 * {@link #reap()} once they have been idle longer than the grace period, or by
 * {@link #closeAll()} at shutdown. State changes are serialized per key through
 * {@link ConcurrentHashMap#compute}; there is no pool-wide lock. Capacity is
 * counted in a separate slot counter that is reserved before a new key is
 * inserted and returned whenever a key is removed.
 */
public class TunnelPool {

    private static final Logger log = LoggerFactory.getLogger(TunnelPool.class);

    private final ConcurrentHashMap<String, PooledTunnel> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<RelayScope, Instant> backoffUntil = new ConcurrentHashMap<>();
    private final AtomicInteger slots = new AtomicInteger();
    private final RelayCapability relay;
    private final Clock clock;
    private final Settings settings;
    private final FleetMetrics metrics;
    private final ExecutorService setupExecutor;

    /**
     * Pool tuning.
     *
     * @param setupTimeout   how long an acquire waits for a tunnel to come up
     * @param idleGrace      how long an unreferenced tunnel is kept for reuse
     * @param failureBackoff how long a relay scope fails fast after a creation failure
     * @param maxTunnels     maximum number of tunnels held at once
     */
    public record Settings(Duration setupTimeout, Duration idleGrace, Duration failureBackoff, int maxTunnels) {
        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(30), Duration.ofMinutes(5), Duration.ofSeconds(30), 50);
        }
    }

    public TunnelPool(RelayCapability relay, Clock clock, Settings settings) {
        this(relay, clock, settings, null);
    }

    public TunnelPool(RelayCapability relay, Clock clock, Settings settings, FleetMetrics metrics) {
        this.relay = relay;
        this.clock = clock;
        this.settings = settings;
        this.metrics = metrics;
        var threadCount = new AtomicInteger();
        this.setupExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tunnel-setup-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Returns a referenced tunnel to {@code nodeId} through {@code scope},
     * creating one if none is live. Blocks at most the setup timeout.
     *
     * @throws TunnelException if creation fails, times out, the scope is backing
     *                         off after a recent failure, or the pool is full
     */
    public TunnelHandle acquire(String nodeId, RelayScope scope) {
        Instant blockedUntil = backoffUntil.get(scope);
        if (blockedUntil != null) {
            if (clock.instant().isBefore(blockedUntil)) {
                throw new TunnelException("Relay " + scope + " is backing off after a failure until " + blockedUntil);
            }
            backoffUntil.remove(scope, blockedUntil);
        }

        String key = key(nodeId, scope);
        boolean reserved = false;
        if (!entries.containsKey(key)) {
            reserveSlot();
            reserved = true;
        }

        var replaced = new ArrayList<PooledTunnel>(1);
        var created = new AtomicBoolean(false);
        var slotTaken = new AtomicBoolean(false);
        boolean holdsReservation = reserved;
        PooledTunnel entry;
        try {
            entry = entries.compute(key, (k, existing) -> {
                Instant now = clock.instant();
                if (existing != null && isReusable(existing)) {
                    existing.refCount++;
                    existing.lastUsedAt = now;
                    return existing;
                }
                if (existing != null) {
                    replaced.add(existing);
                } else if (holdsReservation) {
                    slotTaken.set(true);
                } else if (!tryTakeSlot()) {
                    throw poolFull();
                } else {
                    slotTaken.set(true);
                }
                created.set(true);
                var fresh = new PooledTunnel(UUID.randomUUID().toString(), nodeId, scope, now);
                fresh.refCount = 1;
                return fresh;
            });
        } finally {
            if (reserved && !slotTaken.get()) {
                slots.decrementAndGet();
            }
        }

        replaced.forEach(dead -> {
            log.info("Replacing dead relay tunnel {} for {} via {}", dead.relayId, nodeId, scope);
            destroy(dead);
        });

        if (created.get()) {
            startCreation(entry);
        } else {
            record("reuse");
        }
        return awaitEstablished(key, entry);
    }

    /**
     * Drops one reference. Never closes the tunnel; the reaper does that once
     * it has sat idle past the grace period. Releasing a handle whose tunnel
     * is already gone is a no-op.
     */
    public void release(TunnelHandle handle) {
        entries.computeIfPresent(key(handle.nodeId(), handle.scope()), (k, e) -> {
            if (e.relayId.equals(handle.relayId()) && e.refCount > 0) {
                e.refCount--;
                e.lastUsedAt = clock.instant();
            }
            return e;
        });
    }

    /**
     * Closes unreferenced tunnels that have been idle longer than the grace
     * period, and unreferenced tunnels that are no longer alive.
     *
     * @return number of tunnels closed
     */
    public int reap() {
        var doomed = new ArrayList<PooledTunnel>();
        for (Map.Entry<String, PooledTunnel> candidate : entries.entrySet()) {
            entries.computeIfPresent(candidate.getKey(), (k, e) -> {
                if (e != candidate.getValue() || e.refCount > 0 || !e.isEstablished()) {
                    return e;
                }
                Duration idle = Duration.between(e.lastUsedAt, clock.instant());
                if (idle.compareTo(settings.idleGrace()) > 0 || !relay.isAlive(e.endpointNow())) {
                    doomed.add(e);
                    return null;
                }
                return e;
            });
        }
        for (PooledTunnel e : doomed) {
            slots.decrementAndGet();
            log.debug("Reaping idle relay tunnel {} for {} via {}", e.relayId, e.nodeId, e.scope);
            destroy(e);
            record("reap");
        }
        return doomed.size();
    }

    /** Force-closes every tunnel regardless of references. Used at shutdown. */
    public void closeAll() {
        int closed = 0;
        for (String key : List.copyOf(entries.keySet())) {
            PooledTunnel e = entries.remove(key);
            if (e != null) {
                slots.decrementAndGet();
                e.endpoint.completeExceptionally(new TunnelException("Tunnel pool closed"));
                destroy(e);
                record("close");
                closed++;
            }
        }
        setupExecutor.shutdownNow();
        if (closed > 0) {
            log.info("Closed {} relay tunnel(s)", closed);
        }
    }

    /** Snapshot of the tunnel for {@code (nodeId, scope)}, if one is held. */
    public Optional<TunnelHandle> find(String nodeId, RelayScope scope) {
        PooledTunnel e = entries.get(key(nodeId, scope));
        return e == null ? Optional.empty() : Optional.of(e.snapshot());
    }

    /** Snapshots of every established tunnel. */
    public List<TunnelHandle> handles() {
        return entries.values().stream()
                .filter(PooledTunnel::isEstablished)
                .map(PooledTunnel::snapshot)
                .toList();
    }

    public PoolStats stats() {
        int inUse = 0;
        int idle = 0;
        int pending = 0;
        for (PooledTunnel e : entries.values()) {
            if (!e.isEstablished()) pending++;
            else if (e.refCount > 0) inUse++;
            else idle++;
        }
        Instant now = clock.instant();
        int backedOff = (int) backoffUntil.values().stream().filter(now::isBefore).count();
        return new PoolStats(entries.size(), inUse, idle, pending, backedOff, settings.maxTunnels());
    }

    private boolean isReusable(PooledTunnel e) {
        if (e.closed.get() || e.endpoint.isCompletedExceptionally()) {
            return false;
        }
        if (!e.isEstablished() || e.refCount > 0) {
            return true;
        }
        return relay.isAlive(e.endpointNow());
    }

    private void startCreation(PooledTunnel entry) {
        log.info("Opening relay tunnel for {} via {}", entry.nodeId, entry.scope);
        CompletableFuture
                .supplyAsync(() -> relay.createRelay(entry.nodeId, entry.scope), setupExecutor)
                .whenComplete((endpoint, err) -> {
                    if (err != null) {
                        entry.endpoint.completeExceptionally(err);
                    } else if (!entry.endpoint.complete(endpoint)) {
                        // The acquire already gave up on this entry
                        log.debug("Late relay tunnel {} for {} discarded", endpoint, entry.nodeId);
                        destroyQuietly(endpoint);
                    }
                });
    }

    private TunnelHandle awaitEstablished(String key, PooledTunnel entry) {
        try {
            entry.endpoint.get(settings.setupTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return entry.snapshot();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw fail(key, entry, "Relay tunnel to " + entry.nodeId + " via " + entry.scope
                    + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            entry.endpoint.completeExceptionally(e);
            throw fail(key, entry, "Relay tunnel to " + entry.nodeId + " via " + entry.scope
                    + " not ready after " + settings.setupTimeout().toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(entry.snapshot());
            throw new TunnelException("Interrupted waiting for relay tunnel to " + entry.nodeId, e);
        }
    }

    private TunnelException fail(String key, PooledTunnel entry, String message, Throwable cause) {
        if (entries.remove(key, entry)) {
            slots.decrementAndGet();
            backoffUntil.put(entry.scope, clock.instant().plus(settings.failureBackoff()));
            log.warn("{}; backing off relay {} for {}s", message, entry.scope,
                    settings.failureBackoff().toSeconds());
            destroy(entry);
            record("fail");
        }
        return new TunnelException(message, cause);
    }

    /**
     * Takes one capacity slot for a new key, evicting the least recently used
     * idle tunnel when the pool is full.
     */
    private void reserveSlot() {
        while (!tryTakeSlot()) {
            if (!evictLeastRecentlyUsed()) {
                throw poolFull();
            }
        }
    }

    private boolean tryTakeSlot() {
        while (true) {
            int taken = slots.get();
            if (taken >= settings.maxTunnels()) {
                return false;
            }
            if (slots.compareAndSet(taken, taken + 1)) {
                return true;
            }
        }
    }

    private boolean evictLeastRecentlyUsed() {
        while (true) {
            Optional<Map.Entry<String, PooledTunnel>> lru = entries.entrySet().stream()
                    .filter(e -> e.getValue().isEstablished() && e.getValue().refCount == 0)
                    .min(Comparator.comparing(e -> e.getValue().lastUsedAt));
            if (lru.isEmpty()) {
                return false;
            }
            PooledTunnel victim = lru.get().getValue();
            var evicted = new AtomicBoolean(false);
            entries.computeIfPresent(lru.get().getKey(), (k, e) -> {
                if (e == victim && e.refCount == 0) {
                    evicted.set(true);
                    return null;
                }
                return e;
            });
            if (evicted.get()) {
                slots.decrementAndGet();
                log.info("Tunnel pool full, evicting idle tunnel for {} via {}", victim.nodeId, victim.scope);
                destroy(victim);
                record("evict");
                return true;
            }
        }
    }

    private TunnelException poolFull() {
        return new TunnelException("Tunnel pool is full (" + settings.maxTunnels() + " tunnels in use)");
    }

    private void destroy(PooledTunnel e) {
        if (!e.closed.compareAndSet(false, true)) {
            return;
        }
        String endpoint = e.endpointNow();
        if (endpoint != null) {
            destroyQuietly(endpoint);
        }
    }

    private void destroyQuietly(String endpoint) {
        try {
            relay.destroyRelay(endpoint);
        } catch (Exception ex) {
            log.debug("Ignoring failure tearing down relay tunnel {}: {}", endpoint, ex.getMessage());
        }
    }

    private void record(String operation) {
        if (metrics != null) {
            metrics.recordTunnelOperation(operation);
        }
    }

    private static String key(String nodeId, RelayScope scope) {
        return nodeId + "@" + scope;
    }

    /** Live pool state for one key. Mutable fields are only written inside {@code compute}. */
    private static final class PooledTunnel {
        final String relayId;
        final String nodeId;
        final RelayScope scope;
        final Instant createdAt;
        final CompletableFuture<String> endpoint = new CompletableFuture<>();
        final AtomicBoolean closed = new AtomicBoolean(false);
        volatile Instant lastUsedAt;
        volatile int refCount;

        PooledTunnel(String relayId, String nodeId, RelayScope scope, Instant createdAt) {
            this.relayId = relayId;
            this.nodeId = nodeId;
            this.scope = scope;
            this.createdAt = createdAt;
            this.lastUsedAt = createdAt;
        }

        boolean isEstablished() {
            return endpoint.isDone() && !endpoint.isCompletedExceptionally();
        }

        String endpointNow() {
            return isEstablished() ? endpoint.getNow(null) : null;
        }

        TunnelHandle snapshot() {
            return new TunnelHandle(relayId, nodeId, scope, endpointNow(),
                    scope.relayName(), createdAt, lastUsedAt, refCount);
        }
    }
}
