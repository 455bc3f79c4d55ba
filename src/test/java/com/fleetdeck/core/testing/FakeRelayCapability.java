package com.fleetdeck.core.testing;

import com.fleetdeck.core.model.RelayScope;
import com.fleetdeck.core.tunnel.RelayCapability;
import com.fleetdeck.core.tunnel.TunnelException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory relay that hands out fake local endpoints and records teardown.
 */
public class FakeRelayCapability implements RelayCapability {

    public final AtomicInteger creations = new AtomicInteger();
    public final List<String> created = new CopyOnWriteArrayList<>();
    public final List<String> destroyed = new CopyOnWriteArrayList<>();

    private final Set<String> dead = ConcurrentHashMap.newKeySet();
    private final Set<String> failingNodes = ConcurrentHashMap.newKeySet();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private volatile CountDownLatch gate;
    private volatile boolean throwOnDestroy;

    /** Creations block until {@code latch} opens. */
    public void holdCreationsUntil(CountDownLatch latch) {
        this.gate = latch;
    }

    public void failFor(String nodeId) {
        failingNodes.add(nodeId);
    }

    /** Creations for {@code nodeId} take {@code delay} before answering. */
    public void delayFor(String nodeId, Duration delay) {
        delays.put(nodeId, delay);
    }

    public void kill(String endpoint) {
        dead.add(endpoint);
    }

    public void throwOnDestroy() {
        this.throwOnDestroy = true;
    }

    @Override
    public String createRelay(String nodeId, RelayScope scope) {
        int n = creations.incrementAndGet();
        CountDownLatch latch = gate;
        if (latch != null) {
            try {
                latch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TunnelException("interrupted");
            }
        }
        Duration delay = delays.get(nodeId);
        if (delay != null) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TunnelException("interrupted");
            }
        }
        if (failingNodes.contains(nodeId)) {
            throw new TunnelException("relay " + scope.relayName() + " rejected " + nodeId);
        }
        String endpoint = "127.0.0.1:" + (40000 + n);
        created.add(endpoint);
        return endpoint;
    }

    @Override
    public void destroyRelay(String endpoint) {
        destroyed.add(endpoint);
        if (throwOnDestroy) {
            throw new IllegalStateException("teardown failed for " + endpoint);
        }
    }

    @Override
    public boolean isAlive(String endpoint) {
        return !dead.contains(endpoint) && !destroyed.contains(endpoint);
    }
}
