package com.fleetdeck.core.tunnel;

import com.fleetdeck.core.metrics.FleetMetrics;
import com.fleetdeck.core.model.RelayScope;
import com.fleetdeck.core.model.TunnelHandle;
import com.fleetdeck.core.testing.FakeRelayCapability;
import com.fleetdeck.core.testing.TestClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class TunnelPoolTest {

    private static final RelayScope EAST = new RelayScope("bastion-east", "eastus");
    private static final RelayScope WEST = new RelayScope("bastion-west", "westus");

    private TestClock clock;
    private FakeRelayCapability relay;
    private TunnelPool pool;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        relay = new FakeRelayCapability();
        pool = new TunnelPool(relay, clock, TunnelPool.Settings.defaults());
    }

    @AfterEach
    void tearDown() {
        pool.closeAll();
    }

    @Nested
    @DisplayName("acquire")
    class Acquire {

        @Test
        @DisplayName("creates a tunnel and hands out a referenced handle")
        void createsTunnel() {
            TunnelHandle handle = pool.acquire("node-c", EAST);

            assertEquals("node-c", handle.nodeId());
            assertEquals(EAST, handle.scope());
            assertEquals("127.0.0.1:40001", handle.localEndpoint());
            assertEquals(1, handle.refCount());
            assertEquals(clock.instant(), handle.createdAt());
        }

        @Test
        @DisplayName("reuses the live tunnel for the same node and scope")
        void reusesTunnel() {
            TunnelHandle first = pool.acquire("node-c", EAST);
            TunnelHandle second = pool.acquire("node-c", EAST);

            assertEquals(first.relayId(), second.relayId());
            assertEquals(2, second.refCount());
            assertEquals(1, relay.creations.get());
        }

        @Test
        @DisplayName("different scopes get different tunnels")
        void scopesAreSeparate() {
            TunnelHandle east = pool.acquire("node-c", EAST);
            TunnelHandle west = pool.acquire("node-c", WEST);

            assertNotEquals(east.relayId(), west.relayId());
            assertEquals(2, relay.creations.get());
        }

        @Test
        @DisplayName("concurrent acquires for one key coalesce onto a single creation")
        void concurrentAcquiresCoalesce() throws Exception {
            var gate = new CountDownLatch(1);
            relay.holdCreationsUntil(gate);

            int callers = 10;
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            try {
                var futures = new ArrayList<Future<TunnelHandle>>();
                for (int i = 0; i < callers; i++) {
                    futures.add(executor.submit(() -> pool.acquire("node-c", EAST)));
                }
                await().atMost(Duration.ofSeconds(5)).until(() -> relay.creations.get() == 1);
                gate.countDown();

                var relayIds = new HashSet<String>();
                for (Future<TunnelHandle> f : futures) {
                    relayIds.add(f.get(5, TimeUnit.SECONDS).relayId());
                }
                assertEquals(1, relayIds.size());
                assertEquals(1, relay.creations.get());
                assertEquals(callers, pool.find("node-c", EAST).orElseThrow().refCount());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("a dead idle tunnel is replaced on acquire")
        void replacesDeadTunnel() {
            TunnelHandle first = pool.acquire("node-c", EAST);
            pool.release(first);
            relay.kill(first.localEndpoint());

            TunnelHandle second = pool.acquire("node-c", EAST);

            assertNotEquals(first.relayId(), second.relayId());
            assertTrue(relay.destroyed.contains(first.localEndpoint()));
            assertEquals(2, relay.creations.get());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("relay rejection surfaces as TunnelException and leaves no entry")
        void rejection() {
            relay.failFor("node-c");

            var e = assertThrows(TunnelException.class, () -> pool.acquire("node-c", EAST));
            assertTrue(e.getMessage().contains("node-c"));
            assertTrue(pool.find("node-c", EAST).isEmpty());
        }

        @Test
        @DisplayName("a failed scope fails fast during backoff and recovers after it")
        void backoff() {
            relay.failFor("node-c");
            assertThrows(TunnelException.class, () -> pool.acquire("node-c", EAST));
            assertEquals(1, pool.stats().backedOffScopes());

            assertThrows(TunnelException.class, () -> pool.acquire("node-d", EAST));
            assertEquals(1, relay.creations.get(), "backoff must not call the relay");

            clock.advance(Duration.ofSeconds(31));
            assertNotNull(pool.acquire("node-d", EAST));
            assertEquals(2, relay.creations.get());
        }

        @Test
        @DisplayName("setup timeout throws and a late tunnel is torn down")
        void setupTimeout() {
            var gate = new CountDownLatch(1);
            relay.holdCreationsUntil(gate);
            var quick = new TunnelPool(relay, clock,
                    new TunnelPool.Settings(Duration.ofMillis(100), Duration.ofMinutes(5), Duration.ofSeconds(30), 50));
            try {
                assertThrows(TunnelException.class, () -> quick.acquire("node-c", EAST));
                gate.countDown();

                await().atMost(Duration.ofSeconds(5)).until(() -> !relay.destroyed.isEmpty());
                assertEquals(relay.created, relay.destroyed);
                assertTrue(quick.find("node-c", EAST).isEmpty());
            } finally {
                quick.closeAll();
            }
        }

        @Test
        @DisplayName("teardown failures never propagate")
        void teardownNeverThrows() {
            relay.throwOnDestroy();
            pool.acquire("node-c", EAST);

            assertDoesNotThrow(() -> pool.closeAll());
            assertEquals(1, relay.destroyed.size());
        }
    }

    @Nested
    @DisplayName("release and reap")
    class ReleaseAndReap {

        @Test
        @DisplayName("release drops a reference but keeps the tunnel open")
        void releaseKeepsOpen() {
            TunnelHandle handle = pool.acquire("node-c", EAST);
            pool.release(handle);

            TunnelHandle pooled = pool.find("node-c", EAST).orElseThrow();
            assertEquals(0, pooled.refCount());
            assertTrue(relay.destroyed.isEmpty());
        }

        @Test
        @DisplayName("releasing twice never goes below zero")
        void releaseIsBounded() {
            TunnelHandle handle = pool.acquire("node-c", EAST);
            pool.release(handle);
            pool.release(handle);

            assertEquals(0, pool.find("node-c", EAST).orElseThrow().refCount());
        }

        @Test
        @DisplayName("idle tunnels are reaped only after the grace period")
        void reapAfterGrace() {
            pool.release(pool.acquire("node-c", EAST));

            clock.advance(Duration.ofMinutes(4));
            assertEquals(0, pool.reap());

            clock.advance(Duration.ofMinutes(2));
            assertEquals(1, pool.reap());
            assertTrue(pool.find("node-c", EAST).isEmpty());
            assertEquals(1, relay.destroyed.size());
        }

        @Test
        @DisplayName("referenced tunnels are never reaped")
        void referencedNotReaped() {
            pool.acquire("node-c", EAST);
            clock.advance(Duration.ofHours(1));

            assertEquals(0, pool.reap());
            assertTrue(relay.destroyed.isEmpty());
        }

        @Test
        @DisplayName("dead idle tunnels are reaped regardless of grace")
        void deadReapedEarly() {
            TunnelHandle handle = pool.acquire("node-c", EAST);
            pool.release(handle);
            relay.kill(handle.localEndpoint());

            assertEquals(1, pool.reap());
        }

        @Test
        @DisplayName("closeAll force-closes referenced tunnels")
        void closeAll() {
            pool.acquire("node-c", EAST);
            pool.acquire("node-d", WEST);

            pool.closeAll();

            assertEquals(2, relay.destroyed.size());
            assertEquals(0, pool.stats().total());
        }
    }

    @Nested
    @DisplayName("capacity")
    class Capacity {

        private TunnelPool small;

        @BeforeEach
        void setUp() {
            small = new TunnelPool(relay, clock,
                    new TunnelPool.Settings(Duration.ofSeconds(5), Duration.ofMinutes(5), Duration.ofSeconds(30), 2));
        }

        @AfterEach
        void tearDown() {
            small.closeAll();
        }

        @Test
        @DisplayName("evicts the least recently used idle tunnel when full")
        void evictsLruIdle() {
            TunnelHandle a = small.acquire("a", EAST);
            clock.advance(Duration.ofSeconds(1));
            TunnelHandle b = small.acquire("b", EAST);
            small.release(a);
            clock.advance(Duration.ofSeconds(1));
            small.release(b);

            small.acquire("c", EAST);

            assertTrue(small.find("a", EAST).isEmpty());
            assertTrue(small.find("b", EAST).isPresent());
            assertTrue(relay.destroyed.contains(a.localEndpoint()));
        }

        @Test
        @DisplayName("throws when every tunnel is in use")
        void fullOfReferencedTunnels() {
            small.acquire("a", EAST);
            small.acquire("b", EAST);

            assertThrows(TunnelException.class, () -> small.acquire("c", EAST));
        }

        @Test
        @DisplayName("concurrent acquires of different keys never exceed the cap")
        void concurrentAcquiresRespectCap() throws Exception {
            var gate = new CountDownLatch(1);
            relay.holdCreationsUntil(gate);

            int callers = 8;
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            var start = new CountDownLatch(1);
            try {
                var futures = new ArrayList<Future<TunnelHandle>>();
                for (int i = 0; i < callers; i++) {
                    String nodeId = "node-" + i;
                    futures.add(executor.submit(() -> {
                        start.await();
                        return small.acquire(nodeId, EAST);
                    }));
                }
                start.countDown();
                await().atMost(Duration.ofSeconds(5)).until(() -> relay.creations.get() == 2);
                gate.countDown();

                int acquired = 0;
                int rejected = 0;
                for (Future<TunnelHandle> f : futures) {
                    try {
                        f.get(5, TimeUnit.SECONDS);
                        acquired++;
                    } catch (ExecutionException e) {
                        assertInstanceOf(TunnelException.class, e.getCause());
                        rejected++;
                    }
                }
                assertEquals(2, acquired);
                assertEquals(callers - 2, rejected);
                assertEquals(2, relay.creations.get());
                assertEquals(2, small.stats().total());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("capacity freed by reaping is reusable")
        void reapFreesCapacity() {
            small.release(small.acquire("a", EAST));
            small.release(small.acquire("b", EAST));
            clock.advance(Duration.ofMinutes(6));
            assertEquals(2, small.reap());

            small.acquire("c", EAST);
            small.acquire("d", EAST);

            assertEquals(2, small.stats().total());
            assertThrows(TunnelException.class, () -> small.acquire("e", EAST));
        }
    }

    @Test
    @DisplayName("stats and metrics reflect pool activity")
    void statsAndMetrics() {
        var registry = new SimpleMeterRegistry();
        var metered = new TunnelPool(relay, clock, TunnelPool.Settings.defaults(), new FleetMetrics(registry));
        try {
            TunnelHandle handle = metered.acquire("node-c", EAST);
            metered.acquire("node-c", EAST);
            metered.release(handle);
            metered.acquire("node-d", EAST);
            metered.release(metered.find("node-d", EAST).orElseThrow());

            PoolStats stats = metered.stats();
            assertEquals(2, stats.total());
            assertEquals(1, stats.inUse());
            assertEquals(1, stats.idle());
            assertEquals(0, stats.pending());
            assertEquals(1.0, registry.find("fleetdeck.tunnel.operations")
                    .tag("operation", "reuse").counter().count());
        } finally {
            metered.closeAll();
        }
    }
}
