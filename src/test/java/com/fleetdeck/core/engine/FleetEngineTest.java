package com.fleetdeck.core.engine;

import com.fleetdeck.core.directory.DiscoveryException;
import com.fleetdeck.core.dispatch.DispatchOptions;
import com.fleetdeck.core.dispatch.UnitOfWork;
import com.fleetdeck.core.events.FleetEvent;
import com.fleetdeck.core.model.CommandOutput;
import com.fleetdeck.core.model.DispatchResult;
import com.fleetdeck.core.model.DispatchStatus;
import com.fleetdeck.core.model.NodeFilter;
import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.NodeState;
import com.fleetdeck.core.report.Report;
import com.fleetdeck.core.routing.RelayApprovalPolicy;
import com.fleetdeck.core.testing.ScriptedConnectionProvider;
import com.fleetdeck.core.testing.TestFleet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FleetEngineTest {

    private static final UnitOfWork<CommandOutput> HOSTNAME = ctx -> ctx.connection().execute("hostname");

    private TestFleet fleet;

    @BeforeEach
    void setUp() {
        fleet = new TestFleet();
        fleet.nodes.addAll(List.of(
                new NodeRecord("a-direct", "20.0.0.1", "10.0.0.1", "eastus", true, NodeState.RUNNING),
                new NodeRecord("b-refused", "20.0.0.2", "10.0.0.2", "eastus", true, NodeState.RUNNING),
                new NodeRecord("c-private", null, "10.0.0.3", "eastus", true, NodeState.RUNNING),
                new NodeRecord("d-isolated", null, "10.9.0.4", "westus", true, NodeState.RUNNING),
                new NodeRecord("e-stopped", "20.0.0.5", null, "eastus", true, NodeState.STOPPED)));
        fleet.connections.refuse("20.0.0.2:22");
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    @DisplayName("a mixed fleet yields one result per node with the right outcome")
    void mixedFleet() {
        Report<CommandOutput> report = fleet.engine.runRound(NodeFilter.all(), HOSTNAME, RoundOptions.defaults());

        Map<String, DispatchResult<CommandOutput>> byNode = report.results().stream()
                .collect(Collectors.toMap(DispatchResult::nodeId, Function.identity()));
        assertEquals(5, report.total());
        assertEquals(DispatchStatus.SUCCESS, byNode.get("a-direct").status());
        assertEquals(DispatchStatus.CONNECTION_FAILED, byNode.get("b-refused").status());
        assertEquals(DispatchStatus.SUCCESS, byNode.get("c-private").status());
        assertEquals(DispatchStatus.SKIPPED, byNode.get("d-isolated").status());
        assertEquals(DispatchStatus.SKIPPED, byNode.get("e-stopped").status());

        assertEquals(2, report.succeeded());
        assertEquals(1, report.connectionFailed());
        assertEquals(2, report.skipped());
        assertEquals(1, report.failed());
        assertEquals(List.of("a-direct", "b-refused", "c-private", "d-isolated", "e-stopped"),
                report.results().stream().map(DispatchResult::nodeId).toList());
    }

    @Test
    @DisplayName("tunnel references are released when the round ends")
    void tunnelsReleased() {
        fleet.engine.runRound(NodeFilter.all(), HOSTNAME, RoundOptions.defaults());

        assertEquals(1, fleet.pool.stats().total());
        assertEquals(0, fleet.pool.stats().inUse());
        assertTrue(fleet.relay.destroyed.isEmpty());
    }

    @Test
    @DisplayName("a refused direct address goes through the relay next round")
    void failedDirectFallsBackNextRound() {
        fleet.engine.runRound(NodeFilter.all(), HOSTNAME, RoundOptions.defaults());
        assertTrue(fleet.reachability.isKnownBad("20.0.0.2"));

        Report<CommandOutput> second = fleet.engine.runRound(
                new NodeFilter("b-*", null, false), HOSTNAME, RoundOptions.defaults());

        assertEquals(DispatchStatus.SUCCESS, second.results().get(0).status());
        assertEquals(2, fleet.relay.creations.get());
    }

    @Test
    @DisplayName("declining relays skips private nodes without creating tunnels")
    void relaysDeclined() {
        Report<CommandOutput> report = fleet.engine.runRound(NodeFilter.running(), HOSTNAME,
                RoundOptions.defaults().withRelayApproval(RelayApprovalPolicy.denyAll()));

        DispatchResult<CommandOutput> c = report.results().stream()
                .filter(r -> r.nodeId().equals("c-private")).findFirst().orElseThrow();
        assertEquals(DispatchStatus.SKIPPED, c.status());
        assertTrue(c.reason().contains("declined"));
        assertEquals(0, fleet.relay.creations.get());
    }

    @Test
    @DisplayName("discovery failure propagates and leaves no MDC behind")
    void discoveryFailure() {
        fleet.failDiscovery(new DiscoveryException("credentials expired"));

        assertThrows(DiscoveryException.class,
                () -> fleet.engine.runRound(NodeFilter.all(), HOSTNAME, RoundOptions.defaults()));
        assertNull(MDC.get("roundId"));
    }

    @Test
    @DisplayName("publishes round start and completion events")
    void roundEvents() {
        var events = new CopyOnWriteArrayList<FleetEvent>();
        fleet.eventBus.subscribeAll(events::add);

        Report<CommandOutput> report = fleet.engine.runRound(NodeFilter.all(), HOSTNAME, RoundOptions.defaults());

        List<FleetEvent.Type> roundEvents = events.stream()
                .filter(e -> !e.isNodeEvent())
                .map(FleetEvent::type)
                .toList();
        assertEquals(List.of(FleetEvent.Type.ROUND_STARTED, FleetEvent.Type.ROUND_COMPLETED), roundEvents);
        assertEquals(5, events.get(0).nodeCount());
        assertEquals(5, events.stream().filter(e -> e.type() == FleetEvent.Type.NODE_COMPLETED).count());
        assertTrue(events.stream().allMatch(e -> e.roundId().equals(report.roundId())));
    }

    @Nested
    @DisplayName("timing")
    class Timing {

        private final RoundOptions quick = RoundOptions.defaults()
                .withDispatch(new DispatchOptions(Duration.ofMillis(500), Duration.ofSeconds(10), 8));

        @BeforeEach
        void separateRelays() {
            fleet.close();
            fleet = new TestFleet(Map.of("eastus", "bastion-east", "westus", "bastion-west"));
        }

        @Test
        @DisplayName("slow direct node, relayed nodes and a failing relay settle independently")
        void fiveNodeRound() {
            fleet.nodes.addAll(List.of(
                    new NodeRecord("A", "20.0.1.1", null, "eastus", false, NodeState.RUNNING),
                    new NodeRecord("B", "20.0.1.2", null, "eastus", false, NodeState.RUNNING),
                    new NodeRecord("C", null, "10.0.1.3", "eastus", true, NodeState.RUNNING),
                    new NodeRecord("D", null, "10.0.1.4", "eastus", false, NodeState.RUNNING),
                    new NodeRecord("E", null, "10.0.1.5", "westus", true, NodeState.RUNNING)));
            fleet.connections.on("20.0.1.2:22", ScriptedConnectionProvider.slow(5_000));
            fleet.relay.failFor("E");

            long start = System.nanoTime();
            Report<CommandOutput> report = fleet.engine.runRound(NodeFilter.all(), HOSTNAME, quick);
            long tookMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            Map<String, DispatchResult<CommandOutput>> byNode = report.results().stream()
                    .collect(Collectors.toMap(DispatchResult::nodeId, Function.identity()));
            assertEquals(DispatchStatus.SUCCESS, byNode.get("A").status());
            assertEquals(DispatchStatus.TIMEOUT, byNode.get("B").status());
            assertEquals(DispatchStatus.SUCCESS, byNode.get("C").status());
            assertEquals(DispatchStatus.SKIPPED, byNode.get("D").status());
            assertTrue(byNode.get("D").reason().startsWith("no route"));
            assertEquals(DispatchStatus.CONNECTION_FAILED, byNode.get("E").status());
            assertTrue(byNode.get("E").reason().startsWith("relay tunnel failed"));
            assertTrue(tookMs < 2_000, "round took " + tookMs + "ms, B's timeout is 500ms");
        }

        @Test
        @DisplayName("a hung relay does not hold up the other nodes")
        void hungRelayIsolated() {
            fleet.nodes.addAll(List.of(
                    new NodeRecord("hung", null, "10.0.2.1", "eastus", true, NodeState.RUNNING),
                    new NodeRecord("r-1", null, "10.0.2.2", "eastus", true, NodeState.RUNNING),
                    new NodeRecord("r-2", null, "10.0.2.3", "eastus", true, NodeState.RUNNING),
                    new NodeRecord("direct", "20.0.2.4", null, "eastus", false, NodeState.RUNNING)));
            fleet.relay.delayFor("hung", Duration.ofSeconds(5));
            fleet.relay.delayFor("r-1", Duration.ofMillis(200));
            fleet.relay.delayFor("r-2", Duration.ofMillis(200));

            long start = System.nanoTime();
            Report<CommandOutput> report = fleet.engine.runRound(NodeFilter.all(), HOSTNAME, quick);
            long tookMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertEquals(List.of("direct", "hung", "r-1", "r-2"),
                    report.results().stream().map(DispatchResult::nodeId).toList());
            assertEquals(List.of(DispatchStatus.SUCCESS, DispatchStatus.TIMEOUT, DispatchStatus.SUCCESS,
                    DispatchStatus.SUCCESS), report.results().stream().map(DispatchResult::status).toList());
            assertTrue(tookMs < 2_000, "round took " + tookMs + "ms");
            assertEquals(0, fleet.pool.stats().inUse());
        }

        @Test
        @DisplayName("the overall deadline covers relay setup")
        void deadlineCoversRelaySetup() {
            fleet.nodes.add(new NodeRecord("hung", null, "10.0.2.1", "eastus", true, NodeState.RUNNING));
            fleet.relay.delayFor("hung", Duration.ofSeconds(5));
            var bounded = RoundOptions.defaults()
                    .withDispatch(new DispatchOptions(Duration.ofSeconds(30), Duration.ofMillis(400), 8));

            long start = System.nanoTime();
            Report<CommandOutput> report = fleet.engine.runRound(NodeFilter.all(), HOSTNAME, bounded);
            long tookMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertEquals(DispatchStatus.TIMEOUT, report.results().get(0).status());
            assertTrue(tookMs < 2_000, "round took " + tookMs + "ms");
        }
    }
}
