package com.fleetdeck.core.engine;

import com.fleetdeck.core.directory.NodeDirectory;
import com.fleetdeck.core.dispatch.Dispatcher;
import com.fleetdeck.core.dispatch.UnitOfWork;
import com.fleetdeck.core.events.EventBus;
import com.fleetdeck.core.events.FleetEvent;
import com.fleetdeck.core.logging.MdcContext;
import com.fleetdeck.core.metrics.FleetMetrics;
import com.fleetdeck.core.model.DispatchResult;
import com.fleetdeck.core.model.DispatchStatus;
import com.fleetdeck.core.model.NodeFilter;
import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.RouteMode;
import com.fleetdeck.core.report.Report;
import com.fleetdeck.core.report.ReportAggregator;
import com.fleetdeck.core.routing.RouteRound;
import com.fleetdeck.core.routing.RoutingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Runs one dispatch round: list the fleet, ask for relay approvals, then
 * route and dispatch every node in parallel and summarize the results.
 * Tunnel references taken while routing are always released when the
 * round ends.
 */
public class FleetEngine {

    private static final Logger log = LoggerFactory.getLogger(FleetEngine.class);

    private final NodeDirectory directory;
    private final RoutingResolver resolver;
    private final Dispatcher dispatcher;
    private final ReportAggregator aggregator;
    private final EventBus eventBus;
    private final FleetMetrics metrics;
    private final Clock clock;

    public FleetEngine(NodeDirectory directory, RoutingResolver resolver, Dispatcher dispatcher,
                       ReportAggregator aggregator, EventBus eventBus, FleetMetrics metrics, Clock clock) {
        this.directory = directory;
        this.resolver = resolver;
        this.dispatcher = dispatcher;
        this.aggregator = aggregator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public NodeDirectory directory() {
        return directory;
    }

    /**
     * @throws com.fleetdeck.core.directory.DiscoveryException if the fleet cannot be listed
     */
    public <T> Report<T> runRound(NodeFilter filter, UnitOfWork<T> unit, RoundOptions options) {
        String roundId = UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = clock.instant();
        long startMs = System.currentTimeMillis();
        MdcContext.setRound(roundId);
        try {
            List<NodeRecord> nodes = directory.list(filter);
            eventBus.publish(FleetEvent.roundStarted(roundId, nodes.size()));

            List<DispatchResult<T>> results;
            try (RouteRound routes = resolver.newRound(options.relayApproval())) {
                routes.approveRelays(nodes);
                results = dispatcher.run(roundId, nodes, routes::resolve, unit, options.dispatch());
                markFailedDirectRoutes(routes, results);
            }

            Report<T> report = aggregator.summarize(roundId, startedAt, results);
            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordRoundDuration(elapsedMs);
                metrics.recordRoundSize(nodes.size());
            }
            eventBus.publish(FleetEvent.roundCompleted(roundId, nodes.size(), Duration.ofMillis(elapsedMs)));
            log.info("Round {} finished in {}ms: {} ok, {} failed, {} skipped",
                    roundId, elapsedMs, report.succeeded(), report.failed(), report.skipped());
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private <T> void markFailedDirectRoutes(RouteRound routes, List<DispatchResult<T>> results) {
        for (DispatchResult<T> result : results) {
            if (result.status() != DispatchStatus.CONNECTION_FAILED) {
                continue;
            }
            routes.planned(result.nodeId())
                    .filter(plan -> plan.mode() == RouteMode.DIRECT)
                    .ifPresent(plan -> resolver.reachability().markUnreachable(hostOf(plan.endpoint())));
        }
    }

    private static String hostOf(String endpoint) {
        int colon = endpoint.lastIndexOf(':');
        return colon < 0 ? endpoint : endpoint.substring(0, colon);
    }
}
