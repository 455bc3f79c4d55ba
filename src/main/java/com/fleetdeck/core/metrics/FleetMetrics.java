package com.fleetdeck.core.metrics;

import com.fleetdeck.core.model.DispatchStatus;
import com.fleetdeck.core.model.RouteMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for fleet dispatch.
 */
@Service
public class FleetMetrics {

    private final MeterRegistry registry;

    public FleetMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRoundDuration(long ms) {
        Timer.builder("fleetdeck.round.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRoundSize(int nodeCount) {
        DistributionSummary.builder("fleetdeck.round.nodes")
                .description("Nodes per dispatch round")
                .register(registry)
                .record(nodeCount);
    }

    public void recordNodeOutcome(DispatchStatus status) {
        Counter.builder("fleetdeck.node.outcomes")
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordNodeExecution(RouteMode mode, long ms) {
        Timer.builder("fleetdeck.node.duration")
                .tag("route", mode.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records tunnel lifecycle operations.
     *
     * @param operation "create", "reuse", "reap", "close" or "fail"
     */
    public void recordTunnelOperation(String operation) {
        Counter.builder("fleetdeck.tunnel.operations")
                .description("Relay tunnel lifecycle operations")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /** Outcome of one cache read. */
    public enum CacheLookup {
        HIT, MISS, COALESCED
    }

    public void recordCacheLookup(CacheLookup result) {
        Counter.builder("fleetdeck.cache.lookups")
                .tag("result", result.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
