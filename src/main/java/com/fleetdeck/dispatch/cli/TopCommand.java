package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.dispatch.DispatchOptions;
import com.fleetdeck.core.engine.RoundOptions;
import com.fleetdeck.core.model.NodeMetrics;
import com.fleetdeck.core.report.LiveSession;
import com.fleetdeck.core.report.LiveView;
import com.fleetdeck.core.work.MetricsWork;
import com.fleetdeck.fleet.FleetProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: fleetdeck top
 * <p>
 * Live, refreshing view of load, memory and busiest processes across the fleet.
 */
@Command(name = "top", mixinStandardHelpOptions = true, description = "Live resource view of the fleet")
@Component
public class TopCommand implements Callable<Integer> {

    @Mixin
    FleetOptions fleet = new FleetOptions();

    @Option(names = {"--interval", "-i"}, description = "Seconds between refreshes")
    Integer intervalSeconds;

    @Option(names = "--rounds", description = "Stop after this many refreshes (default: run until interrupted)",
            defaultValue = "0")
    int rounds;

    @Option(names = {"--timeout", "-t"}, description = "Per-node timeout in seconds")
    Integer timeoutSeconds;

    private final LiveView liveView;
    private final FleetProperties properties;

    public TopCommand(LiveView liveView, FleetProperties properties) {
        this.liveView = liveView;
        this.properties = properties;
    }

    @Override
    public Integer call() throws InterruptedException {
        var dispatch = properties.getDispatch();
        int interval = intervalSeconds != null ? intervalSeconds : dispatch.getLiveIntervalSeconds();
        Duration perNode = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : dispatch.perNodeTimeout();
        var options = new RoundOptions(
                new DispatchOptions(perNode, null, dispatch.getMaxConcurrency()), fleet.relayApproval());

        LiveSession session = liveView.start(fleet.filter(), new MetricsWork(), options,
                Duration.ofSeconds(interval), new ConsoleReportSink<NodeMetrics>(ConsoleOutput::metrics, true),
                rounds);
        try {
            while (!session.awaitTermination(Duration.ofSeconds(1))) {
                // keep the CLI alive until the session ends or the JVM is interrupted
            }
        } finally {
            session.cancel();
        }
        return 0;
    }
}
