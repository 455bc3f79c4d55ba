package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.cache.SessionCache;
import com.fleetdeck.core.directory.DiscoveryException;
import com.fleetdeck.core.dispatch.DispatchOptions;
import com.fleetdeck.core.engine.FleetEngine;
import com.fleetdeck.core.engine.RoundOptions;
import com.fleetdeck.core.model.TerminalSession;
import com.fleetdeck.core.report.LiveSession;
import com.fleetdeck.core.report.LiveView;
import com.fleetdeck.core.report.Report;
import com.fleetdeck.core.work.TerminalSessionsWork;
import com.fleetdeck.fleet.FleetProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: fleetdeck sessions
 * <p>
 * Lists tmux sessions on every node. Results are cached per node for a short
 * time so repeated views stay cheap.
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List tmux sessions across the fleet")
@Component
public class SessionsCommand implements Callable<Integer> {

    @Mixin
    FleetOptions fleet = new FleetOptions();

    @Option(names = {"--watch", "-w"}, description = "Keep refreshing")
    boolean watch;

    @Option(names = {"--interval", "-i"}, description = "Seconds between refreshes in watch mode")
    Integer intervalSeconds;

    private final FleetEngine engine;
    private final LiveView liveView;
    private final SessionCache cache;
    private final FleetProperties properties;

    public SessionsCommand(FleetEngine engine, LiveView liveView, SessionCache cache, FleetProperties properties) {
        this.engine = engine;
        this.liveView = liveView;
        this.cache = cache;
        this.properties = properties;
    }

    @Override
    public Integer call() throws InterruptedException {
        var dispatch = properties.getDispatch();
        var work = new TerminalSessionsWork(cache, Duration.ofSeconds(properties.getCache().getSessionsTtlSeconds()));
        var options = new RoundOptions(new DispatchOptions(dispatch.perNodeTimeout(), dispatch.overallDeadline(),
                dispatch.getMaxConcurrency()), fleet.relayApproval());

        if (!watch) {
            try {
                Report<List<TerminalSession>> report = engine.runRound(fleet.filter(), work, options);
                ConsoleOutput.sessions(report);
                return report.failed() > 0 ? 1 : 0;
            } catch (DiscoveryException e) {
                ConsoleOutput.error(e.getMessage());
                return 2;
            }
        }

        int interval = intervalSeconds != null ? intervalSeconds : dispatch.getLiveIntervalSeconds();
        LiveSession session = liveView.start(fleet.filter(), work, options, Duration.ofSeconds(interval),
                new ConsoleReportSink<List<TerminalSession>>(ConsoleOutput::sessions, true));
        try {
            while (!session.awaitTermination(Duration.ofSeconds(1))) {
                // runs until interrupted
            }
        } finally {
            session.cancel();
        }
        return 0;
    }
}
