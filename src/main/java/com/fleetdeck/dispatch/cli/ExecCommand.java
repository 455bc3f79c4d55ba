package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.directory.DiscoveryException;
import com.fleetdeck.core.dispatch.DispatchOptions;
import com.fleetdeck.core.engine.FleetEngine;
import com.fleetdeck.core.engine.RoundOptions;
import com.fleetdeck.core.events.EventBus;
import com.fleetdeck.core.model.CommandOutput;
import com.fleetdeck.core.report.JsonReportSink;
import com.fleetdeck.core.report.Report;
import com.fleetdeck.core.work.ShellCommandWork;
import com.fleetdeck.fleet.FleetProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: fleetdeck exec [options] -- &lt;command&gt;
 * <p>
 * Runs a shell command on every selected node in parallel and prints each
 * node's output followed by a summary. Exits non-zero when any node failed.
 */
@Command(name = "exec", mixinStandardHelpOptions = true, description = "Run a command on every node")
@Component
public class ExecCommand implements Callable<Integer> {

    @Mixin
    FleetOptions fleet = new FleetOptions();

    @Parameters(arity = "1..*", paramLabel = "COMMAND", description = "Command to run on each node")
    List<String> command;

    @Option(names = "--json", description = "Print the report as JSON")
    boolean json;

    @Option(names = {"--timeout", "-t"}, description = "Per-node timeout in seconds")
    Integer timeoutSeconds;

    @Option(names = "--deadline", description = "Overall deadline in seconds")
    Integer deadlineSeconds;

    @Option(names = {"--parallel", "-p"}, description = "Nodes worked on at once")
    Integer parallel;

    @Option(names = "--progress", description = "Print a line to stderr as each node finishes")
    boolean progress;

    private final FleetEngine engine;
    private final EventBus eventBus;
    private final FleetProperties properties;

    public ExecCommand(FleetEngine engine, EventBus eventBus, FleetProperties properties) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        var work = new ShellCommandWork(String.join(" ", command));
        Report<CommandOutput> report;
        EventBus.Subscription subscription = progress
                ? eventBus.subscribeAll(new ProgressPrinter(System.err))
                : () -> { };
        try (subscription) {
            report = engine.runRound(fleet.filter(), work, roundOptions());
        } catch (DiscoveryException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        if (json) {
            new JsonReportSink<CommandOutput>(System.out, true).accept(report);
        } else {
            ConsoleOutput.commandResults(report);
        }
        return report.failed() > 0 ? 1 : 0;
    }

    RoundOptions roundOptions() {
        var dispatch = properties.getDispatch();
        Duration perNode = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : dispatch.perNodeTimeout();
        Duration deadline = deadlineSeconds != null ? Duration.ofSeconds(deadlineSeconds) : dispatch.overallDeadline();
        int concurrency = parallel != null ? parallel : dispatch.getMaxConcurrency();
        return new RoundOptions(new DispatchOptions(perNode, deadline, concurrency), fleet.relayApproval());
    }
}
