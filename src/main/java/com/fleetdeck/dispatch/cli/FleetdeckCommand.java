package com.fleetdeck.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for fleetdeck.
 * Routes to subcommands: list, exec, top, sessions, health.
 */
@Command(
        name = "fleetdeck",
        mixinStandardHelpOptions = true,
        version = "fleetdeck 0.1.0",
        description = "Run commands and watch resources across a fleet of remote nodes",
        subcommands = {
                ListCommand.class,
                ExecCommand.class,
                TopCommand.class,
                SessionsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FleetdeckCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
