package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.directory.DiscoveryException;
import com.fleetdeck.core.directory.NodeDirectory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: fleetdeck list
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List fleet nodes")
@Component
public class ListCommand implements Callable<Integer> {

    @Mixin
    FleetOptions fleet = new FleetOptions();

    @Option(names = "--refresh", description = "Ignore cached membership and rediscover")
    boolean refresh;

    private final NodeDirectory directory;

    public ListCommand(NodeDirectory directory) {
        this.directory = directory;
    }

    @Override
    public Integer call() {
        if (refresh) {
            directory.refresh();
        }
        try {
            ConsoleOutput.nodes(directory.list(fleet.filter()));
            return 0;
        } catch (DiscoveryException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
