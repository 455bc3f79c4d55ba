package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.events.FleetEvent;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Prints a line to stderr as each node of a round finishes, so long rounds
 * show progress before the report. Stdout is left to the report itself.
 */
class ProgressPrinter implements Consumer<FleetEvent> {

    private final PrintStream out;
    private final AtomicInteger finished = new AtomicInteger();
    private volatile int total;

    ProgressPrinter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void accept(FleetEvent event) {
        switch (event.type()) {
            case ROUND_STARTED -> {
                total = event.nodeCount();
                finished.set(0);
            }
            case NODE_COMPLETED -> {
                int n = finished.incrementAndGet();
                String line = String.format("[%d/%d] ", n, total) + event.nodeId() + " "
                        + ConsoleOutput.statusLabel(event.status())
                        + " (" + ConsoleOutput.formatDuration(event.elapsed()) + ")";
                synchronized (out) {
                    out.println(CommandLine.Help.Ansi.AUTO.string(line));
                }
            }
            default -> {
            }
        }
    }
}
