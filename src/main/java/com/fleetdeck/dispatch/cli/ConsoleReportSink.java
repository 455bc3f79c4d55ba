package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.report.Report;
import com.fleetdeck.core.report.ReportSink;

import java.util.function.Consumer;

/**
 * Renders reports as terminal tables. In live mode each frame replaces the previous one.
 */
public class ConsoleReportSink<T> implements ReportSink<T> {

    private final Consumer<Report<T>> renderer;
    private final boolean live;

    public ConsoleReportSink(Consumer<Report<T>> renderer, boolean live) {
        this.renderer = renderer;
        this.live = live;
    }

    @Override
    public void accept(Report<T> report) {
        if (live) {
            ConsoleOutput.clearScreen();
            ConsoleOutput.printBanner();
        }
        renderer.accept(report);
        if (live) {
            System.out.println("Press Ctrl+C to stop");
        }
    }

    @Override
    public void onRoundFailed(Throwable error) {
        ConsoleOutput.error("Round failed: " + error.getMessage());
    }
}
