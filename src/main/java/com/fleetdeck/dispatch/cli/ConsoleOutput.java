package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.model.CommandOutput;
import com.fleetdeck.core.model.DispatchResult;
import com.fleetdeck.core.model.DispatchStatus;
import com.fleetdeck.core.model.NodeMetrics;
import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.TerminalSession;
import com.fleetdeck.core.report.Report;
import picocli.CommandLine;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the fleetdeck CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) FLEETDECK v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLEET]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void rule() {
        System.out.println(RULE);
    }

    /** Clears the terminal between live frames. */
    public static void clearScreen() {
        if (CommandLine.Help.Ansi.AUTO.enabled()) {
            System.out.print("\033[H\033[2J");
            System.out.flush();
        }
    }

    public static void nodes(List<NodeRecord> nodes) {
        if (nodes.isEmpty()) {
            info("No nodes found");
            return;
        }
        System.out.printf("  %-24s %-9s %-14s %-16s %-16s %s%n",
                "NAME", "STATE", "REGION", "PUBLIC", "PRIVATE", "RELAY");
        System.out.println("  " + "-".repeat(88));
        for (NodeRecord n : nodes) {
            System.out.printf("  %-24s %-9s %-14s %-16s %-16s %s%n",
                    truncate(n.name(), 24), n.state(), truncate(orDash(n.region()), 14),
                    orDash(n.publicAddress()), orDash(n.privateAddress()), n.relayEligible() ? "yes" : "no");
        }
        System.out.println();
        info(nodes.size() + " node" + (nodes.size() != 1 ? "s" : ""));
    }

    public static void commandResults(Report<CommandOutput> report) {
        for (DispatchResult<CommandOutput> result : report.results()) {
            String label = "@|bold " + result.nodeId() + "|@ " + statusLabel(result.status())
                    + " (" + formatDuration(result.elapsed()) + ")";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(label));
            String body = result.succeeded() ? result.payload().combined() : result.partialOutput();
            if (!result.succeeded() && result.reason() != null) {
                System.out.println("  " + result.reason());
            }
            if (body != null && !body.isBlank()) {
                body.strip().lines().forEach(line -> System.out.println("  " + line));
            }
        }
        summary(report);
    }

    public static void metrics(Report<NodeMetrics> report) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Fleet metrics|@ " + CLOCK.format(report.completedAt())));
        System.out.printf("  %-24s %-18s %-7s %-16s %s%n", "NODE", "LOAD", "CPU%", "MEMORY", "TOP PROCESS");
        System.out.println("  " + "-".repeat(88));
        for (DispatchResult<NodeMetrics> result : report.results()) {
            if (!result.succeeded()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-24s ",
                        truncate(result.nodeId(), 24)) + statusLabel(result.status()) + " "
                        + orDash(result.reason())));
                continue;
            }
            NodeMetrics m = result.payload();
            String load = m.loadAverage() == null ? "-"
                    : m.loadAverage().stream().map(v -> String.format("%.2f", v)).collect(Collectors.joining(" "));
            String cpu = m.cpuPercent() == null ? "-" : String.format("%.1f", m.cpuPercent());
            String mem = m.memoryPercent() == null ? "-"
                    : String.format("%d/%dMB %.0f%%", m.memoryUsedMb(), m.memoryTotalMb(), m.memoryPercent());
            String top = m.topProcesses().isEmpty() ? "-"
                    : m.topProcesses().get(0).command() + " (" + m.topProcesses().get(0).cpu() + "%)";
            System.out.printf("  %-24s %-18s %-7s %-16s %s%n", truncate(result.nodeId(), 24), load, cpu, mem, top);
        }
        summary(report);
    }

    public static void sessions(Report<List<TerminalSession>> report) {
        System.out.printf("  %-24s %-20s %-8s %-9s %s%n", "NODE", "SESSION", "WINDOWS", "ATTACHED", "CREATED");
        System.out.println("  " + "-".repeat(88));
        int total = 0;
        for (DispatchResult<List<TerminalSession>> result : report.results()) {
            if (!result.succeeded()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-24s ",
                        truncate(result.nodeId(), 24)) + statusLabel(result.status()) + " "
                        + orDash(result.reason())));
                continue;
            }
            if (result.payload().isEmpty()) {
                System.out.printf("  %-24s %s%n", truncate(result.nodeId(), 24), "(no sessions)");
            }
            for (TerminalSession s : result.payload()) {
                System.out.printf("  %-24s %-20s %-8d %-9s %s%n", truncate(s.nodeId(), 24),
                        truncate(s.sessionName(), 20), s.windows(), s.attached() ? "yes" : "no",
                        orDash(s.createdTime()));
                total++;
            }
        }
        System.out.println();
        info(total + " session" + (total != 1 ? "s" : "") + " across " + report.succeeded() + " node(s)");
        summary(report);
    }

    public static void summary(Report<?> report) {
        rule();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Round " + report.roundId() + "|@ " + report.total() + " node(s) in "
                + formatDuration(report.duration()) + ": "
                + "@|fg(green) " + report.succeeded() + " ok|@"
                + (report.timedOut() > 0 ? ", @|fg(yellow) " + report.timedOut() + " timed out|@" : "")
                + (report.connectionFailed() > 0 ? ", @|fg(red) " + report.connectionFailed() + " unreachable|@" : "")
                + (report.commandFailed() > 0 ? ", @|fg(red) " + report.commandFailed() + " failed|@" : "")
                + (report.skipped() > 0 ? ", " + report.skipped() + " skipped" : "")));
    }

    static String statusLabel(DispatchStatus status) {
        return switch (status) {
            case SUCCESS -> "@|fg(green) OK|@";
            case TIMEOUT -> "@|fg(yellow) TIMEOUT|@";
            case CONNECTION_FAILED -> "@|fg(red) UNREACHABLE|@";
            case COMMAND_FAILED -> "@|fg(red) FAILED|@";
            case SKIPPED -> "@|faint SKIPPED|@";
        };
    }

    static String formatDuration(Duration duration) {
        long ms = duration.toMillis();
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return String.format("%.1fs", ms / 1000.0);
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String orDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
