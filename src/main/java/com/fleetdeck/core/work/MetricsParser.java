package com.fleetdeck.core.work;

import com.fleetdeck.core.model.NodeMetrics;
import com.fleetdeck.core.model.NodeMetrics.ProcessSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the combined output of {@code uptime}, {@code free -m} and
 * {@code top -bn1}. Sections that are missing or malformed leave the
 * corresponding fields null rather than failing the whole sample.
 */
final class MetricsParser {

    private static final Logger log = LoggerFactory.getLogger(MetricsParser.class);

    static final int TOP_PROCESSES = 3;
    static final int MAX_COMMAND_LENGTH = 40;

    private MetricsParser() {}

    static NodeMetrics parse(String output) {
        String[] lines = output == null ? new String[0] : output.split("\\R");
        List<Double> load = parseLoad(lines);
        Integer[] memory = parseMemory(lines);
        List<ProcessSample> processes = parseProcesses(lines);
        Double cpu = processes.isEmpty() ? null
                : processes.stream().mapToDouble(p -> Double.parseDouble(p.cpu())).sum();
        return new NodeMetrics(load, cpu, memory[0], memory[1], processes);
    }

    private static List<Double> parseLoad(String[] lines) {
        if (lines.length == 0 || !lines[0].contains("load average:")) {
            return null;
        }
        try {
            String[] parts = lines[0].substring(lines[0].indexOf("load average:") + "load average:".length())
                    .trim().split(",");
            if (parts.length < 3) {
                return null;
            }
            return List.of(Double.parseDouble(parts[0].trim()),
                    Double.parseDouble(parts[1].trim()),
                    Double.parseDouble(parts[2].trim()));
        } catch (NumberFormatException e) {
            log.debug("Unparseable load average: {}", lines[0]);
            return null;
        }
    }

    /** Returns {used, total}. */
    private static Integer[] parseMemory(String[] lines) {
        for (int i = 1; i < Math.min(lines.length, 6); i++) {
            if (lines[i].startsWith("Mem:")) {
                String[] parts = lines[i].trim().split("\\s+");
                try {
                    return new Integer[] {Integer.parseInt(parts[2]), Integer.parseInt(parts[1])};
                } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                    log.debug("Unparseable memory line: {}", lines[i]);
                }
                break;
            }
        }
        return new Integer[] {null, null};
    }

    private static List<ProcessSample> parseProcesses(String[] lines) {
        var processes = new ArrayList<ProcessSample>();
        boolean inTable = false;
        for (String line : lines) {
            if (!inTable) {
                inTable = line.contains("PID") && line.contains("USER") && line.contains("COMMAND");
                continue;
            }
            if (line.isBlank() || processes.size() == TOP_PROCESSES) {
                continue;
            }
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 12) {
                continue;
            }
            try {
                if (Double.parseDouble(parts[8]) <= 0.0) {
                    continue;
                }
            } catch (NumberFormatException e) {
                continue;
            }
            String command = String.join(" ", List.of(parts).subList(11, parts.length));
            if (command.length() > MAX_COMMAND_LENGTH) {
                command = command.substring(0, MAX_COMMAND_LENGTH);
            }
            processes.add(new ProcessSample(parts[0], parts[1], parts[8], parts[9], command));
        }
        return processes;
    }
}
