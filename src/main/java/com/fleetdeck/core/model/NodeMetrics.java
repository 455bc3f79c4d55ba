package com.fleetdeck.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Resource snapshot collected from one node. Any field the node's output
 * did not contain is null.
 *
 * @param loadAverage   1, 5 and 15 minute load averages
 * @param cpuPercent    sum of the top processes' CPU share
 * @param memoryUsedMb  used memory in MB
 * @param memoryTotalMb total memory in MB
 * @param topProcesses  up to three busiest processes
 */
public record NodeMetrics(
    List<Double> loadAverage,
    Double cpuPercent,
    Integer memoryUsedMb,
    Integer memoryTotalMb,
    List<ProcessSample> topProcesses
) implements Serializable {

    public Double memoryPercent() {
        if (memoryUsedMb == null || memoryTotalMb == null) return null;
        return memoryTotalMb > 0 ? memoryUsedMb * 100.0 / memoryTotalMb : 0.0;
    }

    public record ProcessSample(String pid, String user, String cpu, String mem, String command)
            implements Serializable {}
}
