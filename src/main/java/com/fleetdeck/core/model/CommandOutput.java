package com.fleetdeck.core.model;

import java.io.Serializable;

/**
 * Captured result of one remote command.
 */
public record CommandOutput(int exitCode, String stdout, String stderr) implements Serializable {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** Combined stdout and stderr, stdout first. */
    public String combined() {
        boolean hasOut = stdout != null && !stdout.isEmpty();
        boolean hasErr = stderr != null && !stderr.isEmpty();
        if (hasOut && hasErr) return stdout + "\n" + stderr;
        if (hasOut) return stdout;
        return hasErr ? stderr : "";
    }
}
