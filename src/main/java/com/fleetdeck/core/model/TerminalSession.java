package com.fleetdeck.core.model;

import java.io.Serializable;

/**
 * A long-lived multiplexed terminal (tmux) session running on a node.
 */
public record TerminalSession(
    String nodeId,
    String sessionName,
    int windows,
    String createdTime,
    boolean attached
) implements Serializable {}
