package com.fleetdeck.fleet;

import com.fleetdeck.core.model.NodeState;

import java.util.Locale;

final class NodeStates {

    private NodeStates() {}

    /** Maps provider power-state strings ("running", "VM stopped", "deallocated") onto {@link NodeState}. */
    static NodeState parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NodeState.UNKNOWN;
        }
        String s = raw.toLowerCase(Locale.ROOT);
        if (s.contains("running")) {
            return NodeState.RUNNING;
        }
        if (s.contains("stopped") || s.contains("deallocated")) {
            return NodeState.STOPPED;
        }
        return NodeState.UNKNOWN;
    }
}
