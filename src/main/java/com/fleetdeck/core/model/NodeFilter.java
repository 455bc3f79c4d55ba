package com.fleetdeck.core.model;

import java.nio.file.FileSystems;
import java.nio.file.Path;

/**
 * Selects a subset of the fleet.
 *
 * @param namePattern    glob matched against the node name, null for any
 * @param region         exact region, null for any
 * @param includeStopped whether stopped nodes are kept
 */
public record NodeFilter(String namePattern, String region, boolean includeStopped) {

    public static NodeFilter all() {
        return new NodeFilter(null, null, true);
    }

    public static NodeFilter running() {
        return new NodeFilter(null, null, false);
    }

    public boolean matches(NodeRecord node) {
        if (!includeStopped && node.state() == NodeState.STOPPED) return false;
        if (region != null && !region.isBlank() && !region.equalsIgnoreCase(node.region())) return false;
        if (namePattern == null || namePattern.isBlank()) return true;
        var matcher = FileSystems.getDefault().getPathMatcher("glob:" + namePattern);
        return matcher.matches(Path.of(node.name()));
    }
}
