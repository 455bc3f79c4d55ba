package com.fleetdeck.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing fleet-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRound(String roundId) {
        MDC.put("roundId", roundId);
    }

    public static void setNode(String roundId, String nodeId, String routeMode) {
        MDC.put("roundId", roundId);
        MDC.put("nodeId", nodeId);
        MDC.put("routeMode", routeMode);
    }

    public static void clear() {
        MDC.remove("roundId");
        MDC.remove("nodeId");
        MDC.remove("routeMode");
    }
}
