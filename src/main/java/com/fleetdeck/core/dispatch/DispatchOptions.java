package com.fleetdeck.core.dispatch;

import java.time.Duration;

/**
 * Limits for one dispatch.
 *
 * @param perNodeTimeout  time allowed for each node once its work starts
 * @param overallDeadline time allowed for the whole dispatch, or null for none
 * @param maxConcurrency  nodes worked on at once; the rest queue in order
 */
public record DispatchOptions(Duration perNodeTimeout, Duration overallDeadline, int maxConcurrency) {

    public DispatchOptions {
        if (perNodeTimeout == null || perNodeTimeout.isNegative() || perNodeTimeout.isZero()) {
            throw new IllegalArgumentException("perNodeTimeout must be positive");
        }
        if (overallDeadline != null && (overallDeadline.isNegative() || overallDeadline.isZero())) {
            throw new IllegalArgumentException("overallDeadline must be positive when set");
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
    }

    public static DispatchOptions defaults() {
        return new DispatchOptions(Duration.ofSeconds(30), null, 10);
    }

    public DispatchOptions withPerNodeTimeout(Duration timeout) {
        return new DispatchOptions(timeout, overallDeadline, maxConcurrency);
    }

    public DispatchOptions withOverallDeadline(Duration deadline) {
        return new DispatchOptions(perNodeTimeout, deadline, maxConcurrency);
    }
}
