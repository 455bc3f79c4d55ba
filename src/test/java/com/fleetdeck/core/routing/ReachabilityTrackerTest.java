package com.fleetdeck.core.routing;

import com.fleetdeck.core.testing.TestClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReachabilityTrackerTest {

    @Test
    @DisplayName("marked addresses stay bad until the TTL expires")
    void expires() {
        var clock = new TestClock();
        var tracker = new ReachabilityTracker(clock, Duration.ofMinutes(5));

        tracker.markUnreachable("1.1.1.1");
        assertTrue(tracker.isKnownBad("1.1.1.1"));
        assertFalse(tracker.isKnownBad("2.2.2.2"));

        clock.advance(Duration.ofMinutes(5));
        assertFalse(tracker.isKnownBad("1.1.1.1"));
    }

    @Test
    @DisplayName("blank addresses are ignored and clear forgets everything")
    void blankAndClear() {
        var tracker = new ReachabilityTracker(new TestClock(), Duration.ofMinutes(5));
        tracker.markUnreachable(" ");
        tracker.markUnreachable(null);
        tracker.markUnreachable("1.1.1.1");

        tracker.clear();
        assertFalse(tracker.isKnownBad("1.1.1.1"));
    }
}
