package com.fleetdeck.core.report;

import com.fleetdeck.core.model.DispatchResult;
import com.fleetdeck.core.testing.TestClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportAggregatorTest {

    @Test
    @DisplayName("counts every status and keeps result order")
    void summarizes() {
        var clock = new TestClock();
        Instant started = clock.instant();
        clock.advance(Duration.ofSeconds(3));

        List<DispatchResult<String>> results = List.of(
                DispatchResult.success("a", "ok", Duration.ofMillis(10)),
                DispatchResult.timeout("b", "timed out after 100ms", Duration.ofMillis(100)),
                DispatchResult.connectionFailed("c", "refused", Duration.ofMillis(5)),
                DispatchResult.commandFailed("d", "exit code 1", "partial", Duration.ofMillis(7)),
                DispatchResult.skipped("e", "node is stopped"),
                DispatchResult.success("f", "ok", Duration.ofMillis(12)));

        Report<String> report = new ReportAggregator(clock).summarize("r-1", started, results);

        assertEquals("r-1", report.roundId());
        assertEquals(6, report.total());
        assertEquals(2, report.succeeded());
        assertEquals(1, report.timedOut());
        assertEquals(1, report.connectionFailed());
        assertEquals(1, report.commandFailed());
        assertEquals(1, report.skipped());
        assertEquals(3, report.failed());
        assertEquals(Duration.ofSeconds(3), report.duration());
        assertEquals(List.of("a", "b", "c", "d", "e", "f"),
                report.results().stream().map(DispatchResult::nodeId).toList());
    }

    @Test
    @DisplayName("an empty round is an empty report")
    void emptyRound() {
        var clock = new TestClock();
        Report<String> report = new ReportAggregator(clock).summarize("r-2", clock.instant(), List.of());

        assertEquals(0, report.total());
        assertEquals(0, report.failed());
        assertEquals(Duration.ZERO, report.duration());
    }
}
