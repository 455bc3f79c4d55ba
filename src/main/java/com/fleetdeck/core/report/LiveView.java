package com.fleetdeck.core.report;

import com.fleetdeck.core.dispatch.UnitOfWork;
import com.fleetdeck.core.engine.FleetEngine;
import com.fleetdeck.core.engine.RoundOptions;
import com.fleetdeck.core.model.NodeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Re-runs a dispatch round on a fixed interval and hands every report to a
 * sink, until cancelled. The node set is re-read each round, so nodes may come
 * and go between frames. A round that cannot run at all (discovery failure)
 * is reported to the sink and the loop carries on.
 */
public class LiveView {

    private static final Logger log = LoggerFactory.getLogger(LiveView.class);

    private final FleetEngine engine;

    public LiveView(FleetEngine engine) {
        this.engine = engine;
    }

    public <T> LiveSession start(NodeFilter filter, UnitOfWork<T> unit, RoundOptions options,
                                 Duration interval, ReportSink<T> sink) {
        return start(filter, unit, options, interval, sink, 0);
    }

    /**
     * @param maxRounds stop after this many rounds; 0 runs until cancelled
     */
    public <T> LiveSession start(NodeFilter filter, UnitOfWork<T> unit, RoundOptions options,
                                 Duration interval, ReportSink<T> sink, int maxRounds) {
        var scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "live-view");
            t.setDaemon(true);
            return t;
        });
        var session = new LiveSession(scheduler);

        Runnable tick = () -> {
            if (session.isCancelled()) {
                return;
            }
            try {
                Report<T> report = engine.runRound(filter, unit, options);
                if (!session.isCancelled()) {
                    sink.accept(report);
                }
            } catch (RuntimeException e) {
                log.warn("Live round failed: {}", e.getMessage());
                deliverFailure(sink, e);
            }
            if (session.roundFinished() == maxRounds) {
                session.cancel();
            }
        };

        scheduler.scheduleWithFixedDelay(tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        return session;
    }

    private static void deliverFailure(ReportSink<?> sink, Throwable error) {
        try {
            sink.onRoundFailed(error);
        } catch (RuntimeException e) {
            log.warn("Report sink failed handling round failure: {}", e.getMessage(), e);
        }
    }
}
