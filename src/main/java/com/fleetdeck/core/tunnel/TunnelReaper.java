package com.fleetdeck.core.tunnel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically asks the {@link TunnelPool} to close idle tunnels.
 */
public class TunnelReaper {

    private static final Logger log = LoggerFactory.getLogger(TunnelReaper.class);

    private final TunnelPool pool;
    private final Duration interval;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public TunnelReaper(TunnelPool pool, Duration interval) {
        this.pool = pool;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tunnel-reaper");
            t.setDaemon(true);
            return t;
        });
        task = scheduler.scheduleWithFixedDelay(this::reapOnce,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Tunnel reaper started, interval {}s", interval.toSeconds());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        task.cancel(false);
        scheduler.shutdownNow();
        scheduler = null;
        task = null;
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    void reapOnce() {
        try {
            int reaped = pool.reap();
            if (reaped > 0) {
                log.info("Reaped {} idle relay tunnel(s)", reaped);
            }
        } catch (Exception e) {
            log.error("Tunnel reap failed", e);
        }
    }
}
