package com.fleetdeck.core.health;

import com.fleetdeck.core.tunnel.PoolStats;
import com.fleetdeck.core.tunnel.TunnelPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the relay tunnel pool, reported by {@code fleetdeck health}
 * through {@link HealthCheckService}.
 * <p>
 * Reports DEGRADED while any relay scope is backing off after a failed
 * tunnel creation, and when the pool is at capacity.
 */
@Component("relayPoolHealthIndicator")
public class TunnelPoolHealthIndicator implements HealthIndicator {

    private final TunnelPool tunnelPool;

    public TunnelPoolHealthIndicator(TunnelPool tunnelPool) {
        this.tunnelPool = tunnelPool;
    }

    @Override
    public Health health() {
        PoolStats stats = tunnelPool.stats();
        var builder = Health.up()
                .withDetail("tunnels.total", stats.total())
                .withDetail("tunnels.inUse", stats.inUse())
                .withDetail("tunnels.idle", stats.idle())
                .withDetail("tunnels.pending", stats.pending())
                .withDetail("tunnels.max", stats.maxTunnels());

        if (stats.backedOffScopes() > 0) {
            return builder.withDetail("relays.backingOff", stats.backedOffScopes())
                    .status("DEGRADED").build();
        }
        if (stats.total() >= stats.maxTunnels()) {
            return builder.status("DEGRADED").build();
        }
        return builder.build();
    }
}
