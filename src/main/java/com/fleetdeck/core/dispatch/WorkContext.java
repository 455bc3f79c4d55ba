package com.fleetdeck.core.dispatch;

import com.fleetdeck.core.model.RouteMode;
import com.fleetdeck.core.model.RoutePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-node context handed to a {@link UnitOfWork}. The connection is opened on
 * first use, following the node's route plan, and closed by the dispatcher
 * when the work ends.
 */
public final class WorkContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkContext.class);

    private final String roundId;
    private final RoutePlan plan;
    private final ConnectionProvider provider;
    private Connection connection;
    private boolean closed;

    WorkContext(String roundId, RoutePlan plan, ConnectionProvider provider) {
        this.roundId = roundId;
        this.plan = plan;
        this.provider = provider;
    }

    public String roundId() {
        return roundId;
    }

    public String nodeId() {
        return plan.nodeId();
    }

    public RoutePlan plan() {
        return plan;
    }

    public synchronized Connection connection() {
        if (closed) {
            throw new ConnectionException("Work context for " + plan.nodeId() + " is closed");
        }
        if (connection == null) {
            connection = plan.mode() == RouteMode.RELAYED
                    ? provider.openRelayed(plan.endpoint())
                    : provider.openDirect(plan.endpoint());
        }
        return connection;
    }

    /** Whether {@link #connection()} has been called successfully. */
    public synchronized boolean isConnected() {
        return connection != null;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                log.debug("Ignoring failure closing connection to {}: {}", plan.nodeId(), e.getMessage());
            }
        }
    }
}
