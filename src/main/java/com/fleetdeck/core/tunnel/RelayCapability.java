package com.fleetdeck.core.tunnel;

import com.fleetdeck.core.model.RelayScope;

/**
 * Black-box capability that opens a tunnel to a node through a relay.
 * Implementations may block; the pool bounds how long it waits.
 */
public interface RelayCapability {

    /**
     * Opens a tunnel to {@code nodeId} through the relay in {@code scope}.
     *
     * @return the local endpoint the tunnel listens on, e.g. {@code 127.0.0.1:40022}
     * @throws TunnelException if the relay rejects or fails the request
     */
    String createRelay(String nodeId, RelayScope scope);

    /** Tears the tunnel down. Must tolerate being called more than once. */
    void destroyRelay(String endpoint);

    /** Whether a previously created tunnel is still usable. */
    default boolean isAlive(String endpoint) {
        return true;
    }
}
