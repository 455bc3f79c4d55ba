package com.fleetdeck.core.dispatch;

import com.fleetdeck.core.model.CommandOutput;

/**
 * An open session to one node.
 */
public interface Connection extends AutoCloseable {

    /**
     * Runs {@code command} on the node and waits for it to exit.
     *
     * @throws ConnectionException if the transport fails
     */
    CommandOutput execute(String command);

    @Override
    void close();
}
