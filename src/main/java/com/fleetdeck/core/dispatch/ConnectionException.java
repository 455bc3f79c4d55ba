package com.fleetdeck.core.dispatch;

/**
 * The transport to a node failed: refused, unreachable, authentication or tunnel error.
 */
public class ConnectionException extends RuntimeException {
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
