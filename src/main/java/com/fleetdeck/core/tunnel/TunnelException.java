package com.fleetdeck.core.tunnel;

/**
 * Thrown when a relay tunnel cannot be created in time or is rejected.
 */
public class TunnelException extends RuntimeException {
    public TunnelException(String message) {
        super(message);
    }

    public TunnelException(String message, Throwable cause) {
        super(message, cause);
    }
}
