package com.fleetdeck.core.directory;

/**
 * Thrown when fleet membership cannot be discovered. Fatal to a dispatch round.
 */
public class DiscoveryException extends RuntimeException {
    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
