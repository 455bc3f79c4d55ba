package com.fleetdeck.core.cache;

/**
 * Thrown when waiting on another caller's in-flight fetch fails or takes too long.
 */
public class SessionCacheException extends RuntimeException {
    public SessionCacheException(String message) {
        super(message);
    }

    public SessionCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
