package com.fleetdeck.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Read-only view of a pooled relay tunnel at the moment it was handed out.
 * The pool owns the live state; pass the handle back to release it.
 */
public record TunnelHandle(
    String relayId,
    String nodeId,
    RelayScope scope,
    String localEndpoint,
    String remoteEndpoint,
    Instant createdAt,
    Instant lastUsedAt,
    int refCount
) implements Serializable {}
