package com.fleetdeck.core.model;

import java.io.Serializable;

/**
 * Snapshot of one fleet member as reported by discovery.
 * Never mutated; a directory refresh replaces the whole record.
 *
 * @param name           unique node name, used as the node id
 * @param publicAddress  directly reachable address, or null
 * @param privateAddress network-internal address, or null
 * @param region         network/region the node lives in (selects the relay scope)
 * @param relayEligible  whether the node may be reached through a relay
 * @param state          liveness as last reported by discovery
 */
public record NodeRecord(
    String name,
    String publicAddress,
    String privateAddress,
    String region,
    boolean relayEligible,
    NodeState state
) implements Serializable {

    public boolean hasPublicAddress() {
        return publicAddress != null && !publicAddress.isBlank();
    }

    public boolean hasPrivateAddress() {
        return privateAddress != null && !privateAddress.isBlank();
    }
}
