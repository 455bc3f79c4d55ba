package com.fleetdeck.core.model;

import java.io.Serializable;

/**
 * The relay serving one network/region.
 */
public record RelayScope(String relayName, String region) implements Serializable {

    @Override
    public String toString() {
        return region + "/" + relayName;
    }
}
