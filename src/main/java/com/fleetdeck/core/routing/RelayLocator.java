package com.fleetdeck.core.routing;

import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.RelayScope;

import java.util.Optional;

/**
 * Finds the relay that can reach a node's private network.
 */
@FunctionalInterface
public interface RelayLocator {
    Optional<RelayScope> locate(NodeRecord node);
}
