package com.fleetdeck.fleet;

import com.fleetdeck.core.directory.DiscoverySource;
import com.fleetdeck.core.model.NodeRecord;

import java.util.List;

/**
 * Fleet membership from the {@code fleetdeck.inventory} configuration block.
 */
public class StaticDiscoverySource implements DiscoverySource {

    private final List<NodeRecord> nodes;

    public StaticDiscoverySource(List<NodeRecord> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    static StaticDiscoverySource fromInventory(FleetProperties.Inventory inventory) {
        return new StaticDiscoverySource(inventory.getNodes().stream()
                .map(n -> new NodeRecord(n.getName(), n.getPublicAddress(), n.getPrivateAddress(),
                        n.getRegion(), n.isRelayEligible(), NodeStates.parse(n.getState())))
                .toList());
    }

    @Override
    public List<NodeRecord> discover() {
        return nodes;
    }
}
