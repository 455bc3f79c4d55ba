package com.fleetdeck.fleet;

import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.RelayScope;
import com.fleetdeck.core.routing.RelayLocator;

import java.util.Map;
import java.util.Optional;

/**
 * Looks the relay up by the node's region in {@code fleetdeck.relay.regions}.
 */
public class ConfiguredRelayLocator implements RelayLocator {

    private final Map<String, String> relaysByRegion;

    public ConfiguredRelayLocator(Map<String, String> relaysByRegion) {
        this.relaysByRegion = Map.copyOf(relaysByRegion);
    }

    @Override
    public Optional<RelayScope> locate(NodeRecord node) {
        if (node.region() == null) {
            return Optional.empty();
        }
        String relay = relaysByRegion.get(node.region());
        return relay == null || relay.isBlank()
                ? Optional.empty()
                : Optional.of(new RelayScope(relay, node.region()));
    }
}
