package com.fleetdeck.fleet;

import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.NodeState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StaticDiscoverySourceTest {

    @Test
    void mapsInventoryEntries() {
        var web = new FleetProperties.Node();
        web.setName("web-1");
        web.setPublicAddress("20.1.2.3");
        web.setRegion("eastus");
        var db = new FleetProperties.Node();
        db.setName("db-1");
        db.setPrivateAddress("10.0.0.9");
        db.setState("VM deallocated");
        var inventory = new FleetProperties.Inventory();
        inventory.setNodes(List.of(web, db));

        List<NodeRecord> nodes = StaticDiscoverySource.fromInventory(inventory).discover();

        assertEquals(new NodeRecord("web-1", "20.1.2.3", null, "eastus", true, NodeState.RUNNING), nodes.get(0));
        assertEquals(NodeState.STOPPED, nodes.get(1).state());
        assertEquals("10.0.0.9", nodes.get(1).privateAddress());
    }

    @Test
    void powerStatesAreNormalised() {
        assertEquals(NodeState.RUNNING, NodeStates.parse("VM running"));
        assertEquals(NodeState.STOPPED, NodeStates.parse("stopped"));
        assertEquals(NodeState.STOPPED, NodeStates.parse("deallocated"));
        assertEquals(NodeState.UNKNOWN, NodeStates.parse("starting"));
        assertEquals(NodeState.UNKNOWN, NodeStates.parse(null));
    }
}
