package com.fleetdeck.fleet;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FleetPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new FleetProperties();
        assertEquals(30, props.getDispatch().getPerNodeTimeoutSeconds());
        assertEquals(10, props.getDispatch().getMaxConcurrency());
        assertNull(props.getDispatch().overallDeadline());
        assertEquals(60, props.getDirectory().getTtlSeconds());
        assertEquals(300, props.getTunnel().getIdleGraceSeconds());
        assertEquals(50, props.getTunnel().getMaxTunnels());
        assertEquals(22, props.getRouting().getDirectPort());
        assertEquals("ssh", props.getSsh().getBinary());
        assertEquals("static", props.getDiscovery().getSource());
        assertTrue(props.getInventory().getNodes().isEmpty());
        assertTrue(props.getRelay().getCommandTemplate().contains("{port}"));
    }

    @Test
    void overallDeadlineOnlyWhenPositive() {
        var dispatch = new FleetProperties.Dispatch();
        dispatch.setOverallDeadlineSeconds(90);
        assertEquals(Duration.ofSeconds(90), dispatch.overallDeadline());
        assertEquals(Duration.ofSeconds(30), dispatch.perNodeTimeout());
    }

    @Test
    void bindsFromConfiguration() {
        var source = new MapConfigurationPropertySource(Map.of(
                "fleetdeck.dispatch.max-concurrency", "4",
                "fleetdeck.relay.regions.eastus", "bastion-east",
                "fleetdeck.inventory.nodes[0].name", "web-1",
                "fleetdeck.inventory.nodes[0].public-address", "20.1.2.3",
                "fleetdeck.inventory.nodes[0].relay-eligible", "false"));

        FleetProperties props = new Binder(source).bind("fleetdeck", FleetProperties.class).get();

        assertEquals(4, props.getDispatch().getMaxConcurrency());
        assertEquals("bastion-east", props.getRelay().getRegions().get("eastus"));
        var node = props.getInventory().getNodes().get(0);
        assertEquals("web-1", node.getName());
        assertEquals("20.1.2.3", node.getPublicAddress());
        assertFalse(node.isRelayEligible());
        assertEquals("RUNNING", node.getState());
    }
}
