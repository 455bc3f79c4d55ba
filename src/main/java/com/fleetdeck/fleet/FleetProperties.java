package com.fleetdeck.fleet;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "fleetdeck")
public class FleetProperties {

    private Dispatch dispatch = new Dispatch();
    private Directory directory = new Directory();
    private Cache cache = new Cache();
    private Tunnel tunnel = new Tunnel();
    private Routing routing = new Routing();
    private Ssh ssh = new Ssh();
    private Relay relay = new Relay();
    private Discovery discovery = new Discovery();
    private Inventory inventory = new Inventory();

    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Directory getDirectory() { return directory; }
    public void setDirectory(Directory directory) { this.directory = directory; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Tunnel getTunnel() { return tunnel; }
    public void setTunnel(Tunnel tunnel) { this.tunnel = tunnel; }
    public Routing getRouting() { return routing; }
    public void setRouting(Routing routing) { this.routing = routing; }
    public Ssh getSsh() { return ssh; }
    public void setSsh(Ssh ssh) { this.ssh = ssh; }
    public Relay getRelay() { return relay; }
    public void setRelay(Relay relay) { this.relay = relay; }
    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }
    public Inventory getInventory() { return inventory; }
    public void setInventory(Inventory inventory) { this.inventory = inventory; }

    public static class Dispatch {
        private int perNodeTimeoutSeconds = 30;
        /** 0 disables the overall deadline. */
        private int overallDeadlineSeconds = 0;
        private int maxConcurrency = 10;
        private int liveIntervalSeconds = 10;

        public int getPerNodeTimeoutSeconds() { return perNodeTimeoutSeconds; }
        public void setPerNodeTimeoutSeconds(int perNodeTimeoutSeconds) { this.perNodeTimeoutSeconds = perNodeTimeoutSeconds; }
        public int getOverallDeadlineSeconds() { return overallDeadlineSeconds; }
        public void setOverallDeadlineSeconds(int overallDeadlineSeconds) { this.overallDeadlineSeconds = overallDeadlineSeconds; }
        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public int getLiveIntervalSeconds() { return liveIntervalSeconds; }
        public void setLiveIntervalSeconds(int liveIntervalSeconds) { this.liveIntervalSeconds = liveIntervalSeconds; }

        public Duration perNodeTimeout() { return Duration.ofSeconds(perNodeTimeoutSeconds); }
        public Duration overallDeadline() {
            return overallDeadlineSeconds > 0 ? Duration.ofSeconds(overallDeadlineSeconds) : null;
        }
    }

    public static class Directory {
        private int ttlSeconds = 60;

        public int getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(int ttlSeconds) { this.ttlSeconds = ttlSeconds; }
    }

    public static class Cache {
        private int maxWaitSeconds = 60;
        private int sessionsTtlSeconds = 30;

        public int getMaxWaitSeconds() { return maxWaitSeconds; }
        public void setMaxWaitSeconds(int maxWaitSeconds) { this.maxWaitSeconds = maxWaitSeconds; }
        public int getSessionsTtlSeconds() { return sessionsTtlSeconds; }
        public void setSessionsTtlSeconds(int sessionsTtlSeconds) { this.sessionsTtlSeconds = sessionsTtlSeconds; }
    }

    public static class Tunnel {
        private int setupTimeoutSeconds = 30;
        private int idleGraceSeconds = 300;
        private int failureBackoffSeconds = 30;
        private int maxTunnels = 50;
        private int reapIntervalSeconds = 60;

        public int getSetupTimeoutSeconds() { return setupTimeoutSeconds; }
        public void setSetupTimeoutSeconds(int setupTimeoutSeconds) { this.setupTimeoutSeconds = setupTimeoutSeconds; }
        public int getIdleGraceSeconds() { return idleGraceSeconds; }
        public void setIdleGraceSeconds(int idleGraceSeconds) { this.idleGraceSeconds = idleGraceSeconds; }
        public int getFailureBackoffSeconds() { return failureBackoffSeconds; }
        public void setFailureBackoffSeconds(int failureBackoffSeconds) { this.failureBackoffSeconds = failureBackoffSeconds; }
        public int getMaxTunnels() { return maxTunnels; }
        public void setMaxTunnels(int maxTunnels) { this.maxTunnels = maxTunnels; }
        public int getReapIntervalSeconds() { return reapIntervalSeconds; }
        public void setReapIntervalSeconds(int reapIntervalSeconds) { this.reapIntervalSeconds = reapIntervalSeconds; }
    }

    public static class Routing {
        private int directPort = 22;
        private int unreachableTtlSeconds = 300;

        public int getDirectPort() { return directPort; }
        public void setDirectPort(int directPort) { this.directPort = directPort; }
        public int getUnreachableTtlSeconds() { return unreachableTtlSeconds; }
        public void setUnreachableTtlSeconds(int unreachableTtlSeconds) { this.unreachableTtlSeconds = unreachableTtlSeconds; }
    }

    public static class Ssh {
        private String binary = "ssh";
        /** Remote login user; blank uses the local ssh default. */
        private String user = "";
        private String keyPath = "";
        private int connectTimeoutSeconds = 10;

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public String getUser() { return user; }
        public void setUser(String user) { this.user = user; }
        public String getKeyPath() { return keyPath; }
        public void setKeyPath(String keyPath) { this.keyPath = keyPath; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
    }

    public static class Relay {
        /** Placeholders: {relay}, {region}, {node}, {port}. */
        private String commandTemplate = "ssh -N -o BatchMode=yes -o ExitOnForwardFailure=yes -L 127.0.0.1:{port}:{node}:22 {relay}";
        /** Region name to relay host. Regions without an entry have no relay. */
        private Map<String, String> regions = new LinkedHashMap<>();

        public String getCommandTemplate() { return commandTemplate; }
        public void setCommandTemplate(String commandTemplate) { this.commandTemplate = commandTemplate; }
        public Map<String, String> getRegions() { return regions; }
        public void setRegions(Map<String, String> regions) { this.regions = regions; }
    }

    public static class Discovery {
        /** "static" reads {@code fleetdeck.inventory}; "command" runs {@link #command}. */
        private String source = "static";
        private String command = "";
        private int commandTimeoutSeconds = 60;

        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public int getCommandTimeoutSeconds() { return commandTimeoutSeconds; }
        public void setCommandTimeoutSeconds(int commandTimeoutSeconds) { this.commandTimeoutSeconds = commandTimeoutSeconds; }
    }

    public static class Inventory {
        private List<Node> nodes = new ArrayList<>();

        public List<Node> getNodes() { return nodes; }
        public void setNodes(List<Node> nodes) { this.nodes = nodes; }
    }

    public static class Node {
        private String name;
        private String publicAddress;
        private String privateAddress;
        private String region = "";
        private boolean relayEligible = true;
        private String state = "RUNNING";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getPublicAddress() { return publicAddress; }
        public void setPublicAddress(String publicAddress) { this.publicAddress = publicAddress; }
        public String getPrivateAddress() { return privateAddress; }
        public void setPrivateAddress(String privateAddress) { this.privateAddress = privateAddress; }
        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
        public boolean isRelayEligible() { return relayEligible; }
        public void setRelayEligible(boolean relayEligible) { this.relayEligible = relayEligible; }
        public String getState() { return state; }
        public void setState(String state) { this.state = state; }
    }
}
