package com.fleetdeck.fleet;

import com.fleetdeck.core.cache.SessionCache;
import com.fleetdeck.core.directory.DiscoverySource;
import com.fleetdeck.core.directory.NodeDirectory;
import com.fleetdeck.core.dispatch.ConnectionProvider;
import com.fleetdeck.core.dispatch.Dispatcher;
import com.fleetdeck.core.engine.FleetEngine;
import com.fleetdeck.core.events.EventBus;
import com.fleetdeck.core.metrics.FleetMetrics;
import com.fleetdeck.core.report.LiveView;
import com.fleetdeck.core.report.ReportAggregator;
import com.fleetdeck.core.routing.ReachabilityTracker;
import com.fleetdeck.core.routing.RelayLocator;
import com.fleetdeck.core.routing.RoutingResolver;
import com.fleetdeck.core.tunnel.RelayCapability;
import com.fleetdeck.core.tunnel.TunnelPool;
import com.fleetdeck.core.tunnel.TunnelReaper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class FleetConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "fleetdeck.discovery.source", havingValue = "static", matchIfMissing = true)
    public DiscoverySource staticDiscoverySource(FleetProperties properties) {
        return StaticDiscoverySource.fromInventory(properties.getInventory());
    }

    @Bean
    @ConditionalOnProperty(name = "fleetdeck.discovery.source", havingValue = "command")
    public DiscoverySource commandDiscoverySource(FleetProperties properties) {
        var discovery = properties.getDiscovery();
        return new CommandDiscoverySource(discovery.getCommand(),
                Duration.ofSeconds(discovery.getCommandTimeoutSeconds()));
    }

    @Bean
    public SessionCache sessionCache(Clock clock, FleetProperties properties,
                                     @Autowired(required = false) FleetMetrics metrics) {
        return new SessionCache(clock, Duration.ofSeconds(properties.getCache().getMaxWaitSeconds()), metrics);
    }

    @Bean
    public NodeDirectory nodeDirectory(DiscoverySource source, SessionCache cache, FleetProperties properties) {
        return new NodeDirectory(source, cache, Duration.ofSeconds(properties.getDirectory().getTtlSeconds()));
    }

    @Bean
    public RelayCapability relayCapability(FleetProperties properties) {
        return new ProcessRelayCapability(properties.getRelay().getCommandTemplate(),
                Duration.ofSeconds(properties.getTunnel().getSetupTimeoutSeconds()));
    }

    @Bean
    public RelayLocator relayLocator(FleetProperties properties) {
        return new ConfiguredRelayLocator(properties.getRelay().getRegions());
    }

    /** Force-closes every tunnel when the context shuts down. */
    @Bean(destroyMethod = "closeAll")
    public TunnelPool tunnelPool(RelayCapability relay, Clock clock, FleetProperties properties,
                                 @Autowired(required = false) FleetMetrics metrics) {
        var tunnel = properties.getTunnel();
        var settings = new TunnelPool.Settings(
                Duration.ofSeconds(tunnel.getSetupTimeoutSeconds()),
                Duration.ofSeconds(tunnel.getIdleGraceSeconds()),
                Duration.ofSeconds(tunnel.getFailureBackoffSeconds()),
                tunnel.getMaxTunnels());
        return new TunnelPool(relay, clock, settings, metrics);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public TunnelReaper tunnelReaper(TunnelPool pool, FleetProperties properties) {
        return new TunnelReaper(pool, Duration.ofSeconds(properties.getTunnel().getReapIntervalSeconds()));
    }

    @Bean
    public ReachabilityTracker reachabilityTracker(Clock clock, FleetProperties properties) {
        return new ReachabilityTracker(clock, Duration.ofSeconds(properties.getRouting().getUnreachableTtlSeconds()));
    }

    @Bean
    public RoutingResolver routingResolver(TunnelPool pool, RelayLocator locator,
                                           ReachabilityTracker reachability, FleetProperties properties) {
        return new RoutingResolver(pool, locator, reachability, properties.getRouting().getDirectPort());
    }

    @Bean(destroyMethod = "shutdown")
    public SshConnectionProvider sshConnectionProvider(FleetProperties properties) {
        return new SshConnectionProvider(properties.getSsh());
    }

    @Bean
    public Dispatcher dispatcher(ConnectionProvider connections, EventBus eventBus,
                                 @Autowired(required = false) FleetMetrics metrics) {
        return new Dispatcher(connections, eventBus, metrics);
    }

    @Bean
    public ReportAggregator reportAggregator(Clock clock) {
        return new ReportAggregator(clock);
    }

    @Bean
    public FleetEngine fleetEngine(NodeDirectory directory, RoutingResolver resolver, Dispatcher dispatcher,
                                   ReportAggregator aggregator, EventBus eventBus,
                                   @Autowired(required = false) FleetMetrics metrics, Clock clock) {
        return new FleetEngine(directory, resolver, dispatcher, aggregator, eventBus, metrics, clock);
    }

    @Bean
    public LiveView liveView(FleetEngine engine) {
        return new LiveView(engine);
    }
}
