package com.fleetdeck.core.health;

import com.fleetdeck.core.directory.NodeDirectory;
import com.fleetdeck.core.model.NodeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Backs {@code fleetdeck health}: discovery, every actuator
 * {@link HealthIndicator} in the context (the relay pool among them) and
 * the adapters' {@link HealthProbe}s.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private static final List<String> BEAN_SUFFIXES = List.of("HealthIndicator", "HealthContributor");

    private final NodeDirectory directory;
    private final Map<String, HealthIndicator> indicators;
    private final List<HealthProbe> probes;

    public HealthCheckService(
            @Autowired(required = false) NodeDirectory directory,
            @Autowired(required = false) Map<String, HealthIndicator> indicators,
            @Autowired(required = false) List<HealthProbe> probes) {
        this.directory = directory;
        this.indicators = indicators != null ? new TreeMap<>(indicators) : Map.of();
        this.probes = probes != null ? probes : List.of();
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDiscovery());
        indicators.forEach((beanName, indicator) -> results.add(runIndicator(componentName(beanName), indicator)));
        for (HealthProbe check : probes) {
            results.add(runCheck(check));
        }
        return results;
    }

    private HealthStatus checkDiscovery() {
        if (directory == null) {
            return new HealthStatus("discovery", HealthStatus.Status.DOWN,
                    "No node directory configured", Map.of());
        }
        try {
            int count = directory.list(NodeFilter.all()).size();
            return new HealthStatus("discovery", HealthStatus.Status.UP,
                    count + " node(s) discovered", Map.of("nodes", String.valueOf(count)));
        } catch (Exception e) {
            log.warn("Discovery health check failed: {}", e.getMessage());
            return new HealthStatus("discovery", HealthStatus.Status.DOWN,
                    "Discovery error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus runIndicator(String component, HealthIndicator indicator) {
        try {
            Health health = indicator.health();
            var metadata = new LinkedHashMap<String, String>();
            health.getDetails().forEach((key, value) -> metadata.put(key, String.valueOf(value)));
            return new HealthStatus(component, toStatus(health.getStatus()), summarize(metadata), metadata);
        } catch (Exception e) {
            log.warn("Health indicator {} failed: {}", component, e.getMessage());
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "Indicator error: " + e.getMessage(), Map.of());
        }
    }

    static HealthStatus.Status toStatus(Status status) {
        if (Status.UP.equals(status)) {
            return HealthStatus.Status.UP;
        }
        if (Status.DOWN.equals(status) || Status.OUT_OF_SERVICE.equals(status)) {
            return HealthStatus.Status.DOWN;
        }
        return HealthStatus.Status.DEGRADED;
    }

    /** {@code relayPoolHealthIndicator} becomes {@code relay-pool}. */
    static String componentName(String beanName) {
        String base = beanName;
        for (String suffix : BEAN_SUFFIXES) {
            if (base.endsWith(suffix) && base.length() > suffix.length()) {
                base = base.substring(0, base.length() - suffix.length());
            }
        }
        return base.replaceAll("([a-z0-9])([A-Z])", "$1-$2").toLowerCase(Locale.ROOT);
    }

    private static String summarize(Map<String, String> metadata) {
        if (metadata.isEmpty()) {
            return "";
        }
        var parts = new ArrayList<String>();
        metadata.forEach((key, value) -> parts.add(key + "=" + value));
        return String.join(", ", parts);
    }

    private HealthStatus runCheck(HealthProbe check) {
        try {
            return check.check();
        } catch (Exception e) {
            log.warn("Health check {} failed: {}", check.getClass().getSimpleName(), e.getMessage());
            return new HealthStatus(check.getClass().getSimpleName(), HealthStatus.Status.DOWN,
                    "Check error: " + e.getMessage(), Map.of());
        }
    }
}
