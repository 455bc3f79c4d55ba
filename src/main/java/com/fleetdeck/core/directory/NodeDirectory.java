package com.fleetdeck.core.directory;

import com.fleetdeck.core.cache.SessionCache;
import com.fleetdeck.core.model.NodeFilter;
import com.fleetdeck.core.model.NodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-through view of fleet membership.
 *
 * <p>The full membership is cached under a single key, so concurrent callers
 * on a cold or expired cache trigger exactly one discovery call. Records are
 * de-duplicated by name and returned in name order.
 */
public class NodeDirectory {

    private static final Logger log = LoggerFactory.getLogger(NodeDirectory.class);

    static final String MEMBERSHIP_KEY = "directory:membership";

    private final DiscoverySource source;
    private final SessionCache cache;
    private final Duration ttl;

    public NodeDirectory(DiscoverySource source, SessionCache cache, Duration ttl) {
        this.source = source;
        this.cache = cache;
        this.ttl = ttl;
    }

    /**
     * Lists the nodes matching {@code filter}.
     *
     * @throws DiscoveryException if the discovery source fails
     */
    public List<NodeRecord> list(NodeFilter filter) {
        List<NodeRecord> members = cache.getOrFetch(MEMBERSHIP_KEY, ttl, this::discover);
        return members.stream().filter(filter::matches).toList();
    }

    /** Drops the cached membership so the next {@link #list} rediscovers. */
    public void refresh() {
        cache.invalidate(MEMBERSHIP_KEY);
    }

    private List<NodeRecord> discover() {
        List<NodeRecord> raw;
        try {
            raw = source.discover();
        } catch (DiscoveryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DiscoveryException("Node discovery failed: " + e.getMessage(), e);
        }

        Map<String, NodeRecord> byName = new LinkedHashMap<>();
        for (NodeRecord node : raw) {
            if (node.name() == null || node.name().isBlank()) {
                log.warn("Ignoring discovered node without a name: {}", node);
                continue;
            }
            NodeRecord previous = byName.putIfAbsent(node.name(), node);
            if (previous != null) {
                log.debug("Duplicate node {} in discovery output, keeping first", node.name());
            }
        }
        List<NodeRecord> members = byName.values().stream()
                .sorted(Comparator.comparing(NodeRecord::name))
                .toList();
        log.info("Discovered {} node(s)", members.size());
        return members;
    }
}
