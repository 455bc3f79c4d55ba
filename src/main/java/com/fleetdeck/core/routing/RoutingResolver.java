package com.fleetdeck.core.routing;

import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.NodeState;
import com.fleetdeck.core.model.RelayScope;
import com.fleetdeck.core.model.RoutePlan;
import com.fleetdeck.core.model.TunnelHandle;
import com.fleetdeck.core.model.UnreachableReason;
import com.fleetdeck.core.tunnel.TunnelException;
import com.fleetdeck.core.tunnel.TunnelPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides how each node is reached: directly, through a pooled relay tunnel,
 * or not at all.
 *
 * <p>Order of preference:
 * <ol>
 *   <li>stopped nodes are unreachable</li>
 *   <li>a public address that has not recently failed is used directly</li>
 *   <li>a relay-eligible node with a private address goes through its region's relay,
 *       if one exists and the approval policy allows it</li>
 *   <li>anything else has no route</li>
 * </ol>
 */
public class RoutingResolver {

    private static final Logger log = LoggerFactory.getLogger(RoutingResolver.class);

    static final String NO_ROUTE = "no route: no public address and no relay available";

    private final TunnelPool pool;
    private final RelayLocator locator;
    private final ReachabilityTracker reachability;
    private final int directPort;

    public RoutingResolver(TunnelPool pool, RelayLocator locator, ReachabilityTracker reachability,
                           int directPort) {
        this.pool = pool;
        this.locator = locator;
        this.reachability = reachability;
        this.directPort = directPort;
    }

    /** Starts a round of routing decisions that share tunnel references and relay approvals. */
    public RouteRound newRound(RelayApprovalPolicy policy) {
        return new RouteRound(this, policy);
    }

    /**
     * Resolves a single node outside any round, approving relays. A relayed
     * plan's tunnel reference is dropped immediately, leaving it pooled and idle.
     */
    public RoutePlan resolve(NodeRecord node) {
        try (RouteRound round = newRound(RelayApprovalPolicy.approveAll())) {
            return round.resolve(node);
        }
    }

    public ReachabilityTracker reachability() {
        return reachability;
    }

    /**
     * The relay scope {@code node} would be routed through, or empty when it
     * is stopped, reachable directly, not relay-eligible or has no relay.
     */
    public Optional<RelayScope> relayScopeFor(NodeRecord node) {
        if (node.state() == NodeState.STOPPED || usableDirect(node) || !relayCandidate(node)) {
            return Optional.empty();
        }
        return locator.locate(node);
    }

    RoutePlan plan(NodeRecord node, RouteRound round) {
        String nodeId = node.name();
        if (node.state() == NodeState.STOPPED) {
            return RoutePlan.unreachable(nodeId, UnreachableReason.NODE_STOPPED, "node is stopped");
        }

        if (usableDirect(node)) {
            return RoutePlan.direct(nodeId, node.publicAddress() + ":" + directPort);
        }

        if (relayCandidate(node)) {
            Optional<RelayScope> scope = locator.locate(node);
            if (scope.isEmpty()) {
                return RoutePlan.unreachable(nodeId, UnreachableReason.RELAY_UNAVAILABLE,
                        "no relay available in region " + node.region());
            }
            if (!round.approved(scope.get(), node)) {
                return RoutePlan.unreachable(nodeId, UnreachableReason.RELAY_DECLINED,
                        "relay " + scope.get() + " declined by operator");
            }
            try {
                TunnelHandle handle = pool.acquire(nodeId, scope.get());
                round.hold(handle);
                log.debug("Routing {} through relay {} at {}", nodeId, scope.get(), handle.localEndpoint());
                return RoutePlan.relayed(nodeId, handle.localEndpoint(), handle.relayId(), handle.createdAt());
            } catch (TunnelException e) {
                log.warn("Relay tunnel for {} failed: {}", nodeId, e.getMessage());
                return RoutePlan.unreachable(nodeId, UnreachableReason.RELAY_FAILED,
                        "relay tunnel failed: " + e.getMessage());
            }
        }

        return RoutePlan.unreachable(nodeId, UnreachableReason.NO_ROUTE, NO_ROUTE);
    }

    private boolean usableDirect(NodeRecord node) {
        return node.hasPublicAddress() && !reachability.isKnownBad(node.publicAddress());
    }

    private static boolean relayCandidate(NodeRecord node) {
        return node.relayEligible() && node.hasPrivateAddress();
    }

    void release(TunnelHandle handle) {
        pool.release(handle);
    }
}
