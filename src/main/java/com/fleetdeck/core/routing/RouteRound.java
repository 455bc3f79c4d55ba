package com.fleetdeck.core.routing;

import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.RelayScope;
import com.fleetdeck.core.model.RoutePlan;
import com.fleetdeck.core.model.TunnelHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routing decisions for one dispatch round. Each node is resolved once; asking
 * again returns the same plan without acquiring another tunnel reference.
 * Closing the round releases every tunnel reference it took.
 *
 * <p>{@link #resolve} is safe to call from many threads at once. A node whose
 * tunnel is slow to come up only blocks callers asking for that same node.
 */
public final class RouteRound implements AutoCloseable {

    private final RoutingResolver resolver;
    private final RelayApprovalPolicy policy;
    private final ConcurrentHashMap<String, CompletableFuture<RoutePlan>> plans = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<RelayScope, Boolean> approvals = new ConcurrentHashMap<>();
    private final List<TunnelHandle> held = new ArrayList<>();
    private boolean closed;

    RouteRound(RoutingResolver resolver, RelayApprovalPolicy policy) {
        this.resolver = resolver;
        this.policy = policy;
    }

    public RoutePlan resolve(NodeRecord node) {
        var mine = new CompletableFuture<RoutePlan>();
        CompletableFuture<RoutePlan> existing = plans.putIfAbsent(node.name(), mine);
        if (existing != null) {
            return existing.join();
        }
        try {
            RoutePlan plan = resolver.plan(node, this);
            mine.complete(plan);
            return plan;
        } catch (RuntimeException e) {
            plans.remove(node.name(), mine);
            mine.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Asks the approval policy up front for every relay scope these nodes
     * would be routed through, one scope at a time on the calling thread.
     * Later {@link #resolve} calls reuse the answers and never prompt.
     */
    public void approveRelays(List<NodeRecord> nodes) {
        for (NodeRecord node : nodes) {
            resolver.relayScopeFor(node).ifPresent(scope -> approved(scope, node));
        }
    }

    /** The plan already decided for {@code nodeId} in this round, if any. */
    public Optional<RoutePlan> planned(String nodeId) {
        CompletableFuture<RoutePlan> plan = plans.get(nodeId);
        if (plan == null || !plan.isDone() || plan.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(plan.join());
    }

    /** Tunnel references currently held by this round. */
    public synchronized List<TunnelHandle> heldTunnels() {
        return List.copyOf(held);
    }

    boolean approved(RelayScope scope, NodeRecord node) {
        Boolean answer = approvals.get(scope);
        if (answer != null) {
            return answer;
        }
        synchronized (approvals) {
            return approvals.computeIfAbsent(scope, s -> policy.approve(s, node));
        }
    }

    synchronized void hold(TunnelHandle handle) {
        if (closed) {
            resolver.release(handle);
            return;
        }
        held.add(handle);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        held.forEach(resolver::release);
        held.clear();
    }
}
