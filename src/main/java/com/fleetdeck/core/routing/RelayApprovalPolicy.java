package com.fleetdeck.core.routing;

import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.RelayScope;

/**
 * Decides whether a relay may be used. A {@link RouteRound} consults the
 * policy at most once per relay scope.
 */
@FunctionalInterface
public interface RelayApprovalPolicy {

    /**
     * @param scope relay about to be used
     * @param node  first node in the round that needs it
     */
    boolean approve(RelayScope scope, NodeRecord node);

    static RelayApprovalPolicy approveAll() {
        return (scope, node) -> true;
    }

    static RelayApprovalPolicy denyAll() {
        return (scope, node) -> false;
    }
}
