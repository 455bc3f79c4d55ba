package com.fleetdeck.core.engine;

import com.fleetdeck.core.dispatch.DispatchOptions;
import com.fleetdeck.core.routing.RelayApprovalPolicy;

/**
 * Settings for one dispatch round.
 *
 * @param dispatch      timeouts and concurrency
 * @param relayApproval decides whether relays may be used this round
 */
public record RoundOptions(DispatchOptions dispatch, RelayApprovalPolicy relayApproval) {

    public static RoundOptions defaults() {
        return new RoundOptions(DispatchOptions.defaults(), RelayApprovalPolicy.approveAll());
    }

    public RoundOptions withDispatch(DispatchOptions options) {
        return new RoundOptions(options, relayApproval);
    }

    public RoundOptions withRelayApproval(RelayApprovalPolicy policy) {
        return new RoundOptions(dispatch, policy);
    }
}
