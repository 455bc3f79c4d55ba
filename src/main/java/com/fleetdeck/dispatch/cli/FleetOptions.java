package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.model.NodeFilter;
import com.fleetdeck.core.routing.RelayApprovalPolicy;
import picocli.CommandLine.Option;

/**
 * Node selection and relay options shared by the fleet commands.
 */
public class FleetOptions {

    @Option(names = {"--name", "-n"}, description = "Only nodes whose name matches this glob")
    String namePattern;

    @Option(names = {"--region", "-r"}, description = "Only nodes in this region")
    String region;

    @Option(names = "--include-stopped", description = "Include stopped nodes (reported as skipped)")
    boolean includeStopped;

    @Option(names = {"--yes", "-y"}, description = "Use relays without asking")
    boolean yes;

    @Option(names = "--no-relay", description = "Never use relays; nodes without a public address are skipped")
    boolean noRelay;

    NodeFilter filter() {
        return new NodeFilter(namePattern, region, includeStopped);
    }

    RelayApprovalPolicy relayApproval() {
        if (noRelay) {
            return RelayApprovalPolicy.denyAll();
        }
        if (yes) {
            return RelayApprovalPolicy.approveAll();
        }
        return new PromptingRelayApproval(System.in, System.out);
    }
}
