package com.fleetdeck.dispatch.cli;

import com.fleetdeck.core.model.NodeRecord;
import com.fleetdeck.core.model.RelayScope;
import com.fleetdeck.core.routing.RelayApprovalPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Asks the operator on the terminal before a relay is used. No answer
 * (end of input) counts as a decline.
 */
public class PromptingRelayApproval implements RelayApprovalPolicy {

    private static final Logger log = LoggerFactory.getLogger(PromptingRelayApproval.class);

    private final BufferedReader in;
    private final PrintStream out;

    public PromptingRelayApproval(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public synchronized boolean approve(RelayScope scope, NodeRecord node) {
        out.printf("Node %s has no public address. Open a tunnel through relay %s in %s? [y/N] ",
                node.name(), scope.relayName(), scope.region());
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                out.println();
                return false;
            }
            answer = answer.trim().toLowerCase(Locale.ROOT);
            return answer.equals("y") || answer.equals("yes");
        } catch (IOException e) {
            log.warn("Could not read relay approval: {}", e.getMessage());
            return false;
        }
    }
}
