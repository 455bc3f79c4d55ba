package com.fleetdeck.core.work;

import com.fleetdeck.core.cache.SessionCache;
import com.fleetdeck.core.dispatch.UnitOfWork;
import com.fleetdeck.core.dispatch.WorkContext;
import com.fleetdeck.core.model.CommandOutput;
import com.fleetdeck.core.model.TerminalSession;

import java.time.Duration;
import java.util.List;

/**
 * Lists the tmux sessions on each node, reading through the session cache so
 * repeated views within the TTL do not touch the node at all.
 */
public class TerminalSessionsWork implements UnitOfWork<List<TerminalSession>> {

    static final String COMMAND = "tmux list-sessions 2>/dev/null || echo 'No sessions'";

    private final SessionCache cache;
    private final Duration ttl;

    public TerminalSessionsWork(SessionCache cache, Duration ttl) {
        this.cache = cache;
        this.ttl = ttl;
    }

    @Override
    public List<TerminalSession> execute(WorkContext context) {
        String nodeId = context.nodeId();
        return cache.getOrFetch("tmux:" + nodeId, ttl, () -> {
            CommandOutput output = context.connection().execute(COMMAND);
            return List.copyOf(TmuxSessionParser.parse(nodeId, output.stdout()));
        });
    }
}
