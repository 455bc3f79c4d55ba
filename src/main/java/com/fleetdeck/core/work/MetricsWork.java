package com.fleetdeck.core.work;

import com.fleetdeck.core.dispatch.CommandException;
import com.fleetdeck.core.dispatch.UnitOfWork;
import com.fleetdeck.core.dispatch.WorkContext;
import com.fleetdeck.core.model.CommandOutput;
import com.fleetdeck.core.model.NodeMetrics;

/**
 * Samples load, memory and the busiest processes on each node.
 */
public class MetricsWork implements UnitOfWork<NodeMetrics> {

    static final String COMMAND = "uptime && free -m && top -bn1 -o %CPU | head -n 15";

    @Override
    public NodeMetrics execute(WorkContext context) {
        CommandOutput output = context.connection().execute(COMMAND);
        if (!output.succeeded()) {
            throw new CommandException("metrics command exited with " + output.exitCode(), output.combined());
        }
        return MetricsParser.parse(output.stdout());
    }
}
