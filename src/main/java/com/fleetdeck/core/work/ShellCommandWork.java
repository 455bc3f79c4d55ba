package com.fleetdeck.core.work;

import com.fleetdeck.core.dispatch.CommandException;
import com.fleetdeck.core.dispatch.UnitOfWork;
import com.fleetdeck.core.dispatch.WorkContext;
import com.fleetdeck.core.model.CommandOutput;

/**
 * Runs one shell command on each node. A non-zero exit status fails the node
 * with whatever the command printed.
 */
public class ShellCommandWork implements UnitOfWork<CommandOutput> {

    private final String command;

    public ShellCommandWork(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        this.command = command;
    }

    public String command() {
        return command;
    }

    @Override
    public CommandOutput execute(WorkContext context) {
        CommandOutput output = context.connection().execute(command);
        if (!output.succeeded()) {
            throw new CommandException("exit code " + output.exitCode(), output.combined());
        }
        return output;
    }
}
