package com.fleetdeck.core.dispatch;

/**
 * The connection worked but the command itself failed. Carries whatever
 * output the command produced before failing.
 */
public class CommandException extends RuntimeException {

    private final String partialOutput;

    public CommandException(String message, String partialOutput) {
        super(message);
        this.partialOutput = partialOutput;
    }

    public CommandException(String message, String partialOutput, Throwable cause) {
        super(message, cause);
        this.partialOutput = partialOutput;
    }

    public String getPartialOutput() {
        return partialOutput;
    }
}
