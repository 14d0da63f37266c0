package com.questrail.hexrot.link;

/**
 * The controller answered a command with NO_ACK. The link stays connected.
 */
public final class CommandRejectedException extends LinkException
{
    private final long counter;
    private final String reason;

    public CommandRejectedException(long counter, String reason) {
        super("Command " + counter + " rejected: " + reason);
        this.counter = counter;
        this.reason = reason;
    }

    public long counter() {
        return counter;
    }

    /**
     * The controller's reason text, as received (possibly truncated).
     */
    public String reason() {
        return reason;
    }
}
