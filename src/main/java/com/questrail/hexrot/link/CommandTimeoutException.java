package com.questrail.hexrot.link;

import java.time.Duration;

/**
 * No command status with the command's counter arrived in time. The
 * connection is left as it was; the caller may retry or close.
 */
public final class CommandTimeoutException extends LinkException
{
    private final long counter;

    public CommandTimeoutException(long counter, Duration timeout) {
        super("No status for command " + counter + " within " + timeout.toMillis() + " ms");
        this.counter = counter;
    }

    public long counter() {
        return counter;
    }
}
