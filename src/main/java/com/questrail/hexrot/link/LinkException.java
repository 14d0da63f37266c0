package com.questrail.hexrot.link;

/**
 * Base type for failures surfaced by {@link CommandTelemetryClient} operations.
 */
public class LinkException extends RuntimeException
{
    public LinkException(String message) {
        super(message);
    }

    public LinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
