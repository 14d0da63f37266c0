package com.questrail.hexrot.link;

/**
 * The link was closed by its owner while an operation was waiting.
 */
public final class LinkClosedException extends LinkTransportException
{
    public LinkClosedException(String message) {
        super(message);
    }
}
