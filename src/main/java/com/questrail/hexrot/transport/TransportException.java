package com.questrail.hexrot.transport;

/**
 * Indicates a socket-level failure: bind, connect, or write to a connection
 * that is not up.
 */
public final class TransportException extends RuntimeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
