package com.questrail.hexrot.link;

/**
 * The connection could not be established, is not up, or was lost while an
 * operation was in progress. The link has been torn down when this is thrown
 * for a lost connection.
 */
public class LinkTransportException extends LinkException
{
    public LinkTransportException(String message) {
        super(message);
    }

    public LinkTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
