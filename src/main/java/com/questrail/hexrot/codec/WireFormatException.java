package com.questrail.hexrot.codec;

/**
 * Indicates that a complete, correctly-sized record held a field value that
 * has no meaning in the protocol (for example an unknown acknowledgement code).
 *
 * <p>The stream itself is still aligned when this is thrown; readers drop the
 * offending frame and continue.</p>
 */
public final class WireFormatException extends RuntimeException
{
    public WireFormatException(String message) {
        super(message);
    }

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
