package com.questrail.hexrot.mock;

/**
 * Thrown by a {@link CommandHandler} to reject a command. The message becomes
 * the NO_ACK reason, so keep it short.
 */
public final class DeviceCommandException extends RuntimeException
{
    public DeviceCommandException(String message) {
        super(message);
    }
}
