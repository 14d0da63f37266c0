package com.questrail.hexrot.mock;

import com.questrail.hexrot.model.Command;

/**
 * Executes one accepted command against a mock controller's state.
 */
@FunctionalInterface
public interface CommandHandler
{
    /**
     * @return estimated seconds until the action completes; 0 if already complete
     * @throws DeviceCommandException to reject the command (NO_ACK) without
     *                                changing any state
     */
    double execute(Command command);
}
