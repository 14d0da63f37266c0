package com.questrail.hexrot.observability;

import com.questrail.hexrot.internal.state.DeviceState;
import com.questrail.hexrot.model.Command;

import java.time.Instant;

/**
 * Record representing a device state transition applied by a mock controller.
 *
 * @param triggeringCommand the command that caused the transition, or {@code null}
 *                          for a transition forced from outside (a simulated fault)
 */
public record HexrotStateTransitionEvent(
    Instant timestamp,
    DeviceState oldState,
    DeviceState newState,
    Command triggeringCommand
) {
    /**
     * Checks if the primary controller state changed, ignoring substates.
     */
    public boolean isControllerStateChange() {
        return oldState.state() != newState.state();
    }
}
