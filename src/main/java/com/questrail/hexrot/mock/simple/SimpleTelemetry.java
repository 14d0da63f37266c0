package com.questrail.hexrot.mock.simple;

import com.questrail.hexrot.internal.state.ControllerState;
import com.questrail.hexrot.internal.state.DeviceState;
import com.questrail.hexrot.internal.state.EnabledSubstate;
import com.questrail.hexrot.internal.state.OfflineSubstate;

/**
 * Telemetry reported by the simple device. State fields carry raw wire values;
 * {@link #deviceState()} maps them back to enums.
 */
public record SimpleTelemetry(
        int state,
        int enabledSubstate,
        int offlineSubstate,
        double currentPosition,
        double commandedPosition
) {
    public static SimpleTelemetry of(DeviceState deviceState, double currentPosition, double commandedPosition) {
        return new SimpleTelemetry(
                deviceState.state().wireValue(),
                deviceState.enabledSubstate().wireValue(),
                deviceState.offlineSubstate().wireValue(),
                currentPosition,
                commandedPosition);
    }

    /**
     * @throws IllegalStateException if any state field holds an unknown value
     */
    public DeviceState deviceState() {
        return new DeviceState(
                ControllerState.fromWire(state)
                        .orElseThrow(() -> new IllegalStateException("unknown state " + state)),
                EnabledSubstate.fromWire(enabledSubstate)
                        .orElseThrow(() -> new IllegalStateException("unknown enabled substate " + enabledSubstate)),
                OfflineSubstate.fromWire(offlineSubstate)
                        .orElseThrow(() -> new IllegalStateException("unknown offline substate " + offlineSubstate)));
    }
}
