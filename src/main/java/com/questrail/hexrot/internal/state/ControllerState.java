package com.questrail.hexrot.internal.state;

import java.util.Optional;

/**
 * Primary state of a hexapod or rotator controller, as reported in telemetry.
 */
public enum ControllerState
{
    STANDBY(0),
    DISABLED(1),
    ENABLED(2),
    OFFLINE(3),
    FAULT(4);

    private final int wireValue;

    ControllerState(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static Optional<ControllerState> fromWire(int value) {
        for (ControllerState s : values()) {
            if (s.wireValue == value) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
