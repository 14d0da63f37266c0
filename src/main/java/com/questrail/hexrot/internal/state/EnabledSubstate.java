package com.questrail.hexrot.internal.state;

import java.util.Optional;

/**
 * Substate reported while the controller is {@link ControllerState#ENABLED}.
 */
public enum EnabledSubstate
{
    NONE(0),
    STATIONARY(1),
    MOVING_POINT_TO_POINT(2);

    private final int wireValue;

    EnabledSubstate(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static Optional<EnabledSubstate> fromWire(int value) {
        for (EnabledSubstate s : values()) {
            if (s.wireValue == value) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
