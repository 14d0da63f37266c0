package com.questrail.hexrot.internal.state;

import java.util.Optional;

/**
 * Sub-command carried in {@code param1} of a device's SET_STATE command.
 */
public enum SetStateParam
{
    START(1),
    ENABLE(2),
    STANDBY(3),
    DISABLE(4),
    EXIT(5),
    CLEAR_ERROR(6),
    ENTER_CONTROL(7);

    private final int wireValue;

    SetStateParam(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static Optional<SetStateParam> fromWire(int value) {
        for (SetStateParam p : values()) {
            if (p.wireValue == value) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
