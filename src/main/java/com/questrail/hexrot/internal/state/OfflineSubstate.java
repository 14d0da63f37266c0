package com.questrail.hexrot.internal.state;

import java.util.Optional;

/**
 * Substate reported while the controller is {@link ControllerState#OFFLINE}.
 * Only {@link #AVAILABLE} lets the link take control.
 */
public enum OfflineSubstate
{
    NONE(0),
    PUBLISH_ONLY(1),
    AVAILABLE(2);

    private final int wireValue;

    OfflineSubstate(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static Optional<OfflineSubstate> fromWire(int value) {
        for (OfflineSubstate s : values()) {
            if (s.wireValue == value) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
