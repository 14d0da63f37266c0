package com.questrail.hexrot.model;

import java.util.Optional;

/**
 * Acknowledgement outcome carried by a {@link CommandStatus}.
 */
public enum CommandStatusCode
{
    ACK(1),
    NO_ACK(2);

    private final int wireValue;

    CommandStatusCode(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static Optional<CommandStatusCode> fromWire(int value) {
        for (CommandStatusCode code : values()) {
            if (code.wireValue == value) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
