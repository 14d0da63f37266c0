package com.questrail.hexrot.model;

/**
 * FrameId
 * =============================================================================
 * Discriminator carried in every {@link Header}, selecting the payload that
 * follows it on the stream.
 *
 * <p>Only controller-to-link frames carry a header. Commands travel the other
 * way as bare {@link Command} records.</p>
 */
public enum FrameId
{
    COMMAND_STATUS(0x01),
    TELEMETRY(0x07),
    CONFIG(0x1B);

    private final int wireValue;

    FrameId(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }
}
