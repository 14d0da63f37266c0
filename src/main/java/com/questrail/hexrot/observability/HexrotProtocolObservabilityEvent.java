package com.questrail.hexrot.observability;

import java.time.Instant;

/**
 * Record representing a protocol-level occurrence on the link.
 *
 * @param counter the command or frame counter involved, or {@code -1} if none
 */
public record HexrotProtocolObservabilityEvent(
    Instant timestamp,
    Kind kind,
    long counter,
    String detail
) {
    public enum Kind {
        COMMAND_SENT,
        COMMAND_ACKNOWLEDGED,
        COMMAND_REJECTED,
        COMMAND_TIMED_OUT,
        COMMAND_STATUS_DISCARDED,
        UNRECOGNIZED_FRAME,
        CONFIG_RECEIVED
    }
}
