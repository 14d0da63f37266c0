package com.questrail.hexrot.model;

import java.util.Objects;

/**
 * CommandStatus
 * =============================================================================
 * Controller reply to a {@link Command}, correlated by the counter in the
 * preceding {@link Header}.
 *
 * <p>{@code duration} is the estimated number of seconds until the commanded
 * action completes (0 when already complete). {@code reason} is empty for an
 * {@link CommandStatusCode#ACK}; on the wire it occupies a fixed
 * {@value #REASON_LENGTH}-byte buffer and longer text is truncated.</p>
 */
public record CommandStatus(CommandStatusCode status, double duration, String reason)
{
    public static final int REASON_LENGTH = 50;

    public CommandStatus {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(reason, "reason");
    }

    public static CommandStatus ack(double duration) {
        return new CommandStatus(CommandStatusCode.ACK, duration, "");
    }

    public static CommandStatus noAck(String reason) {
        return new CommandStatus(CommandStatusCode.NO_ACK, 0.0, reason);
    }

    public boolean isAck() {
        return status == CommandStatusCode.ACK;
    }
}
