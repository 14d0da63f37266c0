package com.questrail.hexrot.observability;

import java.time.Instant;

/**
 * Record representing a connection coming up or going down.
 *
 * @param endpoint human-readable description of the connection
 * @param cause    failure that took the connection down; {@code null} for an
 *                 orderly close or for {@link Kind#CONNECTED}
 */
public record HexrotTransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String endpoint,
    Throwable cause
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED
    }
}
