package com.questrail.hexrot.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the link or mock controller.
 */
public record HexrotErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
