package com.questrail.hexrot.config;

import java.time.Duration;
import java.util.Objects;

/**
 * LinkTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational time bounds for a command/telemetry link.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b> - Maximum time {@code connect()} waits for the TCP
 *       connection to be established.</li>
 *   <li><b>commandTimeout</b> - Maximum time {@code runCommand} waits for the
 *       correlated command status before failing with a timeout. The
 *       connection is left open when this expires.</li>
 * </ul>
 */
public record LinkTimingPolicy(
        Duration connectTimeout,
        Duration commandTimeout
) {
    public LinkTimingPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(commandTimeout, "commandTimeout");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (commandTimeout.isNegative() || commandTimeout.isZero()) {
            throw new IllegalArgumentException("commandTimeout must be positive");
        }
    }

    /**
     * Default values: connectTimeout 10 s, commandTimeout 5 s.
     */
    public static LinkTimingPolicy defaults() {
        return new LinkTimingPolicy(Duration.ofSeconds(10), Duration.ofSeconds(5));
    }

    public LinkTimingPolicy withCommandTimeout(Duration commandTimeout) {
        return new LinkTimingPolicy(connectTimeout, commandTimeout);
    }

    public LinkTimingPolicy withConnectTimeout(Duration connectTimeout) {
        return new LinkTimingPolicy(connectTimeout, commandTimeout);
    }
}
