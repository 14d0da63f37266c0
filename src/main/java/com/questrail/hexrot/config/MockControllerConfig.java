package com.questrail.hexrot.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a mock controller.
 *
 * @param host              local address to listen on
 * @param port              local port; 0 binds an ephemeral port
 * @param telemetryInterval period between telemetry frames
 */
public record MockControllerConfig(
    String host,
    int port,
    Duration telemetryInterval
) {
    public static final Duration DEFAULT_TELEMETRY_INTERVAL = Duration.ofMillis(100);

    public MockControllerConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(telemetryInterval, "telemetryInterval");
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port must be in 0..65535: " + port);
        }
        if (telemetryInterval.isNegative() || telemetryInterval.isZero()) {
            throw new IllegalArgumentException("telemetryInterval must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = 0;
        private Duration telemetryInterval = DEFAULT_TELEMETRY_INTERVAL;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withTelemetryInterval(Duration telemetryInterval) {
            this.telemetryInterval = telemetryInterval;
            return this;
        }

        public MockControllerConfig build() {
            return new MockControllerConfig(host, port, telemetryInterval);
        }
    }
}
