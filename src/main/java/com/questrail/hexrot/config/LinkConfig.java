package com.questrail.hexrot.config;

import com.questrail.hexrot.model.Command;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for a command/telemetry link.
 *
 * @param host      controller host name or address
 * @param port      controller command/telemetry port
 * @param commander commander tag stamped on every outgoing command
 */
public record LinkConfig(
    String host,
    int port,
    LinkTimingPolicy timingPolicy,
    int commander
) {
    public LinkConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("port must be in 1..65535: " + port);
        }
    }

    public InetSocketAddress remoteAddress() {
        return new InetSocketAddress(host, port);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "127.0.0.1";
        private int port;
        private LinkTimingPolicy timingPolicy = LinkTimingPolicy.defaults();
        private int commander = Command.DEFAULT_COMMANDER;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withTimingPolicy(LinkTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withCommander(int commander) {
            this.commander = commander;
            return this;
        }

        public LinkConfig build() {
            return new LinkConfig(host, port, timingPolicy, commander);
        }
    }
}
