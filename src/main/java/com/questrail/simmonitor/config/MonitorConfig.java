package com.questrail.simmonitor.config;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of one monitored simulation run.
 *
 * @param requirements   requirement texts, in declaration order; may be empty
 * @param hostname       rosbridge host
 * @param port           rosbridge port
 * @param timeout        overall deadline of the run
 * @param ignore         ignore window: messages are recorded but not evaluated until it elapses
 * @param connectTimeout how long to wait for the bus connection
 */
public record MonitorConfig(
    List<String> requirements,
    String hostname,
    int port,
    Duration timeout,
    Duration ignore,
    Duration connectTimeout
) {
    public static final int DEFAULT_PORT = 9090;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_IGNORE = Duration.ZERO;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public MonitorConfig {
        requirements = List.copyOf(Objects.requireNonNull(requirements, "requirements"));
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(ignore, "ignore");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        if (hostname.isBlank()) {
            throw new IllegalArgumentException("hostname must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be in 1..65535: " + port);
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        if (ignore.isNegative()) {
            throw new IllegalArgumentException("ignore must be >= 0");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
    }

    /**
     * WebSocket address of the rosbridge server.
     */
    public URI busUri() {
        return URI.create("ws://" + hostname + ":" + port);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> requirements = List.of();
        private String hostname;
        private int port = DEFAULT_PORT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration ignore = DEFAULT_IGNORE;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

        public Builder withRequirements(List<String> requirements) {
            this.requirements = requirements;
            return this;
        }

        public Builder withHostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withIgnore(Duration ignore) {
            this.ignore = ignore;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public MonitorConfig build() {
            return new MonitorConfig(requirements, hostname, port, timeout, ignore, connectTimeout);
        }
    }
}
