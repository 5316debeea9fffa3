package com.proberelay.core;

import com.proberelay.transport.CollectorEndpoint;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Relay settings: where the collector lives, how hard to try reaching it, and the raw probe
 * declarations.
 *
 * <p>Probe declarations are kept raw on purpose: they are validated by
 * {@link com.proberelay.core.probe.ProbeValidator}, which reports bad ones instead of failing here.
 */
public record ProbeRelayConfig(
        String collectorHost,
        int collectorPort,
        int maxConnectionErrors,
        Duration reconnectDelay,
        Duration maxReconnectDelay,
        String pluginId,
        String hostStartedEvent,
        boolean failFast,
        Map<String, Object> probes) {

    public static final String DEFAULT_COLLECTOR_HOST = "kdc-kuzzle";
    public static final int DEFAULT_COLLECTOR_PORT = 7512;
    public static final int DEFAULT_MAX_CONNECTION_ERRORS = 10;
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_RECONNECT_DELAY = Duration.ofSeconds(30);
    public static final String DEFAULT_PLUGIN_ID = "kuzzle-plugin-probe";
    public static final String DEFAULT_HOST_STARTED_EVENT = "core:kuzzleStart";

    public ProbeRelayConfig {
        if (collectorHost == null || collectorHost.isBlank()) {
            throw new IllegalArgumentException("collectorHost must not be blank");
        }
        if (collectorPort < 1 || collectorPort > 65535) {
            throw new IllegalArgumentException("collectorPort out of range: " + collectorPort);
        }
        if (maxConnectionErrors < 1) {
            throw new IllegalArgumentException("maxConnectionErrors must be positive: " + maxConnectionErrors);
        }
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        Objects.requireNonNull(maxReconnectDelay, "maxReconnectDelay");
        if (reconnectDelay.isNegative() || maxReconnectDelay.isNegative()) {
            throw new IllegalArgumentException("Reconnect delays must not be negative");
        }
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("pluginId must not be blank");
        }
        if (hostStartedEvent == null || hostStartedEvent.isBlank()) {
            throw new IllegalArgumentException("hostStartedEvent must not be blank");
        }
        probes = probes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(probes));
    }

    public CollectorEndpoint endpoint() {
        return CollectorEndpoint.of(collectorHost, collectorPort);
    }

    public static ProbeRelayConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .collectorHost(collectorHost)
                .collectorPort(collectorPort)
                .maxConnectionErrors(maxConnectionErrors)
                .reconnectDelay(reconnectDelay)
                .maxReconnectDelay(maxReconnectDelay)
                .pluginId(pluginId)
                .hostStartedEvent(hostStartedEvent)
                .failFast(failFast)
                .probes(probes);
    }

    public static final class Builder {
        private String collectorHost = DEFAULT_COLLECTOR_HOST;
        private int collectorPort = DEFAULT_COLLECTOR_PORT;
        private int maxConnectionErrors = DEFAULT_MAX_CONNECTION_ERRORS;
        private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
        private Duration maxReconnectDelay = DEFAULT_MAX_RECONNECT_DELAY;
        private String pluginId = DEFAULT_PLUGIN_ID;
        private String hostStartedEvent = DEFAULT_HOST_STARTED_EVENT;
        private boolean failFast;
        private final Map<String, Object> probes = new LinkedHashMap<>();

        private Builder() {}

        public Builder collectorHost(String collectorHost) {
            this.collectorHost = collectorHost;
            return this;
        }

        public Builder collectorPort(int collectorPort) {
            this.collectorPort = collectorPort;
            return this;
        }

        public Builder maxConnectionErrors(int maxConnectionErrors) {
            this.maxConnectionErrors = maxConnectionErrors;
            return this;
        }

        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
            return this;
        }

        public Builder maxReconnectDelay(Duration maxReconnectDelay) {
            this.maxReconnectDelay = maxReconnectDelay;
            return this;
        }

        public Builder pluginId(String pluginId) {
            this.pluginId = pluginId;
            return this;
        }

        public Builder hostStartedEvent(String hostStartedEvent) {
            this.hostStartedEvent = hostStartedEvent;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder probe(String name, Object declaration) {
            this.probes.put(name, declaration);
            return this;
        }

        public Builder probes(Map<String, ?> probes) {
            this.probes.clear();
            if (probes != null) this.probes.putAll(probes);
            return this;
        }

        public ProbeRelayConfig build() {
            return new ProbeRelayConfig(
                    collectorHost,
                    collectorPort,
                    maxConnectionErrors,
                    reconnectDelay,
                    maxReconnectDelay,
                    pluginId,
                    hostStartedEvent,
                    failFast,
                    probes);
        }
    }
}
