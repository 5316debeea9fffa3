package com.proberelay.spring.autoconfigure;

import com.proberelay.core.ProbeRelayConfig;
import com.proberelay.transport.CollectorEndpoint;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the probe relay.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * probe-relay:
 *   enabled: true            # default
 *   transport: okhttp        # okhttp (default) or logging
 *   collector:
 *     host: kdc-kuzzle
 *     port: 7512
 *   max-connection-errors: 10
 *   reconnect-delay: 1s
 *   max-reconnect-delay: 30s
 *   probes:
 *     requests:
 *       kind: monitor
 *       hooks: ["server:afterInfo"]
 *     sessions:
 *       kind: counter
 *       increasers: ["auth:afterLogin"]
 *       decreasers: ["auth:afterLogout"]
 * }</pre>
 *
 * <p>The collector URL can still be overridden with the {@code probe-relay.collector.url} system
 * property or the {@code PROBE_RELAY_COLLECTOR_URL} environment variable.
 */
@ConfigurationProperties(prefix = "probe-relay")
public class ProbeRelayProperties {

    /** Master switch; when disabled no relay bean is created. */
    private boolean enabled = true;

    private Transport transport = Transport.OKHTTP;

    private final Collector collector = new Collector();

    /** Failed connection attempts tolerated before measures are disabled for good. */
    private int maxConnectionErrors = ProbeRelayConfig.DEFAULT_MAX_CONNECTION_ERRORS;

    private Duration reconnectDelay = ProbeRelayConfig.DEFAULT_RECONNECT_DELAY;

    private Duration maxReconnectDelay = ProbeRelayConfig.DEFAULT_MAX_RECONNECT_DELAY;

    /** Plugin the measures are addressed to on the collector. */
    private String pluginId = ProbeRelayConfig.DEFAULT_PLUGIN_ID;

    /** Host event that opens the collector connection. */
    private String hostStartedEvent = ProbeRelayConfig.DEFAULT_HOST_STARTED_EVENT;

    /** Refuse to start when any probe declaration is invalid instead of skipping it. */
    private boolean failFast;

    /** Connect as soon as the Spring application is ready. */
    private boolean connectOnReady = true;

    private Map<String, ProbeDeclaration> probes = new LinkedHashMap<>();

    public ProbeRelayConfig toConfig() {
        Map<String, Object> raw = new LinkedHashMap<>();
        probes.forEach((name, declaration) -> raw.put(name, declaration == null ? null : declaration.toRaw()));
        return ProbeRelayConfig.builder()
                .collectorHost(collector.getHost())
                .collectorPort(collector.getPort())
                .maxConnectionErrors(maxConnectionErrors)
                .reconnectDelay(reconnectDelay)
                .maxReconnectDelay(maxReconnectDelay)
                .pluginId(pluginId)
                .hostStartedEvent(hostStartedEvent)
                .failFast(failFast)
                .probes(raw)
                .build();
    }

    public CollectorEndpoint endpoint() {
        return new CollectorEndpoint(collector.getScheme(), collector.getHost(), collector.getPort());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Transport getTransport() {
        return transport;
    }

    public void setTransport(Transport transport) {
        this.transport = transport;
    }

    public Collector getCollector() {
        return collector;
    }

    public int getMaxConnectionErrors() {
        return maxConnectionErrors;
    }

    public void setMaxConnectionErrors(int maxConnectionErrors) {
        this.maxConnectionErrors = maxConnectionErrors;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public void setReconnectDelay(Duration reconnectDelay) {
        this.reconnectDelay = reconnectDelay;
    }

    public Duration getMaxReconnectDelay() {
        return maxReconnectDelay;
    }

    public void setMaxReconnectDelay(Duration maxReconnectDelay) {
        this.maxReconnectDelay = maxReconnectDelay;
    }

    public String getPluginId() {
        return pluginId;
    }

    public void setPluginId(String pluginId) {
        this.pluginId = pluginId;
    }

    public String getHostStartedEvent() {
        return hostStartedEvent;
    }

    public void setHostStartedEvent(String hostStartedEvent) {
        this.hostStartedEvent = hostStartedEvent;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    public boolean isConnectOnReady() {
        return connectOnReady;
    }

    public void setConnectOnReady(boolean connectOnReady) {
        this.connectOnReady = connectOnReady;
    }

    public Map<String, ProbeDeclaration> getProbes() {
        return probes;
    }

    public void setProbes(Map<String, ProbeDeclaration> probes) {
        this.probes = probes;
    }

    public enum Transport {
        /** HTTP calls to the collector. */
        OKHTTP,
        /** Measures are only logged; nothing leaves the process. */
        LOGGING
    }

    /** Where the collector listens. */
    public static class Collector {

        private String scheme = CollectorEndpoint.DEFAULT_SCHEME;
        private String host = ProbeRelayConfig.DEFAULT_COLLECTOR_HOST;
        private int port = ProbeRelayConfig.DEFAULT_COLLECTOR_PORT;

        /** Measures kept while the collector is not reachable yet; 0 drops them. */
        private int queueCapacity = 500;

        public String getScheme() {
            return scheme;
        }

        public void setScheme(String scheme) {
            this.scheme = scheme;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
