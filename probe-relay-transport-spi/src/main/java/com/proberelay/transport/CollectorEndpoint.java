package com.proberelay.transport;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Base URL of the collector. An explicit override (system property, then environment) beats the
 * configured host and port.
 */
public record CollectorEndpoint(String scheme, String host, int port) {
    public static final String DEFAULT_SCHEME = "http";
    public static final String DEFAULT_HOST = "kdc-kuzzle";
    public static final int DEFAULT_PORT = 7512;
    public static final String PROP_URL = "probe-relay.collector.url";
    public static final String ENV_URL = "PROBE_RELAY_COLLECTOR_URL";

    public CollectorEndpoint {
        scheme = scheme == null || scheme.isBlank() ? DEFAULT_SCHEME : scheme.trim().toLowerCase(Locale.ROOT);
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Collector host must not be blank");
        }
        host = host.trim();
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Collector port out of range: " + port);
        }
    }

    public static CollectorEndpoint of(String host, int port) {
        return new CollectorEndpoint(DEFAULT_SCHEME, host, port);
    }

    public static CollectorEndpoint defaults() {
        return of(DEFAULT_HOST, DEFAULT_PORT);
    }

    /** Applies the system property or environment override when one is set. */
    public CollectorEndpoint resolve() {
        String sys = System.getProperty(PROP_URL);
        if (sys != null && !sys.isBlank()) return parse(sys);
        String env = System.getenv(ENV_URL);
        if (env != null && !env.isBlank()) return parse(env);
        return this;
    }

    public static CollectorEndpoint parse(String url) {
        URI uri = URI.create(Objects.requireNonNull(url, "url").trim());
        String scheme = uri.getScheme() == null ? DEFAULT_SCHEME : uri.getScheme();
        int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        return new CollectorEndpoint(scheme, uri.getHost(), port);
    }

    public String baseUrl() {
        return scheme + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return baseUrl();
    }
}
