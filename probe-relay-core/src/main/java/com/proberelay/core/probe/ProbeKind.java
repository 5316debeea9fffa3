package com.proberelay.core.probe;

import java.util.Locale;
import java.util.Optional;

/** Closed set of probe kinds. The wire name doubles as the collector action and the handler id. */
public enum ProbeKind {
    MONITOR("monitor"),
    COUNTER("counter"),
    WATCHER("watcher"),
    SAMPLER("sampler");

    private final String wireName;

    ProbeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Watchers and samplers observe document or message content, so their measures carry the payload. */
    public boolean carriesPayload() {
        return this == WATCHER || this == SAMPLER;
    }

    public static Optional<ProbeKind> fromWireName(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProbeKind kind : values()) {
            if (kind.wireName.equals(normalized)) return Optional.of(kind);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
