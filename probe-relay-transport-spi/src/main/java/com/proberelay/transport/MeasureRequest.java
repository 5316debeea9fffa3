package com.proberelay.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One measurement addressed to the collector.
 *
 * @param destination collector channel, {@code <plugin-id>/measure}
 * @param action probe kind handled by the collector
 * @param body {@code {event}} or {@code {event, payload}}, iteration order preserved
 */
public record MeasureRequest(String destination, String action, Map<String, Object> body) {

    public static final String EVENT = "event";
    public static final String PAYLOAD = "payload";

    public MeasureRequest {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(action, "action");
        body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public String event() {
        Object event = body.get(EVENT);
        return event == null ? null : event.toString();
    }

    public boolean hasPayload() {
        return body.containsKey(PAYLOAD);
    }
}
