package com.proberelay.spring;

/**
 * Host event published through the Spring application context; the bridge forwards it to the
 * probes bound to {@code name}.
 */
public record HostEvent(String name, Object payload) {

    public HostEvent {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Host event name must not be blank");
        }
    }

    public static HostEvent of(String name) {
        return new HostEvent(name, null);
    }
}
