package com.proberelay.core.probe;

import java.util.List;
import java.util.Objects;

/** Counts occurrences of each listed event. */
public record MonitorProbe(String name, List<String> hooks) implements Probe {

    public MonitorProbe {
        Objects.requireNonNull(name, "name");
        if (hooks == null || hooks.isEmpty()) {
            throw new IllegalArgumentException("Monitor probe " + name + " needs at least one hook");
        }
        hooks = List.copyOf(hooks);
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.MONITOR;
    }

    @Override
    public List<String> triggerEvents() {
        return hooks;
    }
}
