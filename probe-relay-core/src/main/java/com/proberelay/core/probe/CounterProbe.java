package com.proberelay.core.probe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Counter moved up by {@code increasers} and down by {@code decreasers}. The two lists are disjoint
 * and at least one of them is non-empty.
 */
public record CounterProbe(String name, List<String> increasers, List<String> decreasers) implements Probe {

    public CounterProbe {
        Objects.requireNonNull(name, "name");
        increasers = increasers == null ? List.of() : List.copyOf(increasers);
        decreasers = decreasers == null ? List.of() : List.copyOf(decreasers);
        if (increasers.isEmpty() && decreasers.isEmpty()) {
            throw new IllegalArgumentException("Counter probe " + name + " needs increasers or decreasers");
        }
        if (!Collections.disjoint(increasers, decreasers)) {
            throw new IllegalArgumentException(
                    "Counter probe " + name + " cannot both increase and decrease on " + sharedEvents(increasers, decreasers));
        }
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.COUNTER;
    }

    @Override
    public List<String> triggerEvents() {
        List<String> events = new ArrayList<>(increasers.size() + decreasers.size());
        events.addAll(increasers);
        events.addAll(decreasers);
        return Collections.unmodifiableList(events);
    }

    static List<String> sharedEvents(List<String> increasers, List<String> decreasers) {
        List<String> shared = new ArrayList<>();
        for (String event : increasers) {
            if (decreasers.contains(event) && !shared.contains(event)) shared.add(event);
        }
        return shared;
    }
}
