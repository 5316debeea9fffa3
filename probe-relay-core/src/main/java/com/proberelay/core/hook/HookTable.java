package com.proberelay.core.hook;

import com.proberelay.core.probe.ProbeKind;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only mapping of host event name to the probe kinds that react to it. Each kind appears at
 * most once per event; kinds keep the order in which they were first registered.
 */
public final class HookTable {
    private static final HookTable EMPTY = new HookTable(Map.of());

    private final Map<String, List<ProbeKind>> entries;

    HookTable(Map<String, List<ProbeKind>> entries) {
        Map<String, List<ProbeKind>> copy = new LinkedHashMap<>();
        entries.forEach((event, kinds) -> copy.put(event, List.copyOf(kinds)));
        this.entries = Collections.unmodifiableMap(copy);
    }

    public static HookTable empty() {
        return EMPTY;
    }

    /** Kinds bound to {@code event}, empty when no probe listens to it. */
    public List<ProbeKind> kindsFor(String event) {
        return entries.getOrDefault(event, List.of());
    }

    public Set<String> events() {
        return entries.keySet();
    }

    public Map<String, List<ProbeKind>> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /** Kind membership per event, ignoring registration order. */
    public Map<String, Set<ProbeKind>> membership() {
        Map<String, Set<ProbeKind>> out = new LinkedHashMap<>();
        entries.forEach((event, kinds) -> out.put(event, Collections.unmodifiableSet(EnumSet.copyOf(kinds))));
        return Collections.unmodifiableMap(out);
    }

    /**
     * Host-facing view: a single handler id when one kind listens to the event, the ordered list of
     * handler ids otherwise.
     */
    public Map<String, Object> toHostHooks() {
        Map<String, Object> hooks = new LinkedHashMap<>();
        entries.forEach((event, kinds) -> {
            if (kinds.size() == 1) {
                hooks.put(event, kinds.get(0).wireName());
            } else {
                hooks.put(event, kinds.stream().map(ProbeKind::wireName).toList());
            }
        });
        return hooks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HookTable other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "HookTable" + entries;
    }
}
