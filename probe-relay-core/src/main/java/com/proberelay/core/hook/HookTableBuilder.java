package com.proberelay.core.hook;

import com.proberelay.core.probe.Probe;
import com.proberelay.core.probe.ProbeKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the {@link HookTable} from validated probes.
 *
 * <p>Every trigger event of every probe is merged in with {@link #register}: several probes of the
 * same kind sharing an event still produce a single dispatch for that event.
 */
public final class HookTableBuilder {

    private final Map<String, List<ProbeKind>> hooks = new LinkedHashMap<>();

    public static HookTable build(Map<String, ? extends Probe> probes) {
        HookTableBuilder builder = new HookTableBuilder();
        if (probes != null) probes.values().forEach(builder::add);
        return builder.build();
    }

    public HookTableBuilder add(Probe probe) {
        for (String event : probe.triggerEvents()) {
            register(event, probe.kind());
        }
        return this;
    }

    public HookTable build() {
        return hooks.isEmpty() ? HookTable.empty() : new HookTable(hooks);
    }

    void register(String event, ProbeKind kind) {
        List<ProbeKind> kinds = hooks.get(event);
        if (kinds == null) {
            // first kind for this event
            List<ProbeKind> single = new ArrayList<>(2);
            single.add(kind);
            hooks.put(event, single);
        } else if (!kinds.contains(kind)) {
            // a single kind is promoted to a set, an existing set grows; first-seen order is kept
            kinds.add(kind);
        }
        // already bound: nothing to do
    }
}
