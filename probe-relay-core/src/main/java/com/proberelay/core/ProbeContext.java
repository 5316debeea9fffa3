package com.proberelay.core;

import com.proberelay.core.hook.HookTable;
import com.proberelay.core.probe.Probe;
import com.proberelay.core.probe.ProbeDiagnostic;
import com.proberelay.core.probe.ProbeValidation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot built once at initialization and read by every handler invocation.
 * A new configuration means a new context, never an update of this one.
 */
public record ProbeContext(Map<String, Probe> probes, HookTable hooks, List<ProbeDiagnostic> diagnostics) {

    public ProbeContext {
        probes = probes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(probes));
        hooks = Objects.requireNonNullElse(hooks, HookTable.empty());
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    static ProbeContext of(ProbeValidation validation, HookTable hooks) {
        return new ProbeContext(validation.probes(), hooks, validation.diagnostics());
    }

    public boolean isIdle() {
        return probes.isEmpty();
    }
}
