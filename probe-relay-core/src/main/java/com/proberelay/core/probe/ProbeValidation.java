package com.proberelay.core.probe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link ProbeValidator#validate(Map)}: the admitted probes, in declaration order, next to
 * one diagnostic per rejected declaration.
 */
public record ProbeValidation(Map<String, Probe> probes, List<ProbeDiagnostic> diagnostics) {

    public ProbeValidation {
        probes = probes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(probes));
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static ProbeValidation empty() {
        return new ProbeValidation(Map.of(), List.of());
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /** Fail-fast view: returns the probes only when every declaration was valid. */
    public Map<String, Probe> requireValid() {
        if (hasErrors()) throw new ProbeConfigurationException(diagnostics);
        return probes;
    }
}
