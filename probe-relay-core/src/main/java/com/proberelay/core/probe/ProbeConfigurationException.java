package com.proberelay.core.probe;

import java.util.List;
import java.util.stream.Collectors;

/** Raised only in fail-fast mode, carrying every rejected declaration. */
public class ProbeConfigurationException extends IllegalStateException {
    private final transient List<ProbeDiagnostic> diagnostics;

    public ProbeConfigurationException(List<ProbeDiagnostic> diagnostics) {
        super(describe(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<ProbeDiagnostic> diagnostics() {
        return diagnostics;
    }

    private static String describe(List<ProbeDiagnostic> diagnostics) {
        return diagnostics.size() + " invalid probe declaration(s): "
                + diagnostics.stream().map(ProbeDiagnostic::toString).collect(Collectors.joining("; "));
    }
}
