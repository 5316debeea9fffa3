package com.proberelay.core.probe;

import java.util.Objects;

/** Why one probe declaration was rejected. */
public record ProbeDiagnostic(String probeName, String message) {

    public ProbeDiagnostic {
        Objects.requireNonNull(probeName, "probeName");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return "[probe: " + probeName + "] " + message;
    }
}
