package com.adlens.ledger;

import java.util.Objects;

/** A single diagnostic emitted during a run. {@code cause} may be null. */
public record DiagnosticEvent(Level level, String source, String message, Throwable cause) {

    public enum Level { INFO, WARN, ERROR }

    public DiagnosticEvent {
        Objects.requireNonNull(level, "level");
        source = source != null ? source : "adlens";
        message = message != null ? message : "";
    }
}
