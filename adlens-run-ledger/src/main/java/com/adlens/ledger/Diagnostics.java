package com.adlens.ledger;

/**
 * Sink for run diagnostics (cycle warnings, missing data, isolated failures). Components receive one through their
 * constructor instead of holding a global logger for run events.
 */
public interface Diagnostics {

    void record(DiagnosticEvent event);

    default void info(String source, String message) {
        record(new DiagnosticEvent(DiagnosticEvent.Level.INFO, source, message, null));
    }

    default void warn(String source, String message) {
        record(new DiagnosticEvent(DiagnosticEvent.Level.WARN, source, message, null));
    }

    default void error(String source, String message, Throwable cause) {
        record(new DiagnosticEvent(DiagnosticEvent.Level.ERROR, source, message, cause));
    }

    /** Forwards every event to both sinks, {@code first} before {@code second}. */
    static Diagnostics both(Diagnostics first, Diagnostics second) {
        return event -> {
            first.record(event);
            second.record(event);
        };
    }
}
