package com.adlens.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every diagnostic in memory, in emission order.
 */
public final class RecordingDiagnostics implements Diagnostics {

    private final List<DiagnosticEvent> events = new ArrayList<>();

    @Override
    public void record(DiagnosticEvent event) {
        events.add(event);
    }

    public List<DiagnosticEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public List<DiagnosticEvent> warnings() {
        return byLevel(DiagnosticEvent.Level.WARN);
    }

    public List<DiagnosticEvent> errors() {
        return byLevel(DiagnosticEvent.Level.ERROR);
    }

    private List<DiagnosticEvent> byLevel(DiagnosticEvent.Level level) {
        List<DiagnosticEvent> out = new ArrayList<>();
        for (DiagnosticEvent e : events) {
            if (e.level() == level) out.add(e);
        }
        return out;
    }
}
