package com.adlens.ledger;

import com.adlens.model.Task;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-run diagnostics: the errors isolated during the run and the tasks that were executed, both in append order.
 * Owned by a single executor for the lifetime of one run; not thread-safe.
 * <p>
 * {@link #persist(LedgerStore)} is fail-safe: any exception from the store is caught, logged, and not rethrown
 * so a ledger write never fails a run.
 */
@JsonPropertyOrder({"run_id", "errors", "tasks_executed"})
public final class RunLedger {

    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);

    private final String runId;
    private final List<LedgerError> errors = new ArrayList<>();
    private final List<ExecutedTask> tasksExecuted = new ArrayList<>();

    public RunLedger(String runId) {
        this.runId = Objects.requireNonNull(runId, "runId");
    }

    public void taskExecuted(Task task) {
        tasksExecuted.add(ExecutedTask.of(task));
    }

    public void error(String stage, String taskId, String hypothesisId, String error) {
        errors.add(new LedgerError(stage, taskId, hypothesisId, error));
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("errors")
    public List<LedgerError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    @JsonProperty("tasks_executed")
    public List<ExecutedTask> getTasksExecuted() {
        return Collections.unmodifiableList(tasksExecuted);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Errors recorded for one stage, in append order. */
    public List<LedgerError> errorsForStage(String stage) {
        List<LedgerError> out = new ArrayList<>();
        for (LedgerError e : errors) {
            if (e.stage().equals(stage)) out.add(e);
        }
        return out;
    }

    public void persist(LedgerStore store) {
        if (store == null) return;
        try {
            store.save(this);
        } catch (Exception e) {
            log.warn("Ledger persist failed (runId={}); run result is unaffected. Error: {}", runId, e.getMessage(), e);
        }
    }
}
