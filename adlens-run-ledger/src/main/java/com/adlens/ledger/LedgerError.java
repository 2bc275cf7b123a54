package com.adlens.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One isolated failure of a run: the stage it happened in, the task and/or hypothesis it belongs to, and the
 * error text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerError(
        @JsonProperty("stage") String stage,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("hypothesis_id") String hypothesisId,
        @JsonProperty("error") String error) {

    /** Hypothesis generation for a task. */
    public static final String STAGE_INSIGHT = "insight";
    /** Statistical evaluation of a hypothesis. */
    public static final String STAGE_EVALUATION = "evaluation";
    /** Creative generation after a validated hypothesis. */
    public static final String STAGE_CREATIVE = "creative";

    public LedgerError {
        Objects.requireNonNull(stage, "stage");
        error = error != null ? error : "unknown error";
    }
}
