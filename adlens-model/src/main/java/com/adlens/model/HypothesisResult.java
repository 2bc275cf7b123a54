package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;
import java.util.Objects;

/**
 * A {@link ValidationResult} emitted by a run, together with the hypothesis text and the task it came from.
 */
public record HypothesisResult(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("hypothesis_text") String hypothesisText,
        @JsonProperty("supporting_data_points") List<String> supportingDataPoints,
        @JsonUnwrapped ValidationResult result) {

    public HypothesisResult {
        Objects.requireNonNull(result, "result");
        hypothesisText = hypothesisText != null ? hypothesisText : "";
        supportingDataPoints = supportingDataPoints == null ? List.of() : List.copyOf(supportingDataPoints);
    }

    public static HypothesisResult of(Task task, Hypothesis hypothesis, ValidationResult result) {
        return new HypothesisResult(task.id(), hypothesis.hypothesis(), hypothesis.supportingDataPoints(), result);
    }

    public ValidationStatus status() {
        return result.status();
    }
}
