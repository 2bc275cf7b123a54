package com.adlens.report;

import com.adlens.ledger.ExecutedTask;
import com.adlens.ledger.LedgerError;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/** Content of {@code run_metadata_<runId>.json}. */
@JsonPropertyOrder({"run_id", "query", "timestamp", "errors", "tasks_executed", "artifacts"})
public record RunMetadata(
        @JsonProperty("run_id") String runId,
        @JsonProperty("query") String query,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("errors") List<LedgerError> errors,
        @JsonProperty("tasks_executed") List<ExecutedTask> tasksExecuted,
        @JsonProperty("artifacts") Map<String, String> artifacts) {
}
