package com.adlens.ledger;

import com.adlens.model.Task;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Ledger row for a task that the executor started. */
public record ExecutedTask(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("name") String name,
        @JsonProperty("scope") String scope,
        @JsonProperty("priority") int priority) {

    public static ExecutedTask of(Task task) {
        return new ExecutedTask(task.id(), task.name(), task.scope(), task.priority());
    }
}
