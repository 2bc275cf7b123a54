package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of planning: the user query and the tasks to run (unordered; the scheduler orders them).
 */
public record AnalysisPlan(
        @JsonProperty("query") String query,
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("plan_description") String planDescription,
        @JsonProperty("tasks") List<Task> tasks) {

    public AnalysisPlan {
        planDescription = planDescription != null ? planDescription : "";
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
