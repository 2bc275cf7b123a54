package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistical block of a {@link ValidationResult}: test method, segment means, relative change, p-value,
 * effect size and change-point. When evaluation could not run, only {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Validation(
        @JsonProperty("metric") String metric,
        @JsonProperty("method") String method,
        @JsonProperty("baseline_mean") Double baselineMean,
        @JsonProperty("test_mean") Double testMean,
        @JsonProperty("relative_change_pct") Double relativeChangePct,
        @JsonProperty("p_value") Double pValue,
        @JsonProperty("effect_size") Double effectSize,
        @JsonProperty("n_baseline") Integer nBaseline,
        @JsonProperty("n_test") Integer nTest,
        @JsonProperty("change_point") ChangePoint changePoint,
        @JsonProperty("error") String error) {

    public static Validation error(String message) {
        return new Validation(null, null, null, null, null, null, null, null, null, null,
                message != null ? message : "unknown error");
    }

    public boolean hasError() {
        return error != null;
    }
}
