package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display-oriented view of a validation. {@code ctrDeltaPct} is null when the baseline mean is zero
 * (undefined relative change), unlike {@link Validation#relativeChangePct()} which uses an epsilon floor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Evidence(
        @JsonProperty("baseline_ctr") Double baselineCtr,
        @JsonProperty("current_ctr") Double currentCtr,
        @JsonProperty("ctr_delta_pct") Double ctrDeltaPct,
        @JsonProperty("effect_size") Double effectSize,
        @JsonProperty("p_value") Double pValue,
        @JsonProperty("n_baseline") Integer nBaseline,
        @JsonProperty("n_test") Integer nTest,
        @JsonProperty("change_point") ChangePoint changePoint) {

    private static final Evidence EMPTY = new Evidence(null, null, null, null, null, null, null, null);

    public static Evidence empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return equals(EMPTY);
    }
}
