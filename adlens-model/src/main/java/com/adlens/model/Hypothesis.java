package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A data-grounded claim about a metric movement, produced by a hypothesis generator and read by the evaluator.
 * {@code driver} is the presumed cause tag (e.g. {@value #DRIVER_CREATIVE_FATIGUE}); it defaults to
 * {@value #DRIVER_OTHER}. {@code initialConfidence} must lie in [0, 1].
 */
public record Hypothesis(
        @JsonProperty("id") String id,
        @JsonProperty("hypothesis") String hypothesis,
        @JsonProperty("driver") String driver,
        @JsonProperty("initial_confidence") double initialConfidence,
        @JsonProperty("supporting_data_points") List<String> supportingDataPoints,
        @JsonProperty("required_checks") List<String> requiredChecks) {

    public static final String DRIVER_CREATIVE_FATIGUE = "creative_fatigue";
    public static final String DRIVER_OTHER = "other";

    @JsonCreator
    public Hypothesis {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("hypothesis id must not be blank");
        }
        if (Double.isNaN(initialConfidence) || initialConfidence < 0.0 || initialConfidence > 1.0) {
            throw new IllegalArgumentException("initial_confidence must be within [0,1]: " + initialConfidence);
        }
        hypothesis = hypothesis == null ? "" : hypothesis;
        driver = driver == null || driver.isBlank() ? DRIVER_OTHER : driver.trim();
        supportingDataPoints = supportingDataPoints == null ? List.of() : List.copyOf(supportingDataPoints);
        requiredChecks = requiredChecks == null ? List.of() : List.copyOf(requiredChecks);
    }
}
