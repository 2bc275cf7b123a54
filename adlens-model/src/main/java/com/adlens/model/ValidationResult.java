package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable verdict for one hypothesis. {@code confidenceFinal} is always within [0, 1].
 */
public record ValidationResult(
        @JsonProperty("hypothesis_id") String hypothesisId,
        @JsonProperty("driver") String driver,
        @JsonProperty("validation") Validation validation,
        @JsonProperty("evidence") Evidence evidence,
        @JsonProperty("impact") Impact impact,
        @JsonProperty("confidence_final") double confidenceFinal,
        @JsonProperty("status") ValidationStatus status,
        @JsonProperty("notes") String notes) {

    public ValidationResult {
        Objects.requireNonNull(hypothesisId, "hypothesisId");
        Objects.requireNonNull(validation, "validation");
        Objects.requireNonNull(status, "status");
        if (Double.isNaN(confidenceFinal) || confidenceFinal < 0.0 || confidenceFinal > 1.0) {
            throw new IllegalArgumentException("confidence_final must be within [0,1]: " + confidenceFinal);
        }
        evidence = evidence != null ? evidence : Evidence.empty();
        impact = impact != null ? impact : Impact.LOW;
        notes = notes != null ? notes : "";
    }

    /** INCONCLUSIVE result carrying only an error; used when evaluation cannot produce statistics. */
    public static ValidationResult inconclusive(String hypothesisId, String driver, String error,
                                                double confidence, String notes) {
        return new ValidationResult(hypothesisId, driver, Validation.error(error), Evidence.empty(),
                Impact.LOW, confidence, ValidationStatus.INCONCLUSIVE, notes);
    }

    @JsonIgnore
    public boolean isValidated() {
        return status == ValidationStatus.VALIDATED;
    }
}
