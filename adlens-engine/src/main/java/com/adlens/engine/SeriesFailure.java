package com.adlens.engine;

/**
 * Why a time series could not be supplied. {@link #reason()} is the text recorded in validation errors.
 */
public enum SeriesFailure {
    /** Dataset could not be loaded. */
    MISSING("timeseries_missing"),
    /** No rows for the requested scope. */
    EMPTY("timeseries_empty"),
    /** Requested metric is not a column of the dataset. */
    METRIC_NOT_FOUND("metric_missing"),
    /** Provider failed unexpectedly. */
    ERROR("error_preparing_series");

    private final String reason;

    SeriesFailure(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
