package com.adlens.engine;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of a time series request: chronologically ordered values, or a {@link SeriesFailure} with detail text.
 */
public final class SeriesResult {

    private final double[] values;
    private final SeriesFailure failure;
    private final String detail;

    private SeriesResult(double[] values, SeriesFailure failure, String detail) {
        this.values = values;
        this.failure = failure;
        this.detail = detail;
    }

    public static SeriesResult of(double[] values) {
        Objects.requireNonNull(values, "values");
        return new SeriesResult(values.clone(), null, null);
    }

    public static SeriesResult failure(SeriesFailure failure, String detail) {
        Objects.requireNonNull(failure, "failure");
        return new SeriesResult(new double[0], failure, detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /** Copy of the values; empty on failure. */
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public SeriesFailure failure() {
        return failure;
    }

    /** Failure reason plus detail, e.g. {@code metric_missing: ctr}; null on success. */
    public String describeFailure() {
        if (failure == null) return null;
        return detail == null || detail.isBlank() ? failure.reason() : failure.reason() + ": " + detail;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SeriesResult{n=" + values.length + ", values=" + Arrays.toString(values) + "}"
                : "SeriesResult{" + describeFailure() + "}";
    }
}
