package com.adlens.engine.stats;

import java.util.Arrays;

/**
 * Descriptive statistics over plain {@code double[]} segments. Callers pass finite values only.
 */
public final class SeriesStats {

    private SeriesStats() {
    }

    /**
     * Arithmetic mean; 0 for an empty segment. Accumulates offsets from the first value so a constant segment
     * returns that value exactly.
     */
    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double first = values[0];
        double offset = 0.0;
        for (double v : values) offset += v - first;
        return first + offset / values.length;
    }

    /** Sample variance (n - 1 denominator); 0 for fewer than two values. */
    public static double variance(double[] values) {
        int n = values.length;
        if (n < 2) return 0.0;
        double mean = mean(values);
        double ss = 0.0;
        for (double v : values) {
            double d = v - mean;
            ss += d * d;
        }
        return ss / (n - 1);
    }

    /**
     * Cohen's d of {@code test} against {@code baseline} using the pooled standard deviation.
     * Returns exactly 0 when the pooled deviation is 0 or there are not enough degrees of freedom.
     */
    public static double cohenD(double[] baseline, double[] test) {
        int na = baseline.length;
        int nb = test.length;
        if (na + nb - 2 <= 0) return 0.0;
        double pooledVar = ((na - 1) * variance(baseline) + (nb - 1) * variance(test)) / (na + nb - 2);
        double pooledSd = Math.sqrt(pooledVar);
        if (pooledSd == 0.0) return 0.0;
        return (mean(test) - mean(baseline)) / pooledSd;
    }

    /** Copy of {@code values} without NaN or infinite entries, order preserved. */
    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }
}
