package com.adlens.engine.stats;

/**
 * Baseline-versus-test statistics for one series split.
 *
 * @param method            {@value #T_TEST} or {@value #BOOTSTRAP}
 * @param relativeChangePct {@code (test - baseline) / max(1e-9, baseline) * 100}
 * @param effectSize        Cohen's d, 0 when the pooled deviation is 0
 */
public record SegmentComparison(
        String method,
        double baselineMean,
        double testMean,
        double relativeChangePct,
        double pValue,
        double effectSize,
        int nBaseline,
        int nTest) {

    public static final String T_TEST = "t-test";
    public static final String BOOTSTRAP = "bootstrap";

    public int nTotal() {
        return nBaseline + nTest;
    }

    /** Relative change in percent, or null when the baseline mean is exactly 0. */
    public Double deltaPctOrNull() {
        if (baselineMean == 0.0) return null;
        return (testMean - baselineMean) / baselineMean * 100.0;
    }
}
