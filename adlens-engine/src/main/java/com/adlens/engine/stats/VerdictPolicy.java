package com.adlens.engine.stats;

import com.adlens.config.EvaluatorThresholds;
import com.adlens.model.Impact;
import com.adlens.model.ValidationStatus;

/**
 * Turns segment statistics into a status, a calibrated confidence and an impact tier.
 */
public final class VerdictPolicy {

    static final double STRONG_P = 0.01;
    static final double STRONG_EFFECT = 0.5;
    static final int MIN_TOTAL_SAMPLES = 30;

    private final EvaluatorThresholds thresholds;

    public VerdictPolicy(EvaluatorThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * First matching rule wins: strong evidence, threshold evidence, significant but small, otherwise refuted.
     */
    public ValidationStatus decide(double pValue, double relativeChangePct, double effectSize, int nTotal) {
        if (pValue < STRONG_P && Math.abs(effectSize) >= STRONG_EFFECT && nTotal >= MIN_TOTAL_SAMPLES) {
            return ValidationStatus.VALIDATED;
        }
        if (pValue < thresholds.getPValueThreshold()
                && Math.abs(relativeChangePct) >= thresholds.getCtrDropPctThreshold()) {
            return ValidationStatus.VALIDATED;
        }
        if (pValue < thresholds.getPValueThreshold()) {
            return ValidationStatus.INCONCLUSIVE;
        }
        return ValidationStatus.REFUTED;
    }

    /** Adjusts the initial confidence for significance, effect size and sample count; clipped to [0, 1]. */
    public double calibrate(double initialConfidence, double pValue, double effectSize, int nTotal) {
        double conf = initialConfidence;
        if (pValue < 0.01) conf += 0.25;
        else if (pValue < 0.05) conf += 0.12;
        else conf -= 0.12;

        double d = Math.abs(effectSize);
        if (d >= 0.8) conf += 0.2;
        else if (d >= 0.5) conf += 0.1;

        if (nTotal < MIN_TOTAL_SAMPLES) conf -= 0.15;
        if (Double.isNaN(conf)) return 0.0;
        return Math.max(0.0, Math.min(1.0, conf));
    }

    /** Impact tier; {@code deltaPct} null means undefined relative change, which maps to MEDIUM. */
    public static Impact impact(Double deltaPct, double effectSize, double pValue) {
        if (deltaPct == null) return Impact.MEDIUM;
        double delta = Math.abs(deltaPct);
        double d = Math.abs(effectSize);
        if (delta > 25 && d > 0.5 && pValue < 0.05) return Impact.HIGH;
        if (delta > 10 && d > 0.3) return Impact.MEDIUM;
        return Impact.LOW;
    }
}
