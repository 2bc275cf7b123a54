package com.adlens.model;

/**
 * Verdict of a hypothesis evaluation.
 */
public enum ValidationStatus {
    /** Statistically significant and large enough to act on. */
    VALIDATED,
    /** No significant movement. */
    REFUTED,
    /** Significant but below the magnitude threshold, or data/computation unavailable. */
    INCONCLUSIVE
}
