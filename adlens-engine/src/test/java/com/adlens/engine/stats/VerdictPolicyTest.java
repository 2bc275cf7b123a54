package com.adlens.engine.stats;

import com.adlens.config.EvaluatorThresholds;
import com.adlens.model.Impact;
import com.adlens.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VerdictPolicyTest {

    private final VerdictPolicy policy = new VerdictPolicy(EvaluatorThresholds.defaults());

    @Test
    void decide_strongEvidenceNeedsEffectAndSampleCount() {
        assertEquals(ValidationStatus.VALIDATED, policy.decide(0.001, -5.0, -0.6, 30));
        // same statistics with too few samples only clear the weaker significance rule
        assertEquals(ValidationStatus.INCONCLUSIVE, policy.decide(0.001, -5.0, -0.6, 29));
    }

    @Test
    void decide_thresholdEvidenceNeedsMagnitude() {
        assertEquals(ValidationStatus.VALIDATED, policy.decide(0.04, -20.0, 0.0, 12));
        assertEquals(ValidationStatus.INCONCLUSIVE, policy.decide(0.04, -19.9, 0.0, 12));
    }

    @Test
    void decide_refutedWhenNotSignificant() {
        assertEquals(ValidationStatus.REFUTED, policy.decide(0.05, -80.0, -2.0, 100));
        assertEquals(ValidationStatus.REFUTED, policy.decide(1.0, 0.0, 0.0, 40));
    }

    @Test
    void decide_honoursConfiguredThresholds() {
        VerdictPolicy strict = new VerdictPolicy(EvaluatorThresholds.builder()
                .pValueThreshold(0.01).ctrDropPctThreshold(50.0).build());
        assertEquals(ValidationStatus.REFUTED, strict.decide(0.02, -60.0, 0.0, 12));
        assertEquals(ValidationStatus.INCONCLUSIVE, strict.decide(0.005, -40.0, 0.0, 12));
    }

    @Test
    void calibrate_appliesAdjustments() {
        assertEquals(0.95, policy.calibrate(0.5, 0.001, 0.9, 40), 1e-12);
        assertEquals(0.72, policy.calibrate(0.5, 0.03, 0.6, 40), 1e-12);
        assertEquals(0.23, policy.calibrate(0.5, 0.2, 0.0, 10), 1e-12);
    }

    @Test
    void calibrate_clipsToUnitInterval() {
        assertEquals(1.0, policy.calibrate(1.0, 0.0, -10.0, 1000));
        assertEquals(0.0, policy.calibrate(0.0, 0.9, 0.0, 3));
    }

    @Test
    void impact_tiers() {
        assertEquals(Impact.HIGH, VerdictPolicy.impact(-30.0, -0.6, 0.01));
        assertEquals(Impact.MEDIUM, VerdictPolicy.impact(-30.0, -0.6, 0.2));
        assertEquals(Impact.MEDIUM, VerdictPolicy.impact(-11.0, 0.31, 0.9));
        assertEquals(Impact.LOW, VerdictPolicy.impact(-60.0, 0.0, 0.0));
        assertEquals(Impact.MEDIUM, VerdictPolicy.impact(null, 0.0, 1.0));
    }
}
