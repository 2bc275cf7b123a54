package com.adlens.engine.stats;

import com.adlens.config.EvaluatorThresholds;
import com.adlens.engine.SeriesFailure;
import com.adlens.engine.SeriesResult;
import com.adlens.engine.TimeSeriesProvider;
import com.adlens.ledger.RecordingDiagnostics;
import com.adlens.model.Hypothesis;
import com.adlens.model.Impact;
import com.adlens.model.Task;
import com.adlens.model.ValidationResult;
import com.adlens.model.ValidationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatisticalEvaluatorTest {

    private static final Hypothesis FATIGUE = new Hypothesis("h1", "CTR fell as creatives aged",
            Hypothesis.DRIVER_CREATIVE_FATIGUE, 0.5, List.of("ctr down"), List.of("ctr"));

    private RecordingDiagnostics diagnostics;
    private StatisticalEvaluator evaluator;

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnostics();
        evaluator = new StatisticalEvaluator(EvaluatorThresholds.defaults(), diagnostics);
    }

    @Test
    void validate_clearDropIsValidatedWithTTest() {
        double[] series = concat(constant(28, 0.10), constant(12, 0.04));

        ValidationResult result = evaluator.validate(FATIGUE, provider(series));

        assertEquals(ValidationStatus.VALIDATED, result.status());
        assertEquals("t-test", result.validation().method());
        assertEquals("ctr", result.validation().metric());
        assertTrue(result.validation().pValue() < 0.01);
        assertEquals(-60.0, result.validation().relativeChangePct(), 1e-9);
        // constant segments have zero pooled deviation
        assertEquals(0.0, result.validation().effectSize());
        assertEquals(28, result.validation().nBaseline());
        assertEquals(12, result.validation().nTest());
        assertEquals(0.75, result.confidenceFinal(), 1e-12);
        assertEquals(28, result.validation().changePoint().index());
        assertTrue(result.validation().changePoint().significant());
        assertEquals("Evaluated driver=creative_fatigue using t-test", result.notes());
        assertEquals("h1", result.hypothesisId());
        assertEquals(Hypothesis.DRIVER_CREATIVE_FATIGUE, result.driver());
    }

    @Test
    void compare_clearDropHasLargeNegativeEffect() {
        SegmentComparison cmp = evaluator.compare(jitter(20, 0.10), jitter(20, 0.04));

        assertEquals(SegmentComparison.T_TEST, cmp.method());
        assertTrue(cmp.pValue() < 1e-6, "p=" + cmp.pValue());
        assertTrue(cmp.effectSize() < -5.0, "d=" + cmp.effectSize());
        assertEquals(-60.0, cmp.relativeChangePct(), 1e-6);
        assertEquals(40, cmp.nTotal());
    }

    @Test
    void validate_jitteredDropIsStrongEvidenceWithHighImpact() {
        ValidationResult result = evaluator.validate(FATIGUE, provider(concat(jitter(28, 0.10), jitter(12, 0.04))));

        assertEquals(ValidationStatus.VALIDATED, result.status());
        assertEquals(Impact.HIGH, result.impact());
        assertEquals(0.95, result.confidenceFinal(), 1e-12);
        assertNotNull(result.evidence().ctrDeltaPct());
    }

    @Test
    void validate_flatSeriesIsRefuted() {
        ValidationResult result = evaluator.validate(FATIGUE, provider(constant(40, 0.10)));

        assertEquals(ValidationStatus.REFUTED, result.status());
        assertEquals(1.0, result.validation().pValue());
        assertEquals(0.0, result.validation().effectSize());
        assertEquals(0.0, result.validation().relativeChangePct());
        assertEquals(0.38, result.confidenceFinal(), 1e-12);
        assertFalse(result.validation().changePoint().found());
    }

    @Test
    void validate_singlePointIsInconclusive() {
        ValidationResult result = evaluator.validate(FATIGUE, provider(new double[]{0.1}));

        assertEquals(ValidationStatus.INCONCLUSIVE, result.status());
        assertEquals(0.2, result.confidenceFinal());
        assertEquals("too few samples", result.validation().error());
        assertTrue(result.evidence().isEmpty());
        assertEquals("Insufficient data for evaluation (driver=creative_fatigue)", result.notes());
        assertEquals(1, diagnostics.warnings().size());
    }

    @Test
    void validate_providerFailureIsInconclusive() {
        TimeSeriesProvider missing = (scope, metric) -> SeriesResult.failure(SeriesFailure.METRIC_NOT_FOUND, metric);

        ValidationResult result = evaluator.validate(FATIGUE, missing);

        assertEquals(ValidationStatus.INCONCLUSIVE, result.status());
        assertEquals(0.2, result.confidenceFinal());
        assertEquals("metric_missing: ctr", result.validation().error());
    }

    @Test
    void validate_throwingProviderIsInconclusive() {
        TimeSeriesProvider broken = (scope, metric) -> {
            throw new IllegalStateException("disk gone");
        };

        ValidationResult result = evaluator.validate(FATIGUE, broken);

        assertEquals(ValidationStatus.INCONCLUSIVE, result.status());
        assertEquals(0.2, result.confidenceFinal());
        assertEquals("error_preparing_series: disk gone", result.validation().error());
    }

    @Test
    void validate_overflowingStatisticsDegradeToComputationFailure() {
        double[] series = {1e308, -1e308, 1e308, -1e308};

        ValidationResult result = evaluator.validate(FATIGUE, provider(series));

        assertEquals(ValidationStatus.INCONCLUSIVE, result.status());
        assertEquals(0.1, result.confidenceFinal());
        assertTrue(result.validation().hasError());
        assertEquals("h1", result.hypothesisId());
        assertEquals(Hypothesis.DRIVER_CREATIVE_FATIGUE, result.driver());
        assertEquals(1, diagnostics.errors().size());
    }

    @Test
    void validate_smallSegmentsUseBootstrap() {
        double[] series = {0.10, 0.11, 0.09, 0.10, 0.12, 0.10, 0.11, 0.05, 0.04, 0.05};

        ValidationResult first = evaluator.validate(FATIGUE, provider(series));
        ValidationResult second = evaluator.validate(FATIGUE, provider(series));

        assertEquals("bootstrap", first.validation().method());
        assertEquals(7, first.validation().nBaseline());
        assertEquals(3, first.validation().nTest());
        assertEquals(first, second);
        assertNull(first.validation().changePoint().index());
    }

    @Test
    void validate_ignoresNonFiniteValues() {
        double[] series = concat(constant(28, 0.10), new double[]{Double.NaN}, constant(12, 0.04));

        ValidationResult result = evaluator.validate(FATIGUE, provider(series));

        assertEquals(40, result.validation().nBaseline() + result.validation().nTest());
        assertEquals(ValidationStatus.VALIDATED, result.status());
    }

    @Test
    void validate_requestsCtrForWholeDataset() {
        List<String> requests = new ArrayList<>();
        evaluator.validate(FATIGUE, (scope, metric) -> {
            requests.add(scope + "/" + metric);
            return SeriesResult.of(constant(3, 0.1));
        });

        assertEquals(List.of(Task.SCOPE_ALL + "/ctr"), requests);
    }

    @Test
    void validate_zeroBaselineLeavesEvidenceDeltaUndefined() {
        ValidationResult result = evaluator.validate(FATIGUE, provider(concat(constant(7, 0.0), constant(3, 0.02))));

        assertNull(result.evidence().ctrDeltaPct());
        assertEquals(Impact.MEDIUM, result.impact());
        assertTrue(result.validation().relativeChangePct() > 1e6);
    }

    @Test
    void validate_confidenceStaysInUnitInterval() {
        Random random = new Random(3);
        for (int round = 0; round < 60; round++) {
            int n = 2 + random.nextInt(45);
            double[] series = new double[n];
            double scale = Math.pow(10, random.nextInt(6) - 3);
            for (int i = 0; i < n; i++) series[i] = random.nextDouble() * scale * (i > n * 0.7 ? 0.1 : 1.0);
            Hypothesis h = new Hypothesis("h" + round, "random", "other", random.nextDouble(), null, null);

            ValidationResult result = evaluator.validate(h, provider(series));

            assertTrue(result.confidenceFinal() >= 0.0 && result.confidenceFinal() <= 1.0);
            if (result.validation().effectSize() != null) {
                assertFalse(Double.isNaN(result.validation().effectSize()));
            }
        }
    }

    private static TimeSeriesProvider provider(double[] values) {
        return (scope, metric) -> SeriesResult.of(values);
    }

    private static double[] constant(int n, double value) {
        double[] out = new double[n];
        Arrays.fill(out, value);
        return out;
    }

    private static double[] jitter(int n, double center) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = center + (i % 2 == 0 ? 0.002 : -0.002);
        return out;
    }

    private static double[] concat(double[]... parts) {
        int size = 0;
        for (double[] p : parts) size += p.length;
        double[] out = new double[size];
        int pos = 0;
        for (double[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }
}
