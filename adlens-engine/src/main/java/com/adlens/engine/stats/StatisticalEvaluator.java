package com.adlens.engine.stats;

import com.adlens.config.EvaluatorThresholds;
import com.adlens.engine.HypothesisEvaluator;
import com.adlens.engine.SeriesFailure;
import com.adlens.engine.SeriesResult;
import com.adlens.engine.TimeSeriesProvider;
import com.adlens.ledger.Diagnostics;
import com.adlens.model.ChangePoint;
import com.adlens.model.Evidence;
import com.adlens.model.Hypothesis;
import com.adlens.model.Impact;
import com.adlens.model.Task;
import com.adlens.model.Validation;
import com.adlens.model.ValidationResult;
import com.adlens.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Validates a hypothesis against the click-through-rate series of the whole dataset.
 * <p>
 * The series is split chronologically into a baseline (first 70%, at least one point) and a test segment. Segments
 * with at least {@code min_samples_for_ttest} points each are compared with a Welch t-test, smaller ones with a
 * seeded bootstrap. Effect size, relative change and a full-series change-point feed {@link VerdictPolicy}.
 * <p>
 * Never throws for data problems: missing or too-short series yield INCONCLUSIVE at confidence 0.2, failures during
 * computation yield INCONCLUSIVE at confidence 0.1 with the error text in {@code validation.error}.
 * Stateless between calls.
 */
public final class StatisticalEvaluator implements HypothesisEvaluator {

    private static final Logger log = LoggerFactory.getLogger(StatisticalEvaluator.class);
    private static final String SOURCE = StatisticalEvaluator.class.getName();

    public static final String METRIC = "ctr";
    static final double BASELINE_FRACTION = 0.7;
    static final double EPSILON = 1e-9;
    static final double INSUFFICIENT_DATA_CONFIDENCE = 0.2;
    static final double COMPUTATION_FAILURE_CONFIDENCE = 0.1;

    private final EvaluatorThresholds thresholds;
    private final Diagnostics diagnostics;
    private final BootstrapTest bootstrap;
    private final ChangePointDetector changePoints;
    private final VerdictPolicy policy;

    public StatisticalEvaluator(EvaluatorThresholds thresholds, Diagnostics diagnostics) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.bootstrap = new BootstrapTest(thresholds.getBootstrapIters(), thresholds.getBootstrapSeed());
        this.changePoints = new ChangePointDetector(thresholds.getRollingWindowDays(),
                thresholds.getChangePointRelativeThreshold());
        this.policy = new VerdictPolicy(thresholds);
    }

    @Override
    public ValidationResult validate(Hypothesis hypothesis, TimeSeriesProvider provider) {
        Objects.requireNonNull(hypothesis, "hypothesis");
        String id = hypothesis.id();
        String driver = hypothesis.driver();

        SeriesResult series = fetch(provider);
        double[] values = SeriesStats.finite(series.values());
        if (!series.isSuccess() || values.length < 2) {
            String reason = series.isSuccess() ? "too few samples" : series.describeFailure();
            diagnostics.warn(SOURCE, "Insufficient CTR data for " + id + ": " + reason);
            return ValidationResult.inconclusive(id, driver, reason, INSUFFICIENT_DATA_CONFIDENCE,
                    "Insufficient data for evaluation (driver=" + driver + ")");
        }

        try {
            return evaluate(hypothesis, values);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            diagnostics.error(SOURCE, "Exception during evaluation of " + id + ": " + message, e);
            return ValidationResult.inconclusive(id, driver, message, COMPUTATION_FAILURE_CONFIDENCE,
                    "Exception during evaluation: " + message);
        }
    }

    /**
     * Compares a baseline segment with a test segment. Picks the t-test when both reach
     * {@code min_samples_for_ttest}, the bootstrap otherwise.
     *
     * @throws ArithmeticException if any statistic comes out non-finite
     */
    public SegmentComparison compare(double[] baseline, double[] test) {
        int minSamples = thresholds.getMinSamplesForTtest();
        boolean tTest = baseline.length >= minSamples && test.length >= minSamples;
        double pValue = tTest ? WelchTTest.pValue(baseline, test) : bootstrap.pValue(baseline, test);
        double baselineMean = SeriesStats.mean(baseline);
        double testMean = SeriesStats.mean(test);
        double relativeChangePct = (testMean - baselineMean) / Math.max(EPSILON, baselineMean) * 100.0;
        double effectSize = SeriesStats.cohenD(baseline, test);

        requireFinite("p_value", pValue);
        requireFinite("baseline_mean", baselineMean);
        requireFinite("test_mean", testMean);
        requireFinite("relative_change_pct", relativeChangePct);
        requireFinite("effect_size", effectSize);
        return new SegmentComparison(tTest ? SegmentComparison.T_TEST : SegmentComparison.BOOTSTRAP,
                baselineMean, testMean, relativeChangePct, pValue, effectSize, baseline.length, test.length);
    }

    private ValidationResult evaluate(Hypothesis hypothesis, double[] values) {
        int split = Math.max(1, (int) (values.length * BASELINE_FRACTION));
        double[] baseline = Arrays.copyOfRange(values, 0, split);
        double[] test = Arrays.copyOfRange(values, split, values.length);

        SegmentComparison cmp = compare(baseline, test);
        ChangePoint changePoint = changePoints.detect(values);
        log.debug("Evaluator stats | hypothesis={} | p={} | rel={} | d={} | baseline={} | test={} | changePoint={}",
                hypothesis.id(), cmp.pValue(), cmp.relativeChangePct(), cmp.effectSize(),
                cmp.baselineMean(), cmp.testMean(), changePoint.index());

        ValidationStatus status = policy.decide(cmp.pValue(), cmp.relativeChangePct(), cmp.effectSize(), cmp.nTotal());
        double confidence = policy.calibrate(hypothesis.initialConfidence(), cmp.pValue(), cmp.effectSize(),
                cmp.nTotal());

        Validation validation = new Validation(METRIC, cmp.method(), cmp.baselineMean(), cmp.testMean(),
                cmp.relativeChangePct(), cmp.pValue(), cmp.effectSize(), cmp.nBaseline(), cmp.nTest(), changePoint, null);
        Double deltaPct = cmp.deltaPctOrNull();
        Evidence evidence = new Evidence(cmp.baselineMean(), cmp.testMean(), deltaPct, cmp.effectSize(),
                cmp.pValue(), cmp.nBaseline(), cmp.nTest(), changePoint);
        Impact impact = VerdictPolicy.impact(deltaPct, cmp.effectSize(), cmp.pValue());

        diagnostics.info(SOURCE, "Hypothesis " + hypothesis.id() + " -> " + status + " | confidence="
                + String.format(Locale.ROOT, "%.2f", confidence) + " | impact=" + impact.wireName());
        return new ValidationResult(hypothesis.id(), hypothesis.driver(), validation, evidence, impact, confidence,
                status, "Evaluated driver=" + hypothesis.driver() + " using " + cmp.method());
    }

    private SeriesResult fetch(TimeSeriesProvider provider) {
        if (provider == null) {
            return SeriesResult.failure(SeriesFailure.MISSING, "no time series provider");
        }
        try {
            SeriesResult result = provider.getSeries(Task.SCOPE_ALL, METRIC);
            return result != null ? result : SeriesResult.failure(SeriesFailure.MISSING, "provider returned no series");
        } catch (RuntimeException e) {
            return SeriesResult.failure(SeriesFailure.ERROR, e.getMessage());
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new ArithmeticException(name + " is not finite: " + value);
        }
    }
}
