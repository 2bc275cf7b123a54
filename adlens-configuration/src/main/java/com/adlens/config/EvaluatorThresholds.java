package com.adlens.config;

/**
 * Statistical evaluator options.
 * <ul>
 *   <li>{@code pValueThreshold}: significance cutoff (default 0.05)</li>
 *   <li>{@code ctrDropPctThreshold}: |relative change %| needed for threshold-evidence VALIDATED (default 20)</li>
 *   <li>{@code minSamplesForTtest}: both segments need this many points for the Welch t-test, else bootstrap (default 10)</li>
 *   <li>{@code bootstrapIters}: bootstrap resample count (default 2000)</li>
 *   <li>{@code rollingWindowDays}: change-point window (default 7)</li>
 *   <li>{@code changePointRelativeThreshold}: reporting cutoff for change-points only (default 0.15)</li>
 *   <li>{@code bootstrapSeed}: fixed seed so bootstrap p-values are reproducible (default 42)</li>
 * </ul>
 */
public final class EvaluatorThresholds {

    public static final double DEFAULT_P_VALUE_THRESHOLD = 0.05;
    public static final double DEFAULT_CTR_DROP_PCT_THRESHOLD = 20.0;
    public static final int DEFAULT_MIN_SAMPLES_FOR_TTEST = 10;
    public static final int DEFAULT_BOOTSTRAP_ITERS = 2000;
    public static final int DEFAULT_ROLLING_WINDOW_DAYS = 7;
    public static final double DEFAULT_CHANGE_POINT_RELATIVE_THRESHOLD = 0.15;
    public static final long DEFAULT_BOOTSTRAP_SEED = 42L;

    private static final EvaluatorThresholds DEFAULTS = builder().build();

    private final double pValueThreshold;
    private final double ctrDropPctThreshold;
    private final int minSamplesForTtest;
    private final int bootstrapIters;
    private final int rollingWindowDays;
    private final double changePointRelativeThreshold;
    private final long bootstrapSeed;

    private EvaluatorThresholds(Builder b) {
        if (!(b.pValueThreshold > 0.0 && b.pValueThreshold <= 1.0)) {
            throw new IllegalArgumentException("p_value_threshold must be in (0,1]: " + b.pValueThreshold);
        }
        if (!(b.ctrDropPctThreshold >= 0.0)) {
            throw new IllegalArgumentException("ctr_drop_pct_threshold must be >= 0: " + b.ctrDropPctThreshold);
        }
        if (b.minSamplesForTtest < 2) {
            throw new IllegalArgumentException("min_samples_for_ttest must be >= 2: " + b.minSamplesForTtest);
        }
        if (b.bootstrapIters < 1) {
            throw new IllegalArgumentException("bootstrap_iters must be >= 1: " + b.bootstrapIters);
        }
        if (b.rollingWindowDays < 1) {
            throw new IllegalArgumentException("rolling_window_days must be >= 1: " + b.rollingWindowDays);
        }
        this.pValueThreshold = b.pValueThreshold;
        this.ctrDropPctThreshold = b.ctrDropPctThreshold;
        this.minSamplesForTtest = b.minSamplesForTtest;
        this.bootstrapIters = b.bootstrapIters;
        this.rollingWindowDays = b.rollingWindowDays;
        this.changePointRelativeThreshold = b.changePointRelativeThreshold;
        this.bootstrapSeed = b.bootstrapSeed;
    }

    public static EvaluatorThresholds defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .pValueThreshold(pValueThreshold)
                .ctrDropPctThreshold(ctrDropPctThreshold)
                .minSamplesForTtest(minSamplesForTtest)
                .bootstrapIters(bootstrapIters)
                .rollingWindowDays(rollingWindowDays)
                .changePointRelativeThreshold(changePointRelativeThreshold)
                .bootstrapSeed(bootstrapSeed);
    }

    public double getPValueThreshold() {
        return pValueThreshold;
    }

    public double getCtrDropPctThreshold() {
        return ctrDropPctThreshold;
    }

    public int getMinSamplesForTtest() {
        return minSamplesForTtest;
    }

    public int getBootstrapIters() {
        return bootstrapIters;
    }

    public int getRollingWindowDays() {
        return rollingWindowDays;
    }

    public double getChangePointRelativeThreshold() {
        return changePointRelativeThreshold;
    }

    public long getBootstrapSeed() {
        return bootstrapSeed;
    }

    @Override
    public String toString() {
        return "EvaluatorThresholds{p=" + pValueThreshold + ", ctrDropPct=" + ctrDropPctThreshold
                + ", minTtest=" + minSamplesForTtest + ", bootstrapIters=" + bootstrapIters
                + ", window=" + rollingWindowDays + ", cpThreshold=" + changePointRelativeThreshold
                + ", seed=" + bootstrapSeed + "}";
    }

    public static final class Builder {
        private double pValueThreshold = DEFAULT_P_VALUE_THRESHOLD;
        private double ctrDropPctThreshold = DEFAULT_CTR_DROP_PCT_THRESHOLD;
        private int minSamplesForTtest = DEFAULT_MIN_SAMPLES_FOR_TTEST;
        private int bootstrapIters = DEFAULT_BOOTSTRAP_ITERS;
        private int rollingWindowDays = DEFAULT_ROLLING_WINDOW_DAYS;
        private double changePointRelativeThreshold = DEFAULT_CHANGE_POINT_RELATIVE_THRESHOLD;
        private long bootstrapSeed = DEFAULT_BOOTSTRAP_SEED;

        public Builder pValueThreshold(double pValueThreshold) {
            this.pValueThreshold = pValueThreshold;
            return this;
        }

        public Builder ctrDropPctThreshold(double ctrDropPctThreshold) {
            this.ctrDropPctThreshold = ctrDropPctThreshold;
            return this;
        }

        public Builder minSamplesForTtest(int minSamplesForTtest) {
            this.minSamplesForTtest = minSamplesForTtest;
            return this;
        }

        public Builder bootstrapIters(int bootstrapIters) {
            this.bootstrapIters = bootstrapIters;
            return this;
        }

        public Builder rollingWindowDays(int rollingWindowDays) {
            this.rollingWindowDays = rollingWindowDays;
            return this;
        }

        public Builder changePointRelativeThreshold(double changePointRelativeThreshold) {
            this.changePointRelativeThreshold = changePointRelativeThreshold;
            return this;
        }

        public Builder bootstrapSeed(long bootstrapSeed) {
            this.bootstrapSeed = bootstrapSeed;
            return this;
        }

        public EvaluatorThresholds build() {
            return new EvaluatorThresholds(this);
        }
    }
}
