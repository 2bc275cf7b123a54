package com.adlens.engine.stats;

import java.util.Random;

/**
 * Resampling p-value for small segments. The pooled values are drawn with replacement at full size; the first
 * {@code baseline.length} draws form the resampled baseline, the rest the resampled test segment. The p-value is the
 * share of iterations whose |mean difference| reaches the observed one. A fixed seed keeps results reproducible.
 */
public final class BootstrapTest {

    private final int iterations;
    private final long seed;

    public BootstrapTest(int iterations, long seed) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be >= 1: " + iterations);
        }
        this.iterations = iterations;
        this.seed = seed;
    }

    public double pValue(double[] baseline, double[] test) {
        int na = baseline.length;
        int nb = test.length;
        if (na == 0 || nb == 0) {
            throw new IllegalArgumentException("bootstrap needs non-empty segments: " + na + ", " + nb);
        }
        double[] pooled = new double[na + nb];
        System.arraycopy(baseline, 0, pooled, 0, na);
        System.arraycopy(test, 0, pooled, na, nb);
        double observed = Math.abs(SeriesStats.mean(test) - SeriesStats.mean(baseline));

        Random random = new Random(seed);
        int hits = 0;
        for (int i = 0; i < iterations; i++) {
            double sumBaseline = 0.0;
            double sumTest = 0.0;
            for (int j = 0; j < pooled.length; j++) {
                double draw = pooled[random.nextInt(pooled.length)];
                if (j < na) sumBaseline += draw;
                else sumTest += draw;
            }
            double diff = sumTest / nb - sumBaseline / na;
            if (Math.abs(diff) >= observed) hits++;
        }
        return (double) hits / iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
