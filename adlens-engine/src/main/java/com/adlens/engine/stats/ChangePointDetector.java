package com.adlens.engine.stats;

import com.adlens.model.ChangePoint;

/**
 * Symmetric rolling-window change-point heuristic over a full series. For each index in
 * {@code [window, n - window)} compares the mean of the {@code window} values before it with the mean of the
 * {@code window} values from it onward and keeps the largest absolute relative shift. Indices whose left mean is
 * 0 or undefined are skipped.
 */
public final class ChangePointDetector {

    static final String TOO_SHORT_NOTE = "timeseries too short for change-point heuristic";

    private final int window;
    private final double significanceThreshold;

    /**
     * @param significanceThreshold minimum |relative change| reported as significant; does not affect the search
     */
    public ChangePointDetector(int window, double significanceThreshold) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1: " + window);
        }
        this.window = window;
        this.significanceThreshold = significanceThreshold;
    }

    public ChangePoint detect(double[] values) {
        int n = values.length;
        if (n < 2 * window) {
            return ChangePoint.notFound(TOO_SHORT_NOTE);
        }
        String note = "rolling-window(" + window + ") heuristic";
        double bestRel = 0.0;
        Integer bestIdx = null;
        for (int idx = window; idx < n - window; idx++) {
            double left = windowMean(values, idx - window, idx);
            if (Double.isNaN(left) || left == 0.0) continue;
            double right = windowMean(values, idx, idx + window);
            double rel = (right - left) / left;
            if (Math.abs(rel) > Math.abs(bestRel)) {
                bestRel = rel;
                bestIdx = idx;
            }
        }
        if (bestIdx == null) {
            return ChangePoint.notFound(note);
        }
        return new ChangePoint(bestIdx, bestRel, Math.abs(bestRel) >= significanceThreshold, note);
    }

    private static double windowMean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }

    public int getWindow() {
        return window;
    }
}
