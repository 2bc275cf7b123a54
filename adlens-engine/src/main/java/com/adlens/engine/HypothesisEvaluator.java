package com.adlens.engine;

import com.adlens.model.Hypothesis;
import com.adlens.model.ValidationResult;

/**
 * Turns a hypothesis into a verdict using series from the provider.
 */
public interface HypothesisEvaluator {

    ValidationResult validate(Hypothesis hypothesis, TimeSeriesProvider seriesProvider);
}
