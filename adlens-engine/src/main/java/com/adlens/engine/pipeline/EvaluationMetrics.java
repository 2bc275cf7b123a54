package com.adlens.engine.pipeline;

import com.adlens.model.ValidationResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for a pipeline run. Recording never affects results.
 */
public final class EvaluationMetrics {

    static final String VALIDATIONS = "adlens.hypothesis.validations";
    static final String ERRORS = "adlens.pipeline.errors";
    static final String EVALUATION_TIMER = "adlens.hypothesis.evaluation";

    private final MeterRegistry registry;

    public EvaluationMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics backed by a fresh in-memory registry. */
    public static EvaluationMetrics simple() {
        return new EvaluationMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void validation(ValidationResult result) {
        registry.counter(VALIDATIONS,
                "status", result.status().name(),
                "driver", nullToUnknown(result.driver())
        ).increment();
    }

    public void error(String stage) {
        registry.counter(ERRORS, "stage", nullToUnknown(stage)).increment();
    }

    public void evaluationTime(long durationNanos) {
        Timer.builder(EVALUATION_TIMER)
                .description("Hypothesis evaluation time")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
