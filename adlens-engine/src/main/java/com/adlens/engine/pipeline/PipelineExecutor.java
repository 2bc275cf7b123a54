package com.adlens.engine.pipeline;

import com.adlens.engine.CreativeGenerator;
import com.adlens.engine.CreativeSampleSource;
import com.adlens.engine.HypothesisEvaluator;
import com.adlens.engine.HypothesisGenerator;
import com.adlens.engine.TimeSeriesProvider;
import com.adlens.engine.schedule.TaskGraphScheduler;
import com.adlens.ledger.Diagnostics;
import com.adlens.ledger.LedgerError;
import com.adlens.ledger.RunLedger;
import com.adlens.model.CreativeCandidate;
import com.adlens.model.CreativeSample;
import com.adlens.model.Hypothesis;
import com.adlens.model.HypothesisResult;
import com.adlens.model.Task;
import com.adlens.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Top-level control loop: orders tasks, generates hypotheses per task, evaluates each hypothesis and, for
 * VALIDATED hypotheses of the creative-eligible driver, requests replacement creatives.
 * <p>
 * Single-threaded and sequential. Every collaborator failure is isolated to its unit and recorded in the run
 * ledger under its stage; no collaborator failure aborts the run. Results are appended in task order, then
 * hypothesis order within a task.
 */
public final class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);
    private static final String SOURCE = PipelineExecutor.class.getName();

    /** Confidence of the result synthesized when the evaluator itself fails. */
    static final double EVALUATOR_FAILURE_CONFIDENCE = 0.0;

    private final TaskGraphScheduler scheduler;
    private final TimeSeriesProvider seriesProvider;
    private final CreativeSampleSource creativeSamples;
    private final ExecutorSettings settings;
    private final Diagnostics diagnostics;
    private final EvaluationMetrics metrics;

    public PipelineExecutor(TaskGraphScheduler scheduler,
                            TimeSeriesProvider seriesProvider,
                            CreativeSampleSource creativeSamples,
                            ExecutorSettings settings,
                            Diagnostics diagnostics,
                            EvaluationMetrics metrics) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.seriesProvider = Objects.requireNonNull(seriesProvider, "seriesProvider");
        this.creativeSamples = creativeSamples != null ? creativeSamples : limit -> List.of();
        this.settings = Objects.requireNonNull(settings, "settings");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.metrics = metrics != null ? metrics : EvaluationMetrics.simple();
    }

    /**
     * Runs every task once.
     *
     * @param creativeGenerator may be null to skip the creative stage
     * @throws IllegalArgumentException if two tasks share an id
     */
    public PipelineRunResult run(String runId,
                                 Collection<Task> tasks,
                                 HypothesisGenerator generator,
                                 HypothesisEvaluator evaluator,
                                 CreativeGenerator creativeGenerator) {
        Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(evaluator, "evaluator");
        RunLedger ledger = new RunLedger(runId);
        List<Task> ordered = scheduler.order(tasks);
        List<HypothesisResult> results = new ArrayList<>();
        List<CreativeCandidate> creatives = new ArrayList<>();
        log.info("Pipeline run started | runId={} | tasks={}", runId, ordered.size());

        for (Task task : ordered) {
            ledger.taskExecuted(task);
            log.info("Executing task | taskId={} | name={} | scope={}", task.id(), task.name(), task.scope());

            Outcome<List<Hypothesis>> generated = Outcome.of(() -> generator.generate(task));
            if (!generated.isSuccess()) {
                recordFailure(ledger, LedgerError.STAGE_INSIGHT, task.id(), null, generated);
                continue;
            }
            List<Hypothesis> hypotheses = generated.getValue() != null ? generated.getValue() : List.of();
            log.info("Generated hypotheses | taskId={} | count={}", task.id(), hypotheses.size());

            for (Hypothesis hypothesis : hypotheses) {
                if (hypothesis == null) {
                    diagnostics.warn(SOURCE, "Generator returned a null hypothesis for task " + task.id() + "; skipped");
                    continue;
                }
                ValidationResult result = evaluate(ledger, task, hypothesis, evaluator);
                results.add(HypothesisResult.of(task, hypothesis, result));
                metrics.validation(result);

                if (creativeGenerator != null && result.isValidated() && settings.isCreativeEligible(hypothesis.driver())) {
                    creatives.addAll(generateCreatives(ledger, task, hypothesis, creativeGenerator));
                }
            }
        }

        log.info("Pipeline run finished | runId={} | results={} | creatives={} | errors={}",
                runId, results.size(), creatives.size(), ledger.getErrors().size());
        return new PipelineRunResult(ordered, results, creatives, ledger);
    }

    private ValidationResult evaluate(RunLedger ledger, Task task, Hypothesis hypothesis, HypothesisEvaluator evaluator) {
        long start = System.nanoTime();
        Outcome<ValidationResult> evaluated = Outcome.of(() -> evaluator.validate(hypothesis, seriesProvider));
        metrics.evaluationTime(System.nanoTime() - start);
        if (evaluated.isSuccess() && evaluated.getValue() != null) {
            return evaluated.getValue();
        }
        Outcome<ValidationResult> failed = evaluated.isSuccess()
                ? Outcome.failure("evaluator returned no result", null)
                : evaluated;
        recordFailure(ledger, LedgerError.STAGE_EVALUATION, task.id(), hypothesis.id(), failed);
        return ValidationResult.inconclusive(hypothesis.id(), hypothesis.driver(), failed.getReason(),
                EVALUATOR_FAILURE_CONFIDENCE, "Evaluator failure: " + failed.getReason());
    }

    private List<CreativeCandidate> generateCreatives(RunLedger ledger, Task task, Hypothesis hypothesis,
                                                      CreativeGenerator creativeGenerator) {
        String campaign = task.scope() == null || task.scope().isBlank()
                ? settings.getDefaultCreativeScope()
                : task.scope();
        Outcome<List<CreativeCandidate>> generated = Outcome.of(() -> {
            List<CreativeSample> samples = creativeSamples.creativeSample(settings.getSampleSize());
            return creativeGenerator.generateForCampaign(campaign, samples, settings.getVariations());
        });
        if (!generated.isSuccess()) {
            recordFailure(ledger, LedgerError.STAGE_CREATIVE, task.id(), hypothesis.id(), generated);
            return List.of();
        }
        List<CreativeCandidate> creatives = generated.getValue() != null ? generated.getValue() : List.of();
        log.info("Generated creatives | hypothesisId={} | campaign={} | count={}",
                hypothesis.id(), campaign, creatives.size());
        return creatives;
    }

    private void recordFailure(RunLedger ledger, String stage, String taskId, String hypothesisId, Outcome<?> outcome) {
        ledger.error(stage, taskId, hypothesisId, outcome.getReason());
        metrics.error(stage);
        diagnostics.error(SOURCE, "Stage " + stage + " failed | taskId=" + taskId
                + (hypothesisId != null ? " | hypothesisId=" + hypothesisId : "")
                + " | error=" + outcome.getReason(), outcome.getCause());
    }
}
