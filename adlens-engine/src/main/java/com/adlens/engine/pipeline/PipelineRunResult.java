package com.adlens.engine.pipeline;

import com.adlens.ledger.RunLedger;
import com.adlens.model.CreativeCandidate;
import com.adlens.model.HypothesisResult;
import com.adlens.model.Task;
import com.adlens.model.ValidationStatus;

import java.util.List;
import java.util.Objects;

/**
 * Everything one executor run produced: results in task-then-hypothesis order, creatives in invocation order,
 * the scheduled task order and the run ledger.
 */
public final class PipelineRunResult {

    private final List<Task> orderedTasks;
    private final List<HypothesisResult> results;
    private final List<CreativeCandidate> creatives;
    private final RunLedger ledger;

    public PipelineRunResult(List<Task> orderedTasks, List<HypothesisResult> results, List<CreativeCandidate> creatives,
                      RunLedger ledger) {
        this.orderedTasks = List.copyOf(orderedTasks);
        this.results = List.copyOf(results);
        this.creatives = List.copyOf(creatives);
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public List<Task> getOrderedTasks() {
        return orderedTasks;
    }

    public List<HypothesisResult> getResults() {
        return results;
    }

    public List<CreativeCandidate> getCreatives() {
        return creatives;
    }

    public RunLedger getLedger() {
        return ledger;
    }

    public long count(ValidationStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
