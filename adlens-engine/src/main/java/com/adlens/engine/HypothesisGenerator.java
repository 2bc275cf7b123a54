package com.adlens.engine;

import com.adlens.model.Hypothesis;
import com.adlens.model.Task;

import java.util.List;

/**
 * Produces hypotheses for one analysis task. "No findings" is an empty list, not an exception; any exception
 * thrown is isolated by the executor and recorded against the task.
 */
public interface HypothesisGenerator {

    List<Hypothesis> generate(Task task) throws Exception;
}
