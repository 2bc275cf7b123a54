package com.adlens.agents;

import com.adlens.engine.HypothesisGenerator;
import com.adlens.model.DatasetSummary;
import com.adlens.model.Hypothesis;
import com.adlens.model.Task;
import com.adlens.plugin.ollama.ModelClient;
import com.adlens.plugin.ollama.ModelInvocationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Asks the model for hypotheses explaining a task's metric movement.
 * <p>
 * Malformed entries are skipped. When nothing usable comes back, a single creative-fatigue hypothesis is returned
 * so the task is still evaluated. Model failures are thrown to the caller.
 */
public final class InsightAgent implements HypothesisGenerator {

    private static final Logger log = LoggerFactory.getLogger(InsightAgent.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double FALLBACK_CONFIDENCE = 0.55;
    static final String NO_TEXT = "No hypothesis provided";

    private final ModelClient model;
    private final PromptTemplates templates;
    private final DatasetSummary summary;
    private final ModelOutputParser parser = new ModelOutputParser();

    public InsightAgent(ModelClient model, PromptTemplates templates, DatasetSummary summary) {
        this.model = Objects.requireNonNull(model, "model");
        this.templates = Objects.requireNonNull(templates, "templates");
        this.summary = summary;
    }

    @Override
    public List<Hypothesis> generate(Task task) throws ModelInvocationException {
        log.info("Generating hypotheses | taskId={}", task.id());
        String text = model.generate(buildPrompt(task)).text();

        List<Hypothesis> hypotheses = new ArrayList<>();
        Optional<JsonNode> parsed = parser.extract(text);
        if (parsed.isPresent()) {
            for (JsonNode node : elements(parsed.get())) {
                Hypothesis h = toHypothesis(node);
                if (h != null) hypotheses.add(h);
            }
        }
        if (hypotheses.isEmpty()) {
            log.warn("No hypotheses parsed; using fallback | taskId={}", task.id());
            hypotheses.add(fallback());
        }
        log.info("Hypotheses produced | taskId={} | count={}", task.id(), hypotheses.size());
        return hypotheses;
    }

    String buildPrompt(Task task) {
        return templates.get(PromptTemplates.INSIGHT)
                + "\n\nTASK:\n" + toJson(task)
                + "\n\nDATA_SUMMARY:\n" + toJson(summary)
                + "\n\nReturn ONLY a JSON array of hypotheses.";
    }

    /** Accepts a bare array, {@code {"hypotheses": [...]}} or a single hypothesis object. */
    private static List<JsonNode> elements(JsonNode root) {
        List<JsonNode> out = new ArrayList<>();
        JsonNode array = root.isObject() && root.path("hypotheses").isArray() ? root.get("hypotheses") : root;
        if (array.isArray()) {
            array.forEach(out::add);
        } else if (array.isObject()) {
            out.add(array);
        }
        return out;
    }

    private static Hypothesis toHypothesis(JsonNode node) {
        if (node == null || !node.isObject()) {
            log.warn("Malformed hypothesis skipped: not an object | value={}", node);
            return null;
        }
        try {
            double confidence = JsonFields.number(node, "initial_confidence", DEFAULT_CONFIDENCE);
            if (Double.isNaN(confidence)) confidence = DEFAULT_CONFIDENCE;
            confidence = Math.max(0.0, Math.min(1.0, confidence));
            return new Hypothesis(
                    JsonFields.text(node, "id", AgentIds.next("hyp")),
                    JsonFields.text(node, "hypothesis", NO_TEXT),
                    JsonFields.text(node, "driver", Hypothesis.DRIVER_OTHER),
                    confidence,
                    JsonFields.strings(node, "supporting_data_points"),
                    JsonFields.strings(node, "required_checks"));
        } catch (RuntimeException e) {
            log.warn("Malformed hypothesis skipped | error={} | value={}", e.getMessage(), node);
            return null;
        }
    }

    static Hypothesis fallback() {
        return new Hypothesis(
                AgentIds.next("hyp"),
                "Possible CTR decline in top campaigns indicating creative fatigue.",
                Hypothesis.DRIVER_CREATIVE_FATIGUE,
                FALLBACK_CONFIDENCE,
                List.of("Fallback due to malformed JSON"),
                List.of("ctr_time_series", "creative_impressions_split"));
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
