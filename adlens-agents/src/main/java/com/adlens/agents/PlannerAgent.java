package com.adlens.agents;

import com.adlens.model.AnalysisPlan;
import com.adlens.model.DatasetSummary;
import com.adlens.model.Task;
import com.adlens.plugin.ollama.ModelClient;
import com.adlens.plugin.ollama.ModelInvocationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a user question into an {@link AnalysisPlan} by asking the model for a task list.
 * <p>
 * Never fails: when the model is unreachable, the reply holds no JSON, or no usable task can be read from it,
 * the fixed two-task fallback plan is returned (ROAS time series, then a CTR check depending on it).
 * Missing task fields get defaults; a repeated task id is renamed with a numeric suffix.
 */
public final class PlannerAgent {

    private static final Logger log = LoggerFactory.getLogger(PlannerAgent.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String FALLBACK_DESCRIPTION = "Fallback plan due to JSON parse failure.";
    static final String DEFAULT_TASK_NAME = "analysis_task";

    private final ModelClient model;
    private final PromptTemplates templates;
    private final ModelOutputParser parser = new ModelOutputParser();
    private final Clock clock;

    public PlannerAgent(ModelClient model, PromptTemplates templates) {
        this(model, templates, Clock.systemUTC());
    }

    PlannerAgent(ModelClient model, PromptTemplates templates, Clock clock) {
        this.model = Objects.requireNonNull(model, "model");
        this.templates = Objects.requireNonNull(templates, "templates");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AnalysisPlan plan(String query, DatasetSummary summary) {
        String prompt = buildPrompt(query, summary);
        String text;
        try {
            text = model.generate(prompt).text();
        } catch (ModelInvocationException e) {
            log.warn("Planner model call failed; using fallback plan | error={}", e.getMessage());
            return fallbackPlan(query);
        }
        log.debug("Planner raw output | snippet={}", abbreviate(text, 600));

        Optional<JsonNode> parsed = parser.extract(text);
        if (parsed.isEmpty()) {
            log.warn("Planner output had no JSON; using fallback plan");
            return fallbackPlan(query);
        }
        JsonNode root = parsed.get();
        List<Task> tasks = readTasks(root.isArray() ? root : root.path("tasks"));
        if (tasks.isEmpty()) {
            log.warn("Planner output had no usable tasks; using fallback plan");
            return fallbackPlan(query);
        }
        log.info("Planner built tasks | count={}", tasks.size());
        String planQuery = root.isObject() ? JsonFields.text(root, "query", query) : query;
        String description = root.isObject() ? JsonFields.text(root, "plan_description", "") : "";
        return new AnalysisPlan(planQuery, now(), description, tasks);
    }

    String buildPrompt(String query, DatasetSummary summary) {
        StringBuilder sb = new StringBuilder(templates.get(PromptTemplates.PLANNER));
        sb.append("\n\nUSER_QUERY:\n").append(query != null ? query : "").append('\n');
        sb.append("\nDATA_SUMMARY:\n").append(toJson(summary));
        sb.append("\n\nReturn JSON only.");
        return sb.toString();
    }

    private List<Task> readTasks(JsonNode array) {
        List<Task> tasks = new ArrayList<>();
        if (array == null || !array.isArray()) return tasks;
        Set<String> ids = new HashSet<>();
        for (JsonNode node : array) {
            if (node == null || !node.isObject()) {
                log.warn("Planner task skipped: not an object | value={}", node);
                continue;
            }
            try {
                String id = uniqueId(JsonFields.text(node, "id", AgentIds.next("t")), ids);
                tasks.add(new Task(
                        id,
                        JsonFields.text(node, "name", DEFAULT_TASK_NAME),
                        JsonFields.text(node, "type", Task.DEFAULT_TYPE),
                        JsonFields.text(node, "target", Task.DEFAULT_TARGET),
                        JsonFields.text(node, "scope", Task.SCOPE_ALL),
                        JsonFields.integer(node, "priority", Task.DEFAULT_PRIORITY),
                        JsonFields.strings(node, "depends_on")));
            } catch (RuntimeException e) {
                log.warn("Planner task skipped: malformed | error={} | value={}", e.getMessage(), node);
            }
        }
        return tasks;
    }

    private static String uniqueId(String id, Set<String> seen) {
        if (seen.add(id)) return id;
        int n = 2;
        while (!seen.add(id + "_" + n)) n++;
        String renamed = id + "_" + n;
        log.warn("Planner returned duplicate task id; renamed | id={} | renamed={}", id, renamed);
        return renamed;
    }

    AnalysisPlan fallbackPlan(String query) {
        List<Task> tasks = List.of(
                new Task("t1", "roas_time_series", "timeseries", "roas", Task.SCOPE_ALL, 1, List.of()),
                new Task("t2", "ctr_check", "metric_check", "ctr", Task.SCOPE_ALL, 2, List.of("t1")));
        return new AnalysisPlan(query, now(), FALLBACK_DESCRIPTION, tasks);
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String abbreviate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
