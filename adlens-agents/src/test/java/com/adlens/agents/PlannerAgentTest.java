package com.adlens.agents;

import com.adlens.model.AnalysisPlan;
import com.adlens.model.DatasetSummary;
import com.adlens.model.Task;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlannerAgentTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:30:00Z"), ZoneOffset.UTC);
    private static final PromptTemplates TEMPLATES = PromptTemplates.of(Map.of(PromptTemplates.PLANNER, "PLAN IT"));
    private static final DatasetSummary SUMMARY =
            new DatasetSummary(120, "2024-01-01", "2024-03-31", 4, Map.of("Men Summer Sale", 900.0));

    @Test
    void plan_readsTasksAndAppliesDefaults() {
        String reply = "{\"query\":\"why roas down\",\"plan_description\":\"check ctr\",\"tasks\":["
                + "{\"id\":\"t1\",\"name\":\"roas trend\",\"type\":\"timeseries\",\"target\":\"roas\",\"priority\":1},"
                + "{\"id\":\"t2\",\"target\":\"ctr\",\"priority\":\"2\",\"depends_on\":[\"t1\"]},"
                + "{\"name\":\"no id\"}]}";
        PlannerAgent agent = new PlannerAgent(ScriptedModelClient.replying(reply), TEMPLATES, CLOCK);

        AnalysisPlan plan = agent.plan("why roas down", SUMMARY);

        assertEquals("check ctr", plan.planDescription());
        assertEquals("2024-05-01T08:30:00Z", plan.generatedAt());
        assertEquals(3, plan.tasks().size());
        Task t2 = plan.tasks().get(1);
        assertEquals("t2", t2.id());
        assertEquals(2, t2.priority());
        assertEquals(List.of("t1"), t2.dependsOn());
        assertEquals(Task.SCOPE_ALL, t2.scope());
        Task generated = plan.tasks().get(2);
        assertTrue(generated.id().startsWith("t_"), generated.id());
        assertEquals(Task.DEFAULT_PRIORITY, generated.priority());
        assertEquals(Task.DEFAULT_TARGET, generated.target());
    }

    @Test
    void plan_acceptsBareArrayInFence() {
        String reply = "```json\n[{\"id\":\"a\",\"priority\":3}]\n```";
        AnalysisPlan plan = new PlannerAgent(ScriptedModelClient.replying(reply), TEMPLATES, CLOCK)
                .plan("q", SUMMARY);

        assertEquals("q", plan.query());
        assertEquals(1, plan.tasks().size());
        assertEquals(PlannerAgent.DEFAULT_TASK_NAME, plan.tasks().get(0).name());
    }

    @Test
    void plan_renamesDuplicateIds() {
        String reply = "[{\"id\":\"t1\"},{\"id\":\"t1\"},{\"id\":\"t1\"}]";
        AnalysisPlan plan = new PlannerAgent(ScriptedModelClient.replying(reply), TEMPLATES, CLOCK)
                .plan("q", SUMMARY);

        assertEquals(List.of("t1", "t1_2", "t1_3"),
                plan.tasks().stream().map(Task::id).collect(Collectors.toList()));
    }

    @Test
    void plan_skipsMalformedTasks() {
        String reply = "[{\"id\":\"bad\",\"priority\":\"soon\"}, 7, {\"id\":\"good\"}]";
        AnalysisPlan plan = new PlannerAgent(ScriptedModelClient.replying(reply), TEMPLATES, CLOCK)
                .plan("q", SUMMARY);

        assertEquals(1, plan.tasks().size());
        assertEquals("good", plan.tasks().get(0).id());
    }

    @Test
    void plan_fallsBackOnUnparsableOutput() {
        AnalysisPlan plan = new PlannerAgent(ScriptedModelClient.replying("no idea, sorry"), TEMPLATES, CLOCK)
                .plan("q", SUMMARY);
        assertFallback(plan);
    }

    @Test
    void plan_fallsBackWhenNoTasks() {
        AnalysisPlan plan = new PlannerAgent(ScriptedModelClient.replying("{\"tasks\": []}"), TEMPLATES, CLOCK)
                .plan("q", SUMMARY);
        assertFallback(plan);
    }

    @Test
    void plan_fallsBackWhenModelFails() {
        AnalysisPlan plan = new PlannerAgent(ScriptedModelClient.failing(), TEMPLATES, CLOCK).plan("q", SUMMARY);
        assertFallback(plan);
    }

    @Test
    void buildPrompt_includesQueryAndSummary() {
        ScriptedModelClient model = ScriptedModelClient.replying("[{\"id\":\"t1\"}]");
        new PlannerAgent(model, TEMPLATES, CLOCK).plan("why did roas drop?", SUMMARY);

        String prompt = model.prompts().get(0);
        assertTrue(prompt.startsWith("PLAN IT"));
        assertTrue(prompt.contains("why did roas drop?"));
        assertTrue(prompt.contains("\"n_rows\" : 120"));
        assertTrue(prompt.contains("Men Summer Sale"));
    }

    private static void assertFallback(AnalysisPlan plan) {
        assertEquals(PlannerAgent.FALLBACK_DESCRIPTION, plan.planDescription());
        assertEquals(2, plan.tasks().size());
        Task first = plan.tasks().get(0);
        Task second = plan.tasks().get(1);
        assertEquals("t1", first.id());
        assertEquals("roas_time_series", first.name());
        assertEquals("timeseries", first.type());
        assertEquals(1, first.priority());
        assertEquals("t2", second.id());
        assertEquals("ctr", second.target());
        assertEquals(List.of("t1"), second.dependsOn());
    }
}
