package com.adlens.app;

import com.adlens.config.AnalystConfig;
import com.adlens.plugin.ollama.ModelClient;
import com.adlens.plugin.ollama.ModelInvocationException;
import com.adlens.plugin.ollama.ModelResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalystApplicationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final String RUN_ID = "20250301T120000Z";

    private static final String PLAN = "{\"plan_description\":\"ctr drill-down\",\"tasks\":["
            + "{\"id\":\"t1\",\"name\":\"ctr_check\",\"target\":\"ctr\",\"scope\":\"Men Summer Sale\",\"priority\":1}]}";
    private static final String HYPOTHESES = "[{\"id\":\"h1\",\"hypothesis\":\"CTR fell as creatives aged\","
            + "\"driver\":\"creative_fatigue\",\"initial_confidence\":0.6}]";
    private static final String CREATIVES = "[" + creative(1) + "," + creative(2) + "," + creative(3) + ","
            + creative(4) + "]";

    @TempDir
    Path dir;

    private Path dataset;
    private ByteArrayOutputStream stdout;

    @BeforeEach
    void setUp() throws Exception {
        dataset = dir.resolve("campaigns.csv");
        StringBuilder csv = new StringBuilder(
                "campaign_name,adset_name,date,spend,impressions,clicks,ctr,roas,creative_type,creative_message\n");
        LocalDate day = LocalDate.of(2025, 1, 1);
        for (int i = 0; i < 40; i++) {
            double ctr = i < 28 ? 0.10 : 0.04;
            csv.append("Men Summer Sale,Adset 1,").append(day.plusDays(i)).append(",100.0,10000,")
                    .append((int) (ctr * 10000)).append(',').append(ctr).append(",3.0,Image,Message ")
                    .append(i % 5).append('\n');
        }
        Files.writeString(dataset, csv.toString());
        stdout = new ByteArrayOutputStream();
    }

    @Test
    void run_writesArtifactsAndCreativesForValidatedFatigue() throws Exception {
        int code = app(config(dataset), routingModel()).run(new String[]{"why", "did", "CTR", "drop?"});

        assertEquals(AnalystApplication.EXIT_OK, code);
        Path out = dir.resolve("reports");
        JsonNode insights = MAPPER.readTree(out.resolve("insights_" + RUN_ID + ".json").toFile());
        assertEquals(1, insights.size());
        assertEquals("VALIDATED", insights.get(0).get("status").asText());
        assertEquals("creative_fatigue", insights.get(0).get("driver").asText());

        JsonNode creatives = MAPPER.readTree(out.resolve("creatives_" + RUN_ID + ".json").toFile());
        assertEquals(4, creatives.size());
        assertEquals("Men Summer Sale", creatives.get(0).get("campaign").asText());

        JsonNode meta = MAPPER.readTree(out.resolve("run_metadata_" + RUN_ID + ".json").toFile());
        assertEquals("why did CTR drop?", meta.get("query").asText());
        assertEquals(0, meta.get("errors").size());
        assertEquals("t1", meta.get("tasks_executed").get(0).get("task_id").asText());

        String report = Files.readString(out.resolve("report_" + RUN_ID + ".md"));
        assertTrue(report.contains("- Validated insights: **1**"));
        assertTrue(Files.exists(dir.resolve("logs").resolve("run_ledger_" + RUN_ID + ".json")));
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("report:"));
    }

    @Test
    void run_modelDownStillWritesReportWithIsolatedErrors() throws Exception {
        ModelClient down = prompt -> {
            throw new ModelInvocationException("connection refused", 3, null);
        };

        int code = app(config(dataset), down).run(new String[]{"q"});

        assertEquals(AnalystApplication.EXIT_OK, code);
        JsonNode meta = MAPPER.readTree(dir.resolve("reports").resolve("run_metadata_" + RUN_ID + ".json").toFile());
        assertEquals(2, meta.get("tasks_executed").size());
        assertEquals(2, meta.get("errors").size());
        assertEquals("insight", meta.get("errors").get(0).get("stage").asText());
        assertEquals("t1", meta.get("errors").get(0).get("task_id").asText());
    }

    @Test
    void run_ledgerDisabledSkipsLedgerFile() {
        AnalystConfig config = AnalystConfig.builder()
                .dataPath(dataset)
                .outDir(dir.resolve("reports"))
                .logsDir(dir.resolve("logs"))
                .ledgerEnabled(false)
                .build();

        assertEquals(AnalystApplication.EXIT_OK, app(config, routingModel()).run(new String[]{"q"}));
        assertTrue(Files.notExists(dir.resolve("logs").resolve("run_ledger_" + RUN_ID + ".json")));
        assertTrue(Files.exists(dir.resolve("reports").resolve("report_" + RUN_ID + ".md")));
    }

    @Test
    void run_withoutQueryIsUsageError() {
        assertEquals(AnalystApplication.EXIT_USAGE, app(config(dataset), routingModel()).run(new String[0]));
        assertEquals(AnalystApplication.EXIT_USAGE, app(config(dataset), routingModel()).run(new String[]{"  "}));
    }

    @Test
    void run_missingDatasetExitsWithDatasetError() {
        int code = app(config(dir.resolve("nope.csv")), routingModel()).run(new String[]{"q"});

        assertEquals(AnalystApplication.EXIT_DATASET, code);
        assertTrue(Files.notExists(dir.resolve("reports")));
    }

    private AnalystApplication app(AnalystConfig config, ModelClient model) {
        return new AnalystApplication(config, model, CLOCK, new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private AnalystConfig config(Path data) {
        return AnalystConfig.builder()
                .dataPath(data)
                .outDir(dir.resolve("reports"))
                .logsDir(dir.resolve("logs"))
                .build();
    }

    private static ModelClient routingModel() {
        return prompt -> {
            if (prompt.contains("USER_QUERY:")) return reply(PLAN);
            if (prompt.contains("REQUIRED_VARIATIONS:")) return reply(CREATIVES);
            if (prompt.contains("TASK:")) return reply(HYPOTHESES);
            throw new ModelInvocationException("unexpected prompt", 1, null);
        };
    }

    private static ModelResponse reply(String text) {
        return new ModelResponse(text, 10, 20, "fake");
    }

    private static String creative(int n) {
        return "{\"creative_type\":\"Image\",\"headline\":\"Headline " + n + "\",\"body\":\"Body " + n + "\","
                + "\"cta\":\"Shop Now\",\"rationale\":\"Angle " + n + "\"}";
    }
}
