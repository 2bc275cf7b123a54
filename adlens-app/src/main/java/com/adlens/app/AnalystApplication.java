package com.adlens.app;

import com.adlens.agents.CreativeAgent;
import com.adlens.agents.InsightAgent;
import com.adlens.agents.PlannerAgent;
import com.adlens.agents.PromptTemplates;
import com.adlens.config.AnalystConfig;
import com.adlens.data.CampaignDataset;
import com.adlens.engine.pipeline.EvaluationMetrics;
import com.adlens.engine.pipeline.ExecutorSettings;
import com.adlens.engine.pipeline.PipelineExecutor;
import com.adlens.engine.pipeline.PipelineRunResult;
import com.adlens.engine.schedule.TaskGraphScheduler;
import com.adlens.engine.stats.StatisticalEvaluator;
import com.adlens.ledger.Diagnostics;
import com.adlens.ledger.JsonFileLedgerStore;
import com.adlens.ledger.LedgerStore;
import com.adlens.ledger.NoOpLedgerStore;
import com.adlens.ledger.Slf4jDiagnostics;
import com.adlens.model.AnalysisPlan;
import com.adlens.model.DatasetSummary;
import com.adlens.model.ValidationStatus;
import com.adlens.plugin.ollama.ModelClient;
import com.adlens.plugin.ollama.OllamaModelClient;
import com.adlens.report.ArtifactWriter;
import com.adlens.report.ReportWriter;
import com.adlens.report.RunArtifacts;
import com.adlens.report.RunIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Command-line entry point: {@code adlens "<query>"}.
 * <p>
 * Loads the dataset, plans, runs the pipeline and writes the artifacts under the output directory. Exit code 2 on
 * a usage error, 1 when the dataset cannot be loaded. Settings come from {@code ADLENS_*} environment variables
 * (see {@link AnalystConfig}).
 */
public final class AnalystApplication {

    private static final Logger log = LoggerFactory.getLogger(AnalystApplication.class);
    private static final String MDC_RUN_ID = "runId";
    private static final Duration MODEL_BACKOFF = Duration.ofSeconds(1);

    static final int EXIT_OK = 0;
    static final int EXIT_DATASET = 1;
    static final int EXIT_USAGE = 2;

    private final AnalystConfig config;
    private final ModelClient modelClient;
    private final Clock clock;
    private final PrintStream out;

    AnalystApplication(AnalystConfig config, ModelClient modelClient, Clock clock, PrintStream out) {
        this.config = Objects.requireNonNull(config, "config");
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        AnalystConfig config = AnalystConfig.fromEnvironment();
        ModelClient model = new OllamaModelClient(config.getModelBaseUrl(), config.getModel(),
                config.getModelRetries(), MODEL_BACKOFF);
        int code = new AnalystApplication(config, model, Clock.systemUTC(), System.out).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    int run(String[] args) {
        String query = args == null ? "" : String.join(" ", args).trim();
        if (query.isEmpty()) {
            System.err.println("Usage: adlens \"<query>\"");
            return EXIT_USAGE;
        }
        String runId = RunIds.of(Instant.now(clock));
        MDC.put(MDC_RUN_ID, runId);
        try {
            return execute(runId, query);
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private int execute(String runId, String query) {
        log.info("Pipeline run starting | runId={} | query={}", runId, query);
        CampaignDataset dataset;
        try {
            dataset = CampaignDataset.load(config.getDataPath());
        } catch (IOException e) {
            log.error("Dataset load failed | path={} | error={}", config.getDataPath(), e.toString());
            System.err.println("Could not load dataset " + config.getDataPath() + ": " + e.getMessage());
            return EXIT_DATASET;
        }
        DatasetSummary summary = dataset.summary();
        log.info("Dataset loaded | rows={} | campaigns={}", summary.rows(), summary.campaignCount());

        PromptTemplates templates = PromptTemplates.fromClasspath();
        AnalysisPlan plan = new PlannerAgent(modelClient, templates).plan(query, summary);

        Diagnostics diagnostics = new Slf4jDiagnostics();
        PipelineExecutor executor = new PipelineExecutor(
                new TaskGraphScheduler(diagnostics),
                dataset,
                dataset,
                ExecutorSettings.from(config),
                diagnostics,
                EvaluationMetrics.simple());
        PipelineRunResult result = executor.run(runId, plan.tasks(),
                new InsightAgent(modelClient, templates, summary),
                new StatisticalEvaluator(config.getThresholds(), diagnostics),
                new CreativeAgent(modelClient, templates));

        LedgerStore ledgerStore = config.isLedgerEnabled()
                ? new JsonFileLedgerStore(config.getLogsDir())
                : new NoOpLedgerStore();
        result.getLedger().persist(ledgerStore);

        RunArtifacts artifacts;
        try {
            artifacts = new ArtifactWriter(config.getOutDir(), new ReportWriter(), clock).write(query, result);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifacts to " + config.getOutDir(), e);
        }

        log.info("Pipeline run completed | runId={} | validated={} | refuted={} | inconclusive={} | creatives={}",
                runId, result.count(ValidationStatus.VALIDATED), result.count(ValidationStatus.REFUTED),
                result.count(ValidationStatus.INCONCLUSIVE), result.getCreatives().size());
        out.println("insights:  " + artifacts.insights());
        out.println("creatives: " + artifacts.creatives());
        out.println("report:    " + artifacts.report());
        out.println("metadata:  " + artifacts.metadata());
        return EXIT_OK;
    }
}
