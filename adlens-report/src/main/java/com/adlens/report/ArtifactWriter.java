package com.adlens.report;

import com.adlens.engine.pipeline.PipelineRunResult;
import com.adlens.ledger.RunLedger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the artifacts of one run under the output directory: {@code insights_<runId>.json},
 * {@code creatives_<runId>.json}, {@code report_<runId>.md} and {@code run_metadata_<runId>.json}.
 */
public final class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path outDir;
    private final ReportWriter reportWriter;
    private final Clock clock;

    public ArtifactWriter(Path outDir) {
        this(outDir, new ReportWriter(), Clock.systemUTC());
    }

    public ArtifactWriter(Path outDir, ReportWriter reportWriter, Clock clock) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RunArtifacts write(String query, PipelineRunResult run) throws IOException {
        RunLedger ledger = run.getLedger();
        String runId = ledger.getRunId();
        String timestamp = Instant.now(clock).toString();
        Files.createDirectories(outDir);

        RunArtifacts artifacts = new RunArtifacts(
                outDir.resolve("insights_" + runId + ".json"),
                outDir.resolve("creatives_" + runId + ".json"),
                outDir.resolve("report_" + runId + ".md"),
                outDir.resolve("run_metadata_" + runId + ".json"));

        writeJson(artifacts.insights(), run.getResults());
        writeJson(artifacts.creatives(), run.getCreatives());
        reportWriter.write(artifacts.report(), new ReportContext(runId, query, timestamp, run.getResults(),
                run.getCreatives(), ledger.getErrors().size(), artifacts.insights(), artifacts.creatives()));

        Map<String, String> paths = new LinkedHashMap<>();
        paths.put("insights", artifacts.insights().toString());
        paths.put("creatives", artifacts.creatives().toString());
        paths.put("report", artifacts.report().toString());
        writeJson(artifacts.metadata(), new RunMetadata(runId, query, timestamp, ledger.getErrors(),
                ledger.getTasksExecuted(), paths));

        log.info("Artifacts written | runId={} | dir={} | results={} | creatives={} | errors={}",
                runId, outDir, run.getResults().size(), run.getCreatives().size(), ledger.getErrors().size());
        return artifacts;
    }

    private static void writeJson(Path file, Object value) throws IOException {
        Files.writeString(file, MAPPER.writeValueAsString(value), StandardCharsets.UTF_8);
    }
}
