package com.adlens.report;

import com.adlens.model.CreativeCandidate;
import com.adlens.model.HypothesisResult;

import java.nio.file.Path;
import java.util.List;

/** Inputs of a markdown report. */
public record ReportContext(
        String runId,
        String query,
        String timestamp,
        List<HypothesisResult> results,
        List<CreativeCandidate> creatives,
        int errorCount,
        Path insightsFile,
        Path creativesFile) {

    public ReportContext {
        query = query != null ? query : "";
        results = results == null ? List.of() : List.copyOf(results);
        creatives = creatives == null ? List.of() : List.copyOf(creatives);
    }
}
