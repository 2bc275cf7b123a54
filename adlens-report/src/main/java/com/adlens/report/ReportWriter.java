package com.adlens.report;

import com.adlens.model.ChangePoint;
import com.adlens.model.CreativeCandidate;
import com.adlens.model.Evidence;
import com.adlens.model.HypothesisResult;
import com.adlens.model.Validation;
import com.adlens.model.ValidationResult;
import com.adlens.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders the markdown report of a run: executive summary counts, one section per verdict, creative
 * recommendations and links to the JSON artifacts.
 */
public final class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    private static final String NA = "N/A";

    public void write(Path file, ReportContext context) throws IOException {
        Files.writeString(file, render(context), StandardCharsets.UTF_8);
        log.info("Report written | runId={} | file={}", context.runId(), file);
    }

    public String render(ReportContext context) {
        List<HypothesisResult> validated = byStatus(context.results(), ValidationStatus.VALIDATED);
        List<HypothesisResult> inconclusive = byStatus(context.results(), ValidationStatus.INCONCLUSIVE);
        List<HypothesisResult> refuted = byStatus(context.results(), ValidationStatus.REFUTED);

        StringBuilder sb = new StringBuilder();
        sb.append("# Ad Performance Analyst Report\n");
        sb.append("**Run ID:** `").append(context.runId()).append("`\n");
        sb.append("**Query:** ").append(context.query()).append('\n');
        sb.append("**Timestamp:** ").append(context.timestamp()).append("\n\n");

        sb.append("## Executive Summary\n");
        sb.append("- Validated insights: **").append(validated.size()).append("**\n");
        sb.append("- Refuted insights: **").append(refuted.size()).append("**\n");
        sb.append("- Inconclusive insights: **").append(inconclusive.size()).append("**\n");
        sb.append("- Errors recorded: **").append(context.errorCount()).append("**\n\n");

        section(sb, "## Validated Insights", validated, "*No validated insights found.*");
        section(sb, "## Inconclusive Insights", inconclusive, "*None.*");
        section(sb, "## Refuted Insights", refuted, "*None.*");

        sb.append("## Creative Recommendations\n");
        if (context.creatives().isEmpty()) {
            sb.append("*No creatives generated.*\n\n");
        } else {
            for (CreativeCandidate c : context.creatives()) {
                appendCreative(sb, c);
            }
        }

        sb.append("## Appendix\n");
        sb.append("- Insights JSON: `").append(context.insightsFile()).append("`\n");
        sb.append("- Creatives JSON: `").append(context.creativesFile()).append("`\n");
        sb.append("\n---\n");
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, List<HypothesisResult> items, String empty) {
        sb.append(title).append('\n');
        if (items.isEmpty()) {
            sb.append(empty).append("\n\n");
            return;
        }
        for (HypothesisResult item : items) {
            appendInsight(sb, item);
        }
    }

    private static void appendInsight(StringBuilder sb, HypothesisResult item) {
        ValidationResult r = item.result();
        Validation v = r.validation();
        Evidence e = r.evidence();
        sb.append("### Hypothesis `").append(r.hypothesisId()).append("`\n");
        if (!item.hypothesisText().isEmpty()) {
            sb.append("> ").append(item.hypothesisText()).append("\n\n");
        }
        sb.append("**Driver:** ").append(r.driver()).append("  \n");
        sb.append("**Status:** **").append(r.status()).append("**  \n");
        sb.append("**Impact:** ").append(r.impact()).append("  \n");
        sb.append("**Confidence:** ").append(String.format(Locale.ROOT, "%.2f", r.confidenceFinal())).append("\n\n");

        if (v.hasError()) {
            sb.append("**Evaluation error:** ").append(v.error()).append("\n\n");
        } else {
            sb.append("**Evaluator Metrics**\n");
            sb.append("- Method: ").append(v.method() != null ? v.method() : NA).append('\n');
            sb.append("- Baseline: ").append(num(v.baselineMean())).append('\n');
            sb.append("- Test: ").append(num(v.testMean())).append('\n');
            sb.append("- Relative Change (%): ").append(num(v.relativeChangePct())).append('\n');
            sb.append("- p-value: ").append(num(v.pValue())).append('\n');
            sb.append("- Effect Size: ").append(num(v.effectSize())).append("\n\n");

            sb.append("**Evidence**\n");
            sb.append("- Baseline CTR: ").append(num(e.baselineCtr())).append('\n');
            sb.append("- Current CTR: ").append(num(e.currentCtr())).append('\n');
            sb.append("- CTR Delta %: ").append(num(e.ctrDeltaPct())).append('\n');
            sb.append("- Change Point: ").append(changePoint(e.changePoint())).append("\n\n");
        }
        sb.append("**Notes:** ").append(r.notes()).append("\n\n---\n");
    }

    private static void appendCreative(StringBuilder sb, CreativeCandidate c) {
        sb.append("### Creative `").append(c.creativeId()).append("` (").append(c.campaign()).append(")\n");
        sb.append("**Headline:** ").append(c.headline()).append("  \n");
        sb.append("**Body:** ").append(c.body()).append("  \n");
        sb.append("**CTA:** ").append(c.cta()).append("  \n");
        sb.append("**Rationale:** ").append(c.rationale()).append("\n\n---\n");
    }

    private static List<HypothesisResult> byStatus(List<HypothesisResult> results, ValidationStatus status) {
        return results.stream().filter(r -> r.status() == status).collect(Collectors.toList());
    }

    private static String num(Double value) {
        if (value == null) return NA;
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static String changePoint(ChangePoint cp) {
        if (cp == null) return NA;
        if (!cp.found()) return "none (" + cp.note() + ")";
        return String.format(Locale.ROOT, "index %d, relative change %.4f%s",
                cp.index(), cp.relativeChange(), cp.significant() ? " (significant)" : "");
    }
}
