package com.adlens.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads evaluator thresholds from a JSON file. Keys are snake_case; either a top-level object or one nested
 * under {@code "thresholds"}. Absent keys keep their defaults.
 * <pre>
 * {"thresholds": {"p_value_threshold": 0.05, "ctr_drop_pct": 20, "min_samples_for_ttest": 10,
 *                 "bootstrap_iters": 2000, "rolling_window_days": 7, "change_point_relative_threshold": 0.15}}
 * </pre>
 */
public final class ThresholdsLoader {

    private static final Logger log = LoggerFactory.getLogger(ThresholdsLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ThresholdsLoader() {
    }

    public static EvaluatorThresholds load(Path file) throws IOException {
        JsonNode root = MAPPER.readTree(Files.readString(file));
        if (root == null || !root.isObject()) {
            throw new IOException("Thresholds file is not a JSON object: " + file);
        }
        JsonNode node = root.has("thresholds") && root.get("thresholds").isObject() ? root.get("thresholds") : root;
        EvaluatorThresholds.Builder b = EvaluatorThresholds.builder();
        if (node.hasNonNull("p_value_threshold")) b.pValueThreshold(node.get("p_value_threshold").asDouble());
        if (node.hasNonNull("ctr_drop_pct")) b.ctrDropPctThreshold(node.get("ctr_drop_pct").asDouble());
        if (node.hasNonNull("ctr_drop_pct_threshold")) b.ctrDropPctThreshold(node.get("ctr_drop_pct_threshold").asDouble());
        if (node.hasNonNull("min_samples_for_ttest")) b.minSamplesForTtest(node.get("min_samples_for_ttest").asInt());
        if (node.hasNonNull("bootstrap_iters")) b.bootstrapIters(node.get("bootstrap_iters").asInt());
        if (node.hasNonNull("rolling_window_days")) b.rollingWindowDays(node.get("rolling_window_days").asInt());
        if (node.hasNonNull("change_point_relative_threshold")) {
            b.changePointRelativeThreshold(node.get("change_point_relative_threshold").asDouble());
        }
        if (node.hasNonNull("bootstrap_seed")) b.bootstrapSeed(node.get("bootstrap_seed").asLong());
        EvaluatorThresholds thresholds = b.build();
        log.info("Loaded evaluator thresholds | file={} | {}", file, thresholds);
        return thresholds;
    }
}
