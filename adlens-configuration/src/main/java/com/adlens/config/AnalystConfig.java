package com.adlens.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for an analyst run.
 * <p>
 * Paths: ADLENS_DATA_PATH, ADLENS_OUT_DIR, ADLENS_LOGS_DIR. Thresholds: ADLENS_THRESHOLDS_FILE (optional JSON,
 * see {@link ThresholdsLoader}). Model: ADLENS_MODEL_BASE_URL, ADLENS_MODEL, ADLENS_MODEL_RETRIES.
 * Creative step: ADLENS_CREATIVE_DRIVER, ADLENS_CREATIVE_VARIATIONS, ADLENS_CREATIVE_SAMPLE_SIZE.
 * Ledger: ADLENS_LEDGER_ENABLED.
 */
public final class AnalystConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalystConfig.class);

    private static final String ENV_DATA_PATH = "ADLENS_DATA_PATH";
    private static final String ENV_OUT_DIR = "ADLENS_OUT_DIR";
    private static final String ENV_LOGS_DIR = "ADLENS_LOGS_DIR";
    private static final String ENV_THRESHOLDS_FILE = "ADLENS_THRESHOLDS_FILE";
    private static final String ENV_MODEL_BASE_URL = "ADLENS_MODEL_BASE_URL";
    private static final String ENV_MODEL = "ADLENS_MODEL";
    private static final String ENV_MODEL_RETRIES = "ADLENS_MODEL_RETRIES";
    private static final String ENV_CREATIVE_DRIVER = "ADLENS_CREATIVE_DRIVER";
    private static final String ENV_CREATIVE_VARIATIONS = "ADLENS_CREATIVE_VARIATIONS";
    private static final String ENV_CREATIVE_SAMPLE_SIZE = "ADLENS_CREATIVE_SAMPLE_SIZE";
    private static final String ENV_LEDGER_ENABLED = "ADLENS_LEDGER_ENABLED";

    private static final String DEFAULT_DATA_PATH = "data/sample_dataset.csv";
    private static final String DEFAULT_OUT_DIR = "reports";
    private static final String DEFAULT_LOGS_DIR = "logs";
    private static final String DEFAULT_MODEL_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final int DEFAULT_MODEL_RETRIES = 2;
    private static final String DEFAULT_CREATIVE_DRIVER = "creative_fatigue";
    private static final int DEFAULT_CREATIVE_VARIATIONS = 4;
    private static final int DEFAULT_CREATIVE_SAMPLE_SIZE = 20;
    private static final boolean DEFAULT_LEDGER_ENABLED = true;

    private final Path dataPath;
    private final Path outDir;
    private final Path logsDir;
    private final EvaluatorThresholds thresholds;
    private final String modelBaseUrl;
    private final String model;
    private final int modelRetries;
    private final String creativeDriver;
    private final int creativeVariations;
    private final int creativeSampleSize;
    private final boolean ledgerEnabled;

    private AnalystConfig(Builder b) {
        this.dataPath = Objects.requireNonNull(b.dataPath, "dataPath");
        this.outDir = Objects.requireNonNull(b.outDir, "outDir");
        this.logsDir = Objects.requireNonNull(b.logsDir, "logsDir");
        this.thresholds = b.thresholds != null ? b.thresholds : EvaluatorThresholds.defaults();
        this.modelBaseUrl = b.modelBaseUrl;
        this.model = b.model;
        this.modelRetries = Math.max(0, b.modelRetries);
        this.creativeDriver = b.creativeDriver;
        this.creativeVariations = Math.max(1, b.creativeVariations);
        this.creativeSampleSize = Math.max(0, b.creativeSampleSize);
        this.ledgerEnabled = b.ledgerEnabled;
    }

    public static AnalystConfig fromEnvironment() {
        EvaluatorThresholds thresholds = EvaluatorThresholds.defaults();
        String thresholdsFile = System.getenv(ENV_THRESHOLDS_FILE);
        if (thresholdsFile != null && !thresholdsFile.isBlank()) {
            try {
                thresholds = ThresholdsLoader.load(Path.of(thresholdsFile.trim()));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Could not load thresholds from {}={}; using defaults. Error: {}",
                        ENV_THRESHOLDS_FILE, thresholdsFile, e.getMessage());
            }
        }
        return builder()
                .dataPath(Path.of(getEnv(ENV_DATA_PATH, DEFAULT_DATA_PATH)))
                .outDir(Path.of(getEnv(ENV_OUT_DIR, DEFAULT_OUT_DIR)))
                .logsDir(Path.of(getEnv(ENV_LOGS_DIR, DEFAULT_LOGS_DIR)))
                .thresholds(thresholds)
                .modelBaseUrl(getEnv(ENV_MODEL_BASE_URL, DEFAULT_MODEL_BASE_URL))
                .model(getEnv(ENV_MODEL, DEFAULT_MODEL))
                .modelRetries(parseInt(System.getenv(ENV_MODEL_RETRIES), DEFAULT_MODEL_RETRIES))
                .creativeDriver(getEnv(ENV_CREATIVE_DRIVER, DEFAULT_CREATIVE_DRIVER))
                .creativeVariations(parseInt(System.getenv(ENV_CREATIVE_VARIATIONS), DEFAULT_CREATIVE_VARIATIONS))
                .creativeSampleSize(parseInt(System.getenv(ENV_CREATIVE_SAMPLE_SIZE), DEFAULT_CREATIVE_SAMPLE_SIZE))
                .ledgerEnabled(parseBoolean(System.getenv(ENV_LEDGER_ENABLED), DEFAULT_LEDGER_ENABLED))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** CSV dataset (ADLENS_DATA_PATH). Default {@code data/sample_dataset.csv}. */
    public Path getDataPath() {
        return dataPath;
    }

    /** Directory for report and JSON artifacts (ADLENS_OUT_DIR). Default {@code reports}. */
    public Path getOutDir() {
        return outDir;
    }

    public Path getLogsDir() {
        return logsDir;
    }

    public EvaluatorThresholds getThresholds() {
        return thresholds;
    }

    public String getModelBaseUrl() {
        return modelBaseUrl;
    }

    public String getModel() {
        return model;
    }

    /** Extra attempts after the first failed model call (ADLENS_MODEL_RETRIES). Default 2. */
    public int getModelRetries() {
        return modelRetries;
    }

    /** Hypothesis driver that triggers creative generation once VALIDATED. Default {@code creative_fatigue}. */
    public String getCreativeDriver() {
        return creativeDriver;
    }

    public int getCreativeVariations() {
        return creativeVariations;
    }

    public int getCreativeSampleSize() {
        return creativeSampleSize;
    }

    /** Whether the run ledger is persisted next to the artifacts (ADLENS_LEDGER_ENABLED). Default true. */
    public boolean isLedgerEnabled() {
        return ledgerEnabled;
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private Path dataPath = Path.of(DEFAULT_DATA_PATH);
        private Path outDir = Path.of(DEFAULT_OUT_DIR);
        private Path logsDir = Path.of(DEFAULT_LOGS_DIR);
        private EvaluatorThresholds thresholds = EvaluatorThresholds.defaults();
        private String modelBaseUrl = DEFAULT_MODEL_BASE_URL;
        private String model = DEFAULT_MODEL;
        private int modelRetries = DEFAULT_MODEL_RETRIES;
        private String creativeDriver = DEFAULT_CREATIVE_DRIVER;
        private int creativeVariations = DEFAULT_CREATIVE_VARIATIONS;
        private int creativeSampleSize = DEFAULT_CREATIVE_SAMPLE_SIZE;
        private boolean ledgerEnabled = DEFAULT_LEDGER_ENABLED;

        public Builder dataPath(Path dataPath) {
            this.dataPath = dataPath;
            return this;
        }

        public Builder outDir(Path outDir) {
            this.outDir = outDir;
            return this;
        }

        public Builder logsDir(Path logsDir) {
            this.logsDir = logsDir;
            return this;
        }

        public Builder thresholds(EvaluatorThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder modelBaseUrl(String modelBaseUrl) {
            this.modelBaseUrl = modelBaseUrl != null ? modelBaseUrl : DEFAULT_MODEL_BASE_URL;
            return this;
        }

        public Builder model(String model) {
            this.model = model != null ? model : DEFAULT_MODEL;
            return this;
        }

        public Builder modelRetries(int modelRetries) {
            this.modelRetries = modelRetries;
            return this;
        }

        public Builder creativeDriver(String creativeDriver) {
            this.creativeDriver = creativeDriver != null ? creativeDriver : DEFAULT_CREATIVE_DRIVER;
            return this;
        }

        public Builder creativeVariations(int creativeVariations) {
            this.creativeVariations = creativeVariations;
            return this;
        }

        public Builder creativeSampleSize(int creativeSampleSize) {
            this.creativeSampleSize = creativeSampleSize;
            return this;
        }

        public Builder ledgerEnabled(boolean ledgerEnabled) {
            this.ledgerEnabled = ledgerEnabled;
            return this;
        }

        public AnalystConfig build() {
            return new AnalystConfig(this);
        }
    }
}
