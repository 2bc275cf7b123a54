package com.adlens.engine.pipeline;

import com.adlens.config.AnalystConfig;
import com.adlens.model.Hypothesis;

/**
 * Creative-stage settings of the executor: which driver triggers creative generation, how many variations
 * to request, how many sample creatives to pass, and the campaign used when a task has no explicit scope.
 */
public final class ExecutorSettings {

    public static final String DEFAULT_CREATIVE_SCOPE = "campaign_1";

    private final String creativeDriver;
    private final int variations;
    private final int sampleSize;
    private final String defaultCreativeScope;

    private ExecutorSettings(Builder b) {
        this.creativeDriver = b.creativeDriver;
        this.variations = b.variations;
        this.sampleSize = b.sampleSize;
        this.defaultCreativeScope = b.defaultCreativeScope;
    }

    public static ExecutorSettings defaults() {
        return builder().build();
    }

    public static ExecutorSettings from(AnalystConfig config) {
        return builder()
                .creativeDriver(config.getCreativeDriver())
                .variations(config.getCreativeVariations())
                .sampleSize(config.getCreativeSampleSize())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCreativeDriver() {
        return creativeDriver;
    }

    public int getVariations() {
        return variations;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public String getDefaultCreativeScope() {
        return defaultCreativeScope;
    }

    public boolean isCreativeEligible(String driver) {
        return creativeDriver.equals(driver);
    }

    public static final class Builder {
        private String creativeDriver = Hypothesis.DRIVER_CREATIVE_FATIGUE;
        private int variations = 4;
        private int sampleSize = 20;
        private String defaultCreativeScope = DEFAULT_CREATIVE_SCOPE;

        private Builder() {
        }

        public Builder creativeDriver(String creativeDriver) {
            this.creativeDriver = creativeDriver;
            return this;
        }

        public Builder variations(int variations) {
            this.variations = variations;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder defaultCreativeScope(String defaultCreativeScope) {
            this.defaultCreativeScope = defaultCreativeScope;
            return this;
        }

        public ExecutorSettings build() {
            if (creativeDriver == null || creativeDriver.isBlank()) {
                throw new IllegalArgumentException("creativeDriver must not be blank");
            }
            if (variations < 1) {
                throw new IllegalArgumentException("variations must be >= 1: " + variations);
            }
            if (sampleSize < 0) {
                throw new IllegalArgumentException("sampleSize must be >= 0: " + sampleSize);
            }
            if (defaultCreativeScope == null || defaultCreativeScope.isBlank()) {
                throw new IllegalArgumentException("defaultCreativeScope must not be blank");
            }
            return new ExecutorSettings(this);
        }
    }
}
