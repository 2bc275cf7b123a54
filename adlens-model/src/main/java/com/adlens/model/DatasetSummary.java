package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight dataset overview handed to planning and insight prompts. Dates are ISO strings; null when the
 * dataset has no parsable dates. {@code topCampaignsBySpend} keeps descending spend order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DatasetSummary(
        @JsonProperty("n_rows") int rows,
        @JsonProperty("date_min") String dateMin,
        @JsonProperty("date_max") String dateMax,
        @JsonProperty("campaign_count") Integer campaignCount,
        @JsonProperty("top_campaigns_by_spend") Map<String, Double> topCampaignsBySpend) {

    public DatasetSummary {
        topCampaignsBySpend = topCampaignsBySpend == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(topCampaignsBySpend));
    }
}
