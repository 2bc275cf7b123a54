package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** An existing creative taken from the dataset, used as inspiration for new ones. */
public record CreativeSample(
        @JsonProperty("campaign_name") String campaignName,
        @JsonProperty("adset_name") String adsetName,
        @JsonProperty("creative_type") String creativeType,
        @JsonProperty("creative_message") String creativeMessage,
        @JsonProperty("ctr") double ctr) {
}
