package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * A proposed replacement creative for a campaign.
 */
public record CreativeCandidate(
        @JsonProperty("campaign") String campaign,
        @JsonProperty("creative_id") String creativeId,
        @JsonProperty("creative_type") String creativeType,
        @JsonProperty("headline") String headline,
        @JsonProperty("body") String body,
        @JsonProperty("cta") String cta,
        @JsonProperty("rationale") String rationale) {

    @JsonCreator
    public CreativeCandidate {
        creativeType = creativeType == null || creativeType.isBlank() ? "Image" : creativeType.trim();
        headline = headline != null ? headline : "";
        body = body != null ? body : "";
        cta = cta != null ? cta : "";
    }

    /** Copy assigned to a campaign under a fresh id. */
    public CreativeCandidate assign(String campaign, String creativeId) {
        return new CreativeCandidate(campaign, creativeId, creativeType, headline, body, cta, rationale);
    }

    /** Normalized (headline, body, rationale) used to detect duplicate proposals. */
    public String dedupeKey() {
        return norm(headline) + "\u0000" + norm(body) + "\u0000" + norm(rationale);
    }

    private static String norm(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
