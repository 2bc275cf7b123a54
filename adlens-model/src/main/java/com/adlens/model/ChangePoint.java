package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sliding-window change-point estimate over a full series. {@code index} is null when no split was found.
 * {@code significant} marks whether |relativeChange| reached the reporting cutoff.
 */
public record ChangePoint(
        @JsonProperty("best_split") Integer index,
        @JsonProperty("relative_change") double relativeChange,
        @JsonProperty("significant") boolean significant,
        @JsonProperty("method_note") String note) {

    public static ChangePoint notFound(String note) {
        return new ChangePoint(null, 0.0, false, note);
    }

    public boolean found() {
        return index != null;
    }
}
