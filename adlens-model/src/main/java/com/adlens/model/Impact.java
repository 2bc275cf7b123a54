package com.adlens.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Business impact bucket of a validated movement. Serialized lower-case. */
public enum Impact {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Impact fromWireName(String value) {
        if (value == null || value.isBlank()) return MEDIUM;
        return Impact.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
