package com.adlens.agents;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/** Lenient field readers for model-produced JSON. */
final class JsonFields {

    private JsonFields() {
    }

    /** Text of {@code field}, or {@code fallback} when absent, null or blank. */
    static String text(JsonNode node, String field, String fallback) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return fallback;
        String s = v.asText();
        return s == null || s.isBlank() ? fallback : s.trim();
    }

    /**
     * Integer value of {@code field}; numeric strings are accepted.
     *
     * @throws NumberFormatException if the field is present but not a number
     */
    static int integer(JsonNode node, String field, int fallback) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return fallback;
        if (v.isNumber()) return v.intValue();
        String s = v.asText().trim();
        if (s.isEmpty()) return fallback;
        return (int) Double.parseDouble(s);
    }

    /**
     * Double value of {@code field}; numeric strings are accepted.
     *
     * @throws NumberFormatException if the field is present but not a number
     */
    static double number(JsonNode node, String field, double fallback) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return fallback;
        if (v.isNumber()) return v.doubleValue();
        String s = v.asText().trim();
        if (s.isEmpty()) return fallback;
        return Double.parseDouble(s);
    }

    /** Array of scalars as strings; a single scalar becomes a one-element list; absent gives an empty list. */
    static List<String> strings(JsonNode node, String field) {
        JsonNode v = node.get(field);
        List<String> out = new ArrayList<>();
        if (v == null || v.isNull()) return out;
        if (v.isArray()) {
            for (JsonNode item : v) {
                if (item == null || item.isNull()) continue;
                String s = item.isValueNode() ? item.asText() : item.toString();
                if (!s.isBlank()) out.add(s.trim());
            }
        } else if (v.isValueNode()) {
            String s = v.asText();
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }
}
