package com.adlens.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the first JSON object or array out of free model text. Handles the usual output quirks: the whole reply
 * being JSON, JSON inside a fenced code block, JSON surrounded by prose, and a JSON document double-encoded as a
 * string.
 */
public final class ModelOutputParser {

    private static final Logger log = LoggerFactory.getLogger(ModelOutputParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final Pattern FENCED = Pattern.compile("```(?:json|JSON)?\\s*\\n?(.*?)```", Pattern.DOTALL);

    /** Returns the first object or array found, or empty when the text holds none. */
    public Optional<JsonNode> extract(String rawText) {
        if (rawText == null || rawText.isBlank()) return Optional.empty();
        String trimmed = rawText.trim();

        JsonNode direct = tryParse(trimmed);
        if (direct != null) return Optional.of(direct);

        Matcher fenced = FENCED.matcher(trimmed);
        while (fenced.find()) {
            JsonNode node = tryParse(fenced.group(1).trim());
            if (node != null) return Optional.of(node);
        }

        JsonNode scanned = scanBalanced(trimmed);
        if (scanned != null) return Optional.of(scanned);

        if (log.isWarnEnabled()) {
            int maxLog = 600;
            String snippet = trimmed.length() > maxLog
                    ? trimmed.substring(0, maxLog) + "...[truncated length=" + trimmed.length() + "]"
                    : trimmed;
            log.warn("Model output JSON parse failed | raw snippet=[{}]", snippet);
        }
        return Optional.empty();
    }

    /** Parses {@code text} as a JSON container; unwraps a JSON string that itself holds a container. */
    private static JsonNode tryParse(String text) {
        if (text.isEmpty()) return null;
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null) return null;
            if (node.isContainerNode()) return node;
            if (node.isTextual()) {
                String inner = node.asText().trim();
                if (inner.startsWith("{") || inner.startsWith("[")) {
                    JsonNode unwrapped = MAPPER.readTree(inner);
                    return unwrapped != null && unwrapped.isContainerNode() ? unwrapped : null;
                }
            }
            return null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Tries each '{' or '[' as a start, finds its balanced end outside string literals and parses that region.
     */
    private static JsonNode scanBalanced(String text) {
        for (int start = 0; start < text.length(); start++) {
            char c = text.charAt(start);
            if (c != '{' && c != '[') continue;
            int end = balancedEnd(text, start);
            if (end < 0) continue;
            JsonNode node = tryParse(text.substring(start, end));
            if (node != null) return node;
        }
        return null;
    }

    static int balancedEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escape) {
                escape = false;
                continue;
            }
            if (inString) {
                if (c == '\\') escape = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) return i + 1;
                if (depth < 0) return -1;
            }
        }
        return -1;
    }
}
