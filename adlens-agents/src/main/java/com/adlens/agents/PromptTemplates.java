package com.adlens.agents;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt templates by key ({@value #PLANNER}, {@value #INSIGHT}, {@value #CREATIVE}). The classpath variant reads
 * {@code /prompts/<key>.md} on first use and caches it.
 */
public final class PromptTemplates {

    public static final String PLANNER = "planner";
    public static final String INSIGHT = "insight";
    public static final String CREATIVE = "creative";

    private static final String RESOURCE_DIR = "/prompts/";

    private final Map<String, String> templates = new ConcurrentHashMap<>();
    private final boolean classpath;

    private PromptTemplates(Map<String, String> templates, boolean classpath) {
        this.templates.putAll(templates);
        this.classpath = classpath;
    }

    public static PromptTemplates fromClasspath() {
        return new PromptTemplates(Map.of(), true);
    }

    /** Fixed templates; lookups of other keys fail. */
    public static PromptTemplates of(Map<String, String> templates) {
        return new PromptTemplates(templates, false);
    }

    /**
     * @throws IllegalStateException if no template exists for {@code key}
     */
    public String get(String key) {
        String template = templates.get(key);
        if (template != null) return template;
        if (!classpath) {
            throw new IllegalStateException("No prompt template for key: " + key);
        }
        return templates.computeIfAbsent(key, PromptTemplates::load);
    }

    private static String load(String key) {
        String resource = RESOURCE_DIR + key + ".md";
        try (InputStream in = PromptTemplates.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Prompt template not found on classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt template " + resource, e);
        }
    }
}
