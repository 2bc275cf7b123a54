package com.adlens.agents;

import com.adlens.engine.CreativeGenerator;
import com.adlens.model.CreativeCandidate;
import com.adlens.model.CreativeSample;
import com.adlens.plugin.ollama.ModelClient;
import com.adlens.plugin.ollama.ModelInvocationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Asks the model for replacement creatives for one campaign.
 * <p>
 * Steps: prompt with samples, parse (stock creative when the reply holds no array), dedupe on
 * (headline, body, rationale), one top-up request when short, trim to {@code count}, assign ids and campaign.
 * A failed first model call is thrown to the caller; a failed top-up only logs.
 */
public final class CreativeAgent implements CreativeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CreativeAgent.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ModelClient model;
    private final PromptTemplates templates;
    private final ModelOutputParser parser = new ModelOutputParser();

    public CreativeAgent(ModelClient model, PromptTemplates templates) {
        this.model = Objects.requireNonNull(model, "model");
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    @Override
    public List<CreativeCandidate> generateForCampaign(String campaign, List<CreativeSample> samples, int count)
            throws ModelInvocationException {
        log.info("Generating creatives | campaign={} | count={}", campaign, count);
        if (count <= 0) return List.of();

        String text = model.generate(buildPrompt(campaign, samples, count)).text();
        List<CreativeCandidate> parsed = parseCandidates(text);
        if (parsed.isEmpty()) {
            log.warn("Creative output had no usable creatives; using stock creative | campaign={}", campaign);
            parsed = List.of(stockCreative());
        }

        Map<String, CreativeCandidate> unique = new LinkedHashMap<>();
        addAll(unique, parsed);
        if (unique.size() < count) {
            addAll(unique, requestMore(new ArrayList<>(unique.values()), count - unique.size()));
        }

        List<CreativeCandidate> out = new ArrayList<>(count);
        for (CreativeCandidate c : unique.values()) {
            if (out.size() == count) break;
            out.add(c.assign(campaign, AgentIds.next("cr")));
        }
        log.info("Creatives produced | campaign={} | count={}", campaign, out.size());
        return out;
    }

    String buildPrompt(String campaign, List<CreativeSample> samples, int count) {
        return templates.get(PromptTemplates.CREATIVE)
                + "\n\nCAMPAIGN: " + campaign
                + "\nREQUIRED_VARIATIONS: " + count
                + "\n\nSAMPLE_CREATIVES:\n" + toJson(samples != null ? samples : List.of())
                + "\n\nRULES:\n"
                + "- Return ONLY a JSON array.\n"
                + "- NO repetition of headlines/bodies/rationales.\n"
                + "- Provide diverse creative styles.\n";
    }

    private List<CreativeCandidate> requestMore(List<CreativeCandidate> existing, int needed) {
        log.info("Requesting more creatives | needed={}", needed);
        String prompt = "Generate NEW, UNIQUE creatives that DO NOT repeat any headline/body/rationale "
                + "from the following:\n\n" + toJson(existing) + "\n\n"
                + "Return exactly " + needed + " items in a JSON array.";
        try {
            return parseCandidates(model.generate(prompt).text());
        } catch (ModelInvocationException e) {
            log.warn("Creative top-up request failed | error={}", e.getMessage());
            return List.of();
        }
    }

    private List<CreativeCandidate> parseCandidates(String text) {
        List<CreativeCandidate> out = new ArrayList<>();
        Optional<JsonNode> parsed = parser.extract(text);
        if (parsed.isEmpty() || !parsed.get().isArray()) return out;
        for (JsonNode node : parsed.get()) {
            if (node == null || !node.isObject()) continue;
            out.add(new CreativeCandidate(
                    null,
                    null,
                    JsonFields.text(node, "creative_type", null),
                    JsonFields.text(node, "headline", ""),
                    JsonFields.text(node, "body", ""),
                    JsonFields.text(node, "cta", ""),
                    JsonFields.text(node, "rationale", "")));
        }
        return out;
    }

    private static void addAll(Map<String, CreativeCandidate> unique, List<CreativeCandidate> candidates) {
        for (CreativeCandidate c : candidates) {
            unique.putIfAbsent(c.dedupeKey(), c);
        }
    }

    static CreativeCandidate stockCreative() {
        return new CreativeCandidate(null, null, "Image", "Fresh Look, New Comfort",
                "Upgrade your comfort with breathable, all-day underwear.", "Shop Now",
                "Fallback due to parsing failure.");
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
