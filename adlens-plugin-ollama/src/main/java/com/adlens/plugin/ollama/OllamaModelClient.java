package com.adlens.plugin.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * {@link ModelClient} backed by the Ollama chat API.
 * <p>
 * Uses {@code POST baseUrl/api/chat} with {@code model}, a single user message and {@code stream=false}.
 * A failed attempt (transport error, non-200 status, unreadable body) is retried {@code retries} more times,
 * sleeping {@code backoff * attempt} between attempts.
 */
public final class OllamaModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaModelClient.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_MODEL = "llama3.2";
    static final double TEMPERATURE = 0.0;
    static final int MAX_TOKENS = 1500;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String model;
    private final int retries;
    private final Duration backoff;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    /**
     * @param baseUrl Ollama base URL (e.g. "http://localhost:11434"); null or blank for default
     * @param model   model name (e.g. "llama3.2"); null or blank for default
     * @param retries extra attempts after the first failure
     * @param backoff base backoff; attempt {@code n} (1-based) sleeps {@code n * backoff} after failing
     */
    public OllamaModelClient(String baseUrl, String model, int retries, Duration backoff) {
        this(baseUrl, model, retries, backoff, Duration.ofSeconds(120));
    }

    OllamaModelClient(String baseUrl, String model, int retries, Duration backoff, Duration requestTimeout) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.model = model != null && !model.isBlank() ? model.trim() : DEFAULT_MODEL;
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0: " + retries);
        }
        this.retries = retries;
        this.backoff = backoff != null ? backoff : Duration.ZERO;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public ModelResponse generate(String prompt) throws ModelInvocationException {
        int attempts = retries + 1;
        Exception last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            log.info("Model call | model={} | attempt={}/{}", model, attempt, attempts);
            try {
                ModelResponse response = callChat(prompt != null ? prompt : "");
                log.info("Model call done | model={} | promptTokens={} | completionTokens={}",
                        response.model(), response.promptTokens(), response.completionTokens());
                return response;
            } catch (IOException | RuntimeException e) {
                last = e;
                log.warn("Model call failed | model={} | attempt={} | error={}", model, attempt, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ModelInvocationException("Interrupted while calling model " + model, attempt, e);
            }
            if (attempt < attempts && !sleep(backoff.multipliedBy(attempt))) {
                throw new ModelInvocationException("Interrupted during model retry backoff", attempt, last);
            }
        }
        log.error("Model call failed after {} attempt(s) | model={}", attempts, model);
        throw new ModelInvocationException("Model " + model + " failed after " + attempts + " attempt(s): "
                + (last != null ? last.getMessage() : "unknown error"), attempts, last);
    }

    private ModelResponse callChat(String prompt) throws IOException, InterruptedException {
        OllamaChatRequest.Message msg = new OllamaChatRequest.Message("user", prompt);
        OllamaChatRequest req = new OllamaChatRequest(model, List.of(msg), false,
                new OllamaChatRequest.Options(TEMPERATURE, MAX_TOKENS));
        String json = MAPPER.writeValueAsString(req);
        log.debug("Model prompt | model={} | prompt={}", model, abbreviate(prompt, 1500));
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/chat"))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() != 200) {
            throw new IOException("Ollama API error: " + response.statusCode() + " " + abbreviate(response.body(), 300));
        }
        String body = response.body();
        OllamaChatResponse resp = MAPPER.readValue(body, OllamaChatResponse.class);
        String content = null;
        long promptTokens = 0;
        long completionTokens = 0;
        String replyModel = model;
        if (resp != null) {
            if (resp.getMessage() != null) content = resp.getMessage().getContent();
            if (resp.getPromptEvalCount() != null) promptTokens = resp.getPromptEvalCount();
            if (resp.getEvalCount() != null) completionTokens = resp.getEvalCount();
            if (resp.getModel() != null && !resp.getModel().isBlank()) replyModel = resp.getModel();
        }
        if (content == null || content.isEmpty()) {
            content = partsText(body);
        }
        log.debug("Model reply | model={} | text={}", replyModel, abbreviate(content, 1000));
        return new ModelResponse(content, promptTokens, completionTokens, replyModel);
    }

    /** Some models answer with {@code message.parts[].text} instead of {@code message.content}. */
    private static String partsText(String body) throws IOException {
        if (body == null || body.isBlank()) return "";
        JsonNode parts = MAPPER.readTree(body).path("message").path("parts");
        if (!parts.isArray()) return "";
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : parts) {
            JsonNode text = part.path("text");
            if (!text.isMissingNode() && !text.isNull()) sb.append(text.asText());
        }
        return sb.toString();
    }

    private static boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) return true;
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String abbreviate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }
}
