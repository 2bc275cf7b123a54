package com.adlens.plugin.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Ollama /api/chat response (non-streaming). Ignores extra fields (created_at, done, durations). */
@JsonIgnoreProperties(ignoreUnknown = true)
final class OllamaChatResponse {

    private String model;
    private Message message;
    @JsonProperty("prompt_eval_count")
    private Long promptEvalCount;
    @JsonProperty("eval_count")
    private Long evalCount;

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Message {
        private String role;
        private String content;

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
    }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public Message getMessage() { return message; }
    public void setMessage(Message message) { this.message = message; }
    public Long getPromptEvalCount() { return promptEvalCount; }
    public void setPromptEvalCount(Long promptEvalCount) { this.promptEvalCount = promptEvalCount; }
    public Long getEvalCount() { return evalCount; }
    public void setEvalCount(Long evalCount) { this.evalCount = evalCount; }
}
