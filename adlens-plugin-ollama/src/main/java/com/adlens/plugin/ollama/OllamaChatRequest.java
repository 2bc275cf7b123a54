package com.adlens.plugin.ollama;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Ollama /api/chat request body. */
final class OllamaChatRequest {

    private final String model;
    private final List<Message> messages;
    @JsonProperty("stream")
    private final boolean stream;
    private final Options options;

    OllamaChatRequest(String model, List<Message> messages, boolean stream, Options options) {
        this.model = model;
        this.messages = messages;
        this.stream = stream;
        this.options = options;
    }

    public String getModel() { return model; }
    public List<Message> getMessages() { return messages; }
    public boolean isStream() { return stream; }
    public Options getOptions() { return options; }

    static final class Message {
        private final String role;
        private final String content;

        Message(String role, String content) {
            this.role = role;
            this.content = content;
        }

        public String getRole() { return role; }
        public String getContent() { return content; }
    }

    static final class Options {
        private final double temperature;
        @JsonProperty("num_predict")
        private final int numPredict;

        Options(double temperature, int numPredict) {
            this.temperature = temperature;
            this.numPredict = numPredict;
        }

        public double getTemperature() { return temperature; }
        public int getNumPredict() { return numPredict; }
    }
}
