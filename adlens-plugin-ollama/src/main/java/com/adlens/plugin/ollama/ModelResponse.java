package com.adlens.plugin.ollama;

/** Reply text plus token usage; counts are 0 when the server does not report them. */
public record ModelResponse(String text, long promptTokens, long completionTokens, String model) {

    public ModelResponse {
        text = text != null ? text : "";
    }
}
