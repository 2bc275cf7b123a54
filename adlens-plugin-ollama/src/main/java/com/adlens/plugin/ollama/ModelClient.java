package com.adlens.plugin.ollama;

/**
 * Text-in, text-out language model contract used by the planning, insight and creative agents.
 */
public interface ModelClient {

    /**
     * Sends one user prompt and returns the model's reply.
     *
     * @throws ModelInvocationException when the model cannot be reached or answers with an error after all retries
     */
    ModelResponse generate(String prompt) throws ModelInvocationException;
}
