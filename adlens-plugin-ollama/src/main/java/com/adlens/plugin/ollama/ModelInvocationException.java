package com.adlens.plugin.ollama;

/** Thrown when a model call fails after every attempt. */
public class ModelInvocationException extends Exception {

    private final int attempts;

    public ModelInvocationException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
