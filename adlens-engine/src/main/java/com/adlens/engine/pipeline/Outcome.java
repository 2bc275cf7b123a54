package com.adlens.engine.pipeline;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Success-or-reason result of a collaborator call. The executor branches on this instead of catching
 * collaborator exceptions at every stage.
 *
 * @param <T> value type on success
 */
public final class Outcome<T> {

    private final T value;
    private final String reason;
    private final Exception cause;

    private Outcome(T value, String reason, Exception cause) {
        this.value = value;
        this.reason = reason;
        this.cause = cause;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null, null);
    }

    public static <T> Outcome<T> failure(String reason, Exception cause) {
        Objects.requireNonNull(reason, "reason");
        return new Outcome<>(null, reason, cause);
    }

    /**
     * Runs {@code call} and captures any exception as a failure whose reason is the exception message
     * (or its class name when the message is empty). Restores the interrupt flag on {@link InterruptedException}.
     */
    public static <T> Outcome<T> of(Callable<T> call) {
        try {
            return success(call.call());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return failure(describe(e), e);
        }
    }

    public boolean isSuccess() {
        return reason == null;
    }

    /** @throws IllegalStateException on a failed outcome */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("no value on failed outcome: " + reason);
        }
        return value;
    }

    public String getReason() {
        return reason;
    }

    public Exception getCause() {
        return cause;
    }

    static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome{success}" : "Outcome{failure=" + reason + "}";
    }
}
