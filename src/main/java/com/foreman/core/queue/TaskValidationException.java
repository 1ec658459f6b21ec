package com.foreman.core.queue;

/**
 * Thrown synchronously when a task or a queue argument is invalid.
 * The {@link Reason} tells callers which rule was broken; none of them are retryable.
 */
public class TaskValidationException extends RuntimeException {

    public enum Reason {
        NULL_TASK,
        MISSING_ID,
        DUPLICATE_ID,
        NEGATIVE_PRIORITY
    }

    private final Reason reason;

    public TaskValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
