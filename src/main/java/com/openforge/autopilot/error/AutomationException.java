package com.openforge.autopilot.error;

import java.util.Map;

/**
 * Root of the session failure taxonomy.
 *
 * Each subclass is bound to one {@link ErrorType}; {@code details} is merged
 * into the {@code details} object of the error event sent to the client.
 */
public abstract class AutomationException extends RuntimeException {

    private final Map<String, Object> details;

    protected AutomationException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause);
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public abstract ErrorType errorType();

    /** Whether the session carries on unchanged; by default decided by the category. */
    public boolean recoverable() {
        return errorType().recoverable();
    }

    public Map<String, Object> details() {
        return details;
    }
}
