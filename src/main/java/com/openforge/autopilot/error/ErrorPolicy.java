package com.openforge.autopilot.error;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides which error categories tear the whole session down.
 *
 * Built from {@code agent.automation.fatal-error-types}; the default set is
 * AGENT and BROWSER. Recoverable categories are never fatal, whatever the
 * configuration says.
 */
public final class ErrorPolicy {

    private final Set<ErrorType> fatalTypes;

    public ErrorPolicy(Set<ErrorType> fatalTypes) {
        this.fatalTypes = fatalTypes == null || fatalTypes.isEmpty()
                ? EnumSet.noneOf(ErrorType.class)
                : EnumSet.copyOf(fatalTypes);
    }

    public static ErrorPolicy defaults() {
        return new ErrorPolicy(EnumSet.of(ErrorType.AGENT, ErrorType.BROWSER));
    }

    public boolean isFatal(ErrorType type) {
        return !type.recoverable() && fatalTypes.contains(type);
    }

    /** Maps any throwable onto its category; unknown failures count as CONNECTION. */
    public ErrorType classify(Throwable failure, ErrorType fallback) {
        if (failure instanceof AutomationException ae) {
            return ae.errorType();
        }
        return fallback != null ? fallback : ErrorType.CONNECTION;
    }
}
