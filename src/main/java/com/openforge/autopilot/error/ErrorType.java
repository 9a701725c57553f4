package com.openforge.autopilot.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable category of a failure, sent to the client as {@code error_type}.
 *
 * {@code recoverable} categories leave the session status untouched; the others
 * move the session to ERROR and may trigger teardown (see {@link ErrorPolicy}).
 */
public enum ErrorType {

    /** Malformed inbound message. */
    MESSAGE(true),

    /** Reply generator failed. */
    CHAT(true),

    /** Telemetry snapshot failed. */
    SCREENSHOT(true),

    /** Agent could not be started. */
    AGENT(false),

    /** Automation task failed mid-run. */
    AUTOMATION(false),

    /** Browser layer under the agent failed. */
    BROWSER(false),

    /** Anything else escaping the command loop. */
    CONNECTION(false);

    private final boolean recoverable;

    ErrorType(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean recoverable() {
        return recoverable;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
