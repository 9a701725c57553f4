package com.openforge.autopilot.session;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one automation session.
 *
 * Flow:  CONNECTED → RUNNING → { COMPLETED | STOPPED | ERROR }
 *
 *   - CONNECTED is the only initial state and is never re-entered.
 *   - RUNNING is entered once per automation task, from CONNECTED, COMPLETED,
 *     STOPPED or a non-fatal ERROR.
 *   - ERROR is reachable from every state.
 */
public enum SessionStatus {

    CONNECTED,
    RUNNING,
    COMPLETED,
    STOPPED,
    ERROR;

    /** Lower-case name used on the wire ("connected", "running" …). */
    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean canTransitionTo(SessionStatus target) {
        if (target == ERROR) return true;
        return allowedTargets().contains(target);
    }

    private Set<SessionStatus> allowedTargets() {
        return switch (this) {
            case CONNECTED, COMPLETED, STOPPED, ERROR -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(COMPLETED, STOPPED);
        };
    }
}
