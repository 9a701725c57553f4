package com.openforge.autopilot.session;

import java.time.Instant;

/**
 * Immutable, point-in-time copy of an {@link AutomationSession}.
 * Every outbound event carries one; the REST surface renders one.
 */
public record SessionSnapshot(
        String        sessionId,
        SessionStatus status,
        String        currentTask,
        int           stepCount,
        String        currentStep,
        String        error,
        Instant       lastActivity
) {}
