package com.openforge.autopilot.session;

import java.time.Clock;
import java.time.Instant;

/**
 * Mutable state of one automation session.
 *
 * Owned by exactly one {@link SessionOrchestrator}; the command loop, the
 * automation task and the telemetry task all read it, so every accessor is
 * synchronized and callers that need a consistent view take a
 * {@link SessionSnapshot}.
 */
public class AutomationSession {

    private final String  sessionId;
    private final Clock   clock;

    private SessionStatus status = SessionStatus.CONNECTED;
    private String        currentTask;
    private int           stepCount;
    private String        currentStep;
    private String        lastError;
    private Instant       lastActivity;

    public AutomationSession(String sessionId, Clock clock) {
        this.sessionId    = sessionId;
        this.clock        = clock;
        this.lastActivity = clock.instant();
    }

    public String sessionId() {
        return sessionId;
    }

    public synchronized SessionStatus status() {
        return status;
    }

    public synchronized Instant lastActivity() {
        return lastActivity;
    }

    /**
     * Moves the session to {@code target}.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public synchronized void transitionTo(SessionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Session %s cannot move from %s to %s"
                    .formatted(sessionId, status, target));
        }
        status = target;
    }

    /** Resets per-task fields and enters RUNNING for a new automation task. */
    public synchronized void beginTask(String task) {
        transitionTo(SessionStatus.RUNNING);
        currentTask = task;
        stepCount   = 0;
        currentStep = null;
        lastError   = null;
    }

    /** Increments and returns the step counter of the current task. */
    public synchronized int nextStep() {
        return ++stepCount;
    }

    public synchronized void currentStep(String label) {
        currentStep = label;
    }

    /** Enters ERROR and records the failure message. */
    public synchronized void fail(String message) {
        transitionTo(SessionStatus.ERROR);
        lastError = message;
    }

    public synchronized void touch() {
        lastActivity = clock.instant();
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, status, currentTask, stepCount,
                currentStep, lastError, lastActivity);
    }
}
