package com.openforge.autopilot.web;

import com.openforge.autopilot.session.SessionSnapshot;

import java.time.Instant;

/**
 * REST view of a live session, written in the same snake_case as the
 * WebSocket events (session_id, step_count …).
 */
public record SessionResponse(
        String  sessionId,
        String  status,
        String  currentTask,
        int     stepCount,
        String  currentStep,
        String  error,
        Instant lastActivity
) {

    public static SessionResponse from(SessionSnapshot snapshot) {
        return new SessionResponse(
                snapshot.sessionId(),
                snapshot.status().wireName(),
                snapshot.currentTask(),
                snapshot.stepCount(),
                snapshot.currentStep(),
                snapshot.error(),
                snapshot.lastActivity()
        );
    }
}
