package com.openforge.autopilot.session;

/**
 * What the registry and the REST surface may do with a live session.
 */
public interface SessionHandle {

    String sessionId();

    SessionSnapshot snapshot();

    /** Tears the session down. Idempotent; safe from any thread. */
    void close(String reason);
}
