package com.openforge.autopilot.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classifies every event a session sends to its client.
 *
 * Automation flow: STATUS_UPDATE → STEP_START(1) → STEP_COMPLETE(1) → … → TASK_COMPLETE.
 * Chat flow:       TYPING → CHAT_RESPONSE.
 * SCREENSHOT frames interleave with both while the browser has a page.
 */
public enum EventType {

    /** First frame of a session. Carries the session id and the capability list. */
    CONNECTION,

    /** Lifecycle change or acknowledgement (task starting, task stopped). */
    STATUS_UPDATE,

    /** Transient indicator while a chat reply is generated. */
    TYPING,

    /** Reply to a chat message that needed no automation. */
    CHAT_RESPONSE,

    /** The agent is starting a step. Carries url/title when known. */
    STEP_START,

    /** The agent finished a step. Carries the last recorded action result. */
    STEP_COMPLETE,

    /** Automation finished successfully. Carries the result. */
    TASK_COMPLETE,

    /** Periodic browser snapshot. Carries base64 JPEG, url and title. */
    SCREENSHOT,

    /** Any failure. Carries error_type, recoverable and details. */
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
