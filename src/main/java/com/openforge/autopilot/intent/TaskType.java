package com.openforge.autopilot.intent;

import com.fasterxml.jackson.annotation.JsonValue;

/** What kind of work a classified command leads to. */
public enum TaskType {

    TAX_FILING,
    FORM_FILLING,
    CHAT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
