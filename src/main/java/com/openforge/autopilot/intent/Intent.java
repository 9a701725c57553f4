package com.openforge.autopilot.intent;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Intent {

    TAX_FILING,
    FORM_FILLING,
    HELP,
    CHAT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
