package com.openforge.autopilot.reply;

import com.openforge.autopilot.error.AutomationException;
import com.openforge.autopilot.error.ErrorType;

import java.util.Map;

/** The reply generator failed. The session carries on. */
public class ReplyGenerationException extends AutomationException {

    public ReplyGenerationException(String message, Throwable cause) {
        super(message, cause, Map.of());
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.CHAT;
    }
}
