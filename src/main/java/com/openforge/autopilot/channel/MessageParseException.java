package com.openforge.autopilot.channel;

import com.openforge.autopilot.error.AutomationException;
import com.openforge.autopilot.error.ErrorType;

import java.util.Map;

/** The client sent something that is not a valid command. Always recoverable. */
public class MessageParseException extends AutomationException {

    public MessageParseException(String message, String rawPayload) {
        this(message, rawPayload, null);
    }

    public MessageParseException(String message, String rawPayload, Throwable cause) {
        super(message, cause, Map.of("payload", abbreviate(rawPayload)));
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.MESSAGE;
    }

    private static String abbreviate(String raw) {
        if (raw == null) return "";
        return raw.length() <= 200 ? raw : raw.substring(0, 200) + "...";
    }
}
