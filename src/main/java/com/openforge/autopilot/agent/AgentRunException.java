package com.openforge.autopilot.agent;

import com.openforge.autopilot.error.AutomationException;
import com.openforge.autopilot.error.ErrorType;

import java.util.Map;

/**
 * An automation task failed mid-run.
 *
 * The session moves to ERROR but stays open for further commands.
 */
public class AgentRunException extends AutomationException {

    public AgentRunException(String message) {
        this(message, null, Map.of());
    }

    public AgentRunException(String message, Throwable cause) {
        this(message, cause, Map.of());
    }

    public AgentRunException(String message, Throwable cause, Map<String, Object> details) {
        super(message, cause, details);
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.AUTOMATION;
    }
}
