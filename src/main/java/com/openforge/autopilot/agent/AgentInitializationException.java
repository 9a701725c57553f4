package com.openforge.autopilot.agent;

import com.openforge.autopilot.error.AutomationException;
import com.openforge.autopilot.error.ErrorType;

import java.util.Map;

/** The agent could not be started. Fatal for the session. */
public class AgentInitializationException extends AutomationException {

    public AgentInitializationException(String message, Throwable cause) {
        super(message, cause, Map.of());
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.AGENT;
    }
}
