package com.openforge.autopilot.agent;

import com.openforge.autopilot.error.ErrorType;

import java.util.Map;

/**
 * A run failed because the browser under the agent is gone or unusable.
 *
 * Classified as BROWSER, which the default error policy treats as fatal.
 */
public class BrowserException extends AgentRunException {

    public BrowserException(String message, Throwable cause) {
        super(message, cause, Map.of());
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.BROWSER;
    }
}
