package com.openforge.autopilot.session;

import com.openforge.autopilot.error.AutomationException;
import com.openforge.autopilot.error.ErrorType;

import java.util.Map;

/**
 * An automation command arrived while the session's previous run had not
 * returned yet. Reported as an automation error, but the running task and the
 * session status are left alone.
 */
public class TaskAlreadyRunningException extends AutomationException {

    public TaskAlreadyRunningException(String message, String currentTask) {
        super(message, null, currentTask == null ? Map.of() : Map.of("current_task", currentTask));
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.AUTOMATION;
    }

    @Override
    public boolean recoverable() {
        return true;
    }
}
