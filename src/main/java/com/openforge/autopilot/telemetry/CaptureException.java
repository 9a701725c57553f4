package com.openforge.autopilot.telemetry;

import com.openforge.autopilot.error.AutomationException;
import com.openforge.autopilot.error.ErrorType;

import java.util.Map;

/** A telemetry snapshot could not be taken. The stream keeps running. */
public class CaptureException extends AutomationException {

    public CaptureException(String message, Throwable cause) {
        super(message, cause, Map.of());
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.SCREENSHOT;
    }
}
