package com.openforge.autopilot.telemetry;

import java.time.Instant;
import java.util.Base64;

/**
 * One browser snapshot. Never stored: it is encoded into a screenshot event
 * and dropped.
 */
public record TelemetrySnapshot(
        byte[]  jpeg,
        String  url,
        String  title,
        Instant capturedAt
) {

    public String base64() {
        return Base64.getEncoder().encodeToString(jpeg);
    }
}
