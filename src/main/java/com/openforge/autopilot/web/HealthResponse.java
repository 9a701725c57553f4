package com.openforge.autopilot.web;

import java.time.Instant;

public record HealthResponse(
        String  status,
        int     activeSessions,
        Instant timestamp
) {}
