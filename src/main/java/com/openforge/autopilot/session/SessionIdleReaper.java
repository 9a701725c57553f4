package com.openforge.autopilot.session;

import com.openforge.autopilot.config.AutomationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Closes sessions that have received no command for longer than
 * {@code agent.automation.idle-timeout}. A zero timeout disables reaping.
 * Running sessions are never reaped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionIdleReaper {

    static final String IDLE_REASON = "idle timeout";

    private final SessionRegistry      registry;
    private final AutomationProperties properties;
    private final Clock                clock;

    @Scheduled(fixedDelayString = "${agent.automation.reaper-interval-ms:60000}")
    public void reapIdleSessions() {
        Duration idleTimeout = properties.idleTimeout();
        if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) return;

        Instant cutoff = clock.instant().minus(idleTimeout);
        int reaped = 0;
        for (SessionHandle handle : registry.snapshot()) {
            SessionSnapshot state = handle.snapshot();
            if (state.status() != SessionStatus.RUNNING && state.lastActivity().isBefore(cutoff)) {
                log.info("[Reaper] Session {} idle since {}, closing", state.sessionId(), state.lastActivity());
                handle.close(IDLE_REASON);
                reaped++;
            }
        }
        if (reaped > 0) {
            log.info("[Reaper] Closed {} idle session(s), {} remain", reaped, registry.count());
        }
    }
}
