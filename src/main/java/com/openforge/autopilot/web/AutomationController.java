package com.openforge.autopilot.web;

import com.openforge.autopilot.session.SessionHandle;
import com.openforge.autopilot.session.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * REST companion of the WebSocket endpoint.
 *
 * Endpoints:
 *   GET    /api/v1/automation/health           liveness plus live session count
 *   GET    /api/v1/automation/sessions         every live session
 *   GET    /api/v1/automation/sessions/{id}    one live session
 *   DELETE /api/v1/automation/sessions/{id}    close a live session
 *
 * Sessions are only reachable while registered; a closed session answers 404.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/automation")
@RequiredArgsConstructor
public class AutomationController {

    static final String CLOSED_VIA_API = "closed via API";

    private final SessionRegistry registry;
    private final Clock           clock;

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", registry.count(), clock.instant());
    }

    @GetMapping("/sessions")
    public List<SessionResponse> listSessions() {
        return registry.snapshot().stream()
                .map(handle -> SessionResponse.from(handle.snapshot()))
                .sorted(Comparator.comparing(SessionResponse::lastActivity).reversed())
                .toList();
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.from(findOrThrow(sessionId).snapshot()));
    }

    /**
     * Closes the session as if its client had disconnected and returns its
     * last state.
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionResponse> closeSession(@PathVariable String sessionId) {
        SessionHandle handle = findOrThrow(sessionId);
        handle.close(CLOSED_VIA_API);
        log.info("[Controller] Closed session {} via API", sessionId);
        return ResponseEntity.ok(SessionResponse.from(handle.snapshot()));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private SessionHandle findOrThrow(String sessionId) {
        return registry.lookup(sessionId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Session not found: " + sessionId));
    }
}
