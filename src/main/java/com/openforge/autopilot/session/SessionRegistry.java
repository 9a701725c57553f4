package com.openforge.autopilot.session;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map of live sessions, keyed by session id.
 *
 * A session is present from the moment its orchestrator registers until its
 * teardown removes it; an id that has been removed never resolves again.
 */
@Slf4j
@Component
public class SessionRegistry {

    private final Map<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the id is already registered
     */
    public void register(SessionHandle handle) {
        SessionHandle previous = sessions.putIfAbsent(handle.sessionId(), handle);
        if (previous != null) {
            throw new IllegalStateException("Session already registered: " + handle.sessionId());
        }
        log.debug("[Registry] Registered {} (active={})", handle.sessionId(), sessions.size());
    }

    public Optional<SessionHandle> lookup(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /** Idempotent. Returns whether this call removed the entry. */
    public boolean remove(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            log.debug("[Registry] Removed {} (active={})", sessionId, sessions.size());
        }
        return removed;
    }

    public int count() {
        return sessions.size();
    }

    public List<SessionHandle> snapshot() {
        return List.copyOf(sessions.values());
    }

    @PreDestroy
    public void closeAll() {
        closeAll("server shutdown");
    }

    public void closeAll(String reason) {
        List<SessionHandle> live = snapshot();
        if (live.isEmpty()) return;
        log.info("[Registry] Closing {} live session(s): {}", live.size(), reason);
        for (SessionHandle handle : live) {
            try {
                handle.close(reason);
            } catch (RuntimeException e) {
                log.warn("[Registry] Failed to close {}: {}", handle.sessionId(), e.getMessage());
            }
        }
    }
}
