package com.openforge.autopilot.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.event.SessionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link EventChannel} over a raw Spring {@link WebSocketSession}.
 *
 * WebSocketSession.sendMessage is not safe for concurrent callers, so every
 * write happens under one fair lock: producers are served in arrival order and
 * a frame is never interleaved with another.
 */
@Slf4j
public class WebSocketEventChannel implements EventChannel {

    private final WebSocketSession session;
    private final ObjectMapper     objectMapper;
    private final ReentrantLock    writeLock = new ReentrantLock(true);

    private volatile boolean closed;

    public WebSocketEventChannel(WebSocketSession session, ObjectMapper objectMapper) {
        this.session      = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean send(SessionEvent event) {
        if (closed) {
            log.debug("[Channel:{}] Dropping {} event, channel closed", session.getId(), event.type());
            return false;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[Channel:{}] Failed to serialize {} event: {}",
                    session.getId(), event.type(), e.getMessage());
            return false;
        }

        writeLock.lock();
        try {
            if (closed || !session.isOpen()) {
                return false;
            }
            session.sendMessage(new TextMessage(json));
            return true;
        } catch (IOException | IllegalStateException e) {
            // a dead connection must not crash the producer
            log.warn("[Channel:{}] Failed to deliver {} event: {}",
                    session.getId(), event.type(), e.getMessage());
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean isOpen() {
        return !closed && session.isOpen();
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) return;
            closed = true;
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        } catch (IOException e) {
            log.warn("[Channel:{}] Error closing WebSocket: {}", session.getId(), e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }
}
