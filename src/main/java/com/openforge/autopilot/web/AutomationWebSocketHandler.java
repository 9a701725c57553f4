package com.openforge.autopilot.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.channel.WebSocketEventChannel;
import com.openforge.autopilot.error.AutomationException;
import com.openforge.autopilot.session.SessionOrchestrator;
import com.openforge.autopilot.session.SessionOrchestratorFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Raw WebSocket endpoint of the automation service.
 *
 * One {@link SessionOrchestrator} per connection, kept in the WebSocket
 * session's attributes. The container delivers frames of one connection
 * sequentially, which makes {@link #handleTextMessage} the session's command loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutomationWebSocketHandler extends TextWebSocketHandler {

    static final String ORCHESTRATOR_ATTRIBUTE = "autopilot.orchestrator";

    private final SessionOrchestratorFactory factory;
    private final ObjectMapper               objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        try {
            SessionOrchestrator orchestrator = factory.open(new WebSocketEventChannel(session, objectMapper));
            session.getAttributes().put(ORCHESTRATOR_ATTRIBUTE, orchestrator);
            log.info("[WS] Connection {} bound to session {}", session.getId(), orchestrator.sessionId());
        } catch (AutomationException e) {
            // already reported to the client, channel closed
            log.warn("[WS] Connection {} could not open a session: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SessionOrchestrator orchestrator = orchestrator(session);
        if (orchestrator == null) {
            log.debug("[WS] Frame on connection {} without a session, ignored", session.getId());
            return;
        }
        try {
            orchestrator.handleCommand(message.getPayload());
        } catch (RuntimeException e) {
            log.debug("[WS] Command failed on session {}: {}", orchestrator.sessionId(), e.getMessage());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WS] Transport error on connection {}: {}", session.getId(), exception.getMessage());
        SessionOrchestrator orchestrator = orchestrator(session);
        if (orchestrator != null) {
            orchestrator.close("transport error");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SessionOrchestrator orchestrator = orchestrator(session);
        if (orchestrator != null) {
            orchestrator.close("client disconnected (" + status.getCode() + ")");
        }
    }

    private static SessionOrchestrator orchestrator(WebSocketSession session) {
        return (SessionOrchestrator) session.getAttributes().get(ORCHESTRATOR_ATTRIBUTE);
    }
}
