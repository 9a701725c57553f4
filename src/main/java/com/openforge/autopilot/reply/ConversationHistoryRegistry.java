package com.openforge.autopilot.reply;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every session's {@link ConversationHistory}. A history is created on
 * first use and dropped when its session closes.
 */
@Slf4j
@Component
public class ConversationHistoryRegistry {

    private final Map<String, ConversationHistory> histories = new ConcurrentHashMap<>();
    private final int maxTurns;

    public ConversationHistoryRegistry(@Value("${agent.automation.chat.max-turns:20}") int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public ConversationHistory forSession(String sessionId) {
        return histories.computeIfAbsent(sessionId, id -> new ConversationHistory(maxTurns));
    }

    public void drop(String sessionId) {
        if (histories.remove(sessionId) != null) {
            log.debug("[History:{}] Conversation dropped", sessionId);
        }
    }

    public boolean contains(String sessionId) {
        return histories.containsKey(sessionId);
    }
}
