package com.openforge.autopilot.reply;

import com.openforge.autopilot.llm.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat turns of one session, oldest first.
 *
 * Bounded: once {@code maxTurns} user/assistant pairs are held, the oldest
 * pair is dropped. The system prompt is not stored here.
 */
public class ConversationHistory {

    private final int           maxTurns;
    private final List<Message> messages = new ArrayList<>();

    public ConversationHistory(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }

    /** Records one completed exchange. */
    public synchronized void append(String userText, String assistantText) {
        messages.add(Message.user(userText));
        messages.add(Message.assistant(assistantText));
        while (messages.size() > maxTurns * 2) {
            messages.remove(0);
            messages.remove(0);
        }
    }

    public synchronized int size() {
        return messages.size();
    }
}
