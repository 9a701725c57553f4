package com.openforge.autopilot.llm.model;

import java.util.List;

/**
 * Response of /chat/completions. Only the first choice is ever used.
 */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices
) {

    public Message firstMessage() {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalStateException("LLM returned no choices in response: " + id);
        }
        return choices.get(0).message();
    }

    public boolean hasToolCalls() {
        if (choices == null || choices.isEmpty()) return false;
        Message msg = choices.get(0).message();
        return msg != null && msg.toolCalls() != null && !msg.toolCalls().isEmpty();
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}
}
