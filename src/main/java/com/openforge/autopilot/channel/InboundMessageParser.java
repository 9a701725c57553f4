package com.openforge.autopilot.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a raw text frame into an {@link InboundMessage}.
 *
 * Accepted shapes:
 *   {"type":"chat_message","message":"..."}
 *   {"type":"stop_task"}
 *
 * Anything else raises {@link MessageParseException}.
 */
@Component
@RequiredArgsConstructor
public class InboundMessageParser {

    private final ObjectMapper objectMapper;

    public InboundMessage parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MessageParseException("Invalid message format", raw);
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MessageParseException("Invalid message format", raw, e);
        }
        if (node == null || !node.isObject()) {
            throw new MessageParseException("Invalid message format", raw);
        }

        String type = node.path("type").asText("");
        return switch (type) {
            case "chat_message" -> {
                String text = node.path("message").isTextual() ? node.get("message").asText() : null;
                if (text == null || text.isBlank()) {
                    throw new MessageParseException("chat_message requires a non-empty message", raw);
                }
                yield InboundMessage.chat(text);
            }
            case "stop_task" -> InboundMessage.stop();
            case "" -> throw new MessageParseException("Message type is missing", raw);
            default -> throw new MessageParseException("Unknown message type: " + type, raw);
        };
    }
}
