package com.openforge.autopilot.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Body of an OpenAI-compatible /chat/completions call.
 *
 * The model is filled in by {@code LlmRouter} per provider, so factories leave it null.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens
) {

    /** Copy of this request addressed to {@code modelName}. */
    public ChatRequest withModel(String modelName) {
        return new ChatRequest(modelName, messages, tools, toolChoice, temperature, maxTokens);
    }

    /** Plain conversational completion (chat replies). */
    public static ChatRequest conversation(List<Message> messages, double temperature, int maxTokens) {
        return ChatRequest.builder()
                .messages(messages)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }

    /** Completion that must answer with exactly one of {@code tools} (agent decisions). */
    public static ChatRequest toolDecision(List<Message> messages, List<Tool> tools, double temperature) {
        return ChatRequest.builder()
                .messages(messages)
                .tools(tools)
                .toolChoice("required")
                .temperature(temperature)
                .maxTokens(1024)
                .build();
    }
}
