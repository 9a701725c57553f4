package com.openforge.autopilot.llm.model;

/**
 * One tool invocation chosen by the model; for the browser agent this is the
 * next browser action.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {}
