package com.openforge.autopilot.llm.model;

/** Entry of the "tools" array: {"type":"function","function":{...}}. */
public record Tool(
        String type,
        ToolFunction function
) {

    public static Tool ofFunction(ToolFunction function) {
        return new Tool("function", function);
    }
}
