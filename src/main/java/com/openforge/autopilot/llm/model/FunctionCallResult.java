package com.openforge.autopilot.llm.model;

/**
 * Name and raw JSON arguments of a chosen tool, e.g.
 * name = "click", arguments = "{\"selector\":\"#get-otp\"}".
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
