package com.openforge.autopilot.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Declaration of one callable function; {@code parameters} is a JSON Schema
 * kept as a tree so it round-trips verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFunction(
        String name,
        String description,
        JsonNode parameters
) {}
