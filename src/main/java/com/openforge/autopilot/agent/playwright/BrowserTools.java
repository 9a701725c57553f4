package com.openforge.autopilot.agent.playwright;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.llm.model.Tool;
import com.openforge.autopilot.llm.model.ToolFunction;

import java.util.List;

/**
 * The browser actions offered to the model on every step, as OpenAI tool
 * definitions. The model must pick exactly one per step.
 */
public final class BrowserTools {

    public static final String NAVIGATE      = "navigate";
    public static final String CLICK         = "click";
    public static final String FILL          = "fill";
    public static final String SELECT_OPTION = "select_option";
    public static final String PRESS         = "press";
    public static final String SCROLL        = "scroll";
    public static final String WAIT          = "wait";
    public static final String DONE          = "done";

    private static final ObjectMapper SCHEMA_READER = new ObjectMapper();

    private static final List<Tool> DEFINITIONS = List.of(
            tool(NAVIGATE, "Open a URL in the current tab.", """
                    {"type":"object","properties":{
                      "url":{"type":"string","description":"Absolute URL to open"}},
                     "required":["url"]}"""),
            tool(CLICK, "Click the first element matching a Playwright selector.", """
                    {"type":"object","properties":{
                      "selector":{"type":"string","description":"CSS, text= or role= selector"}},
                     "required":["selector"]}"""),
            tool(FILL, "Replace the value of an input or textarea.", """
                    {"type":"object","properties":{
                      "selector":{"type":"string"},
                      "value":{"type":"string"}},
                     "required":["selector","value"]}"""),
            tool(SELECT_OPTION, "Choose an option of a <select> element by value or label.", """
                    {"type":"object","properties":{
                      "selector":{"type":"string"},
                      "value":{"type":"string"}},
                     "required":["selector","value"]}"""),
            tool(PRESS, "Press a key, optionally focused on an element (e.g. Enter, Tab).", """
                    {"type":"object","properties":{
                      "key":{"type":"string"},
                      "selector":{"type":"string"}},
                     "required":["key"]}"""),
            tool(SCROLL, "Scroll the page one screen up or down.", """
                    {"type":"object","properties":{
                      "direction":{"type":"string","enum":["up","down"]}},
                     "required":["direction"]}"""),
            tool(WAIT, "Wait for the page to settle, at most 10 seconds.", """
                    {"type":"object","properties":{
                      "seconds":{"type":"integer","minimum":1,"maximum":10}},
                     "required":["seconds"]}"""),
            tool(DONE, "Finish the task and report the outcome to the user.", """
                    {"type":"object","properties":{
                      "result":{"type":"string","description":"Summary of what was achieved"},
                      "success":{"type":"boolean"}},
                     "required":["result","success"]}""")
    );

    private BrowserTools() {}

    public static List<Tool> definitions() {
        return DEFINITIONS;
    }

    private static Tool tool(String name, String description, String schema) {
        try {
            return Tool.ofFunction(new ToolFunction(name, description, SCHEMA_READER.readTree(schema)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid schema for browser tool " + name, e);
        }
    }
}
