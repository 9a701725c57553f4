package com.openforge.autopilot.agent.playwright;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Low-level page operations behind {@link LlmBrowserAgent}.
 *
 * Not thread-safe: the agent calls every method from its single browser thread.
 */
interface PageDriver {

    /** Launches the browser and opens the first page. */
    void open(String startUrl);

    boolean hasPage();

    String url();

    String title();

    PageState state();

    /**
     * Performs one browser tool.
     *
     * @return a short result line; failed actions return a line starting with "error:"
     * @throws com.openforge.autopilot.agent.BrowserException when the page or browser is gone
     */
    String perform(String tool, JsonNode arguments);

    byte[] screenshot(int jpegQuality);

    void close();
}
