package com.openforge.autopilot.agent.playwright;

/**
 * What the model sees of the page before choosing an action.
 *
 * @param text visible body text, already truncated
 */
record PageState(String url, String title, String text) {

    static final int MAX_TEXT = 6000;

    static PageState of(String url, String title, String text) {
        String visible = text == null ? "" : text.strip();
        if (visible.length() > MAX_TEXT) {
            visible = visible.substring(0, MAX_TEXT) + "\n…[truncated]";
        }
        return new PageState(url, title, visible);
    }
}
