package com.openforge.autopilot.agent;

import java.util.List;

/**
 * Outcome of {@link BrowserAgent#run}.
 *
 * @param finalText what the agent reported when it declared the task done
 * @param success   whether the agent itself considered the task successful
 * @param stopped   true when the run ended because {@link BrowserAgent#stop()} was called
 * @param steps     number of steps performed
 * @param actions   one entry per recorded action, oldest first
 */
public record AgentResult(
        String       finalText,
        boolean      success,
        boolean      stopped,
        int          steps,
        List<String> actions
) {

    public static AgentResult done(String finalText, boolean success, int steps, List<String> actions) {
        return new AgentResult(finalText, success, false, steps, List.copyOf(actions));
    }

    public static AgentResult stopped(int steps, List<String> actions) {
        return new AgentResult(null, false, true, steps, List.copyOf(actions));
    }

    @Override
    public String toString() {
        if (stopped) return "Stopped after %d step(s)".formatted(steps);
        return finalText != null ? finalText : "Finished after %d step(s)".formatted(steps);
    }
}
