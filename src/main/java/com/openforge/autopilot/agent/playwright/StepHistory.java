package com.openforge.autopilot.agent.playwright;

import com.openforge.autopilot.llm.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Action log of one run and the prompt built from it.
 *
 * Every step sends the model three messages: the fixed agent prompt, the
 * task, and a fresh observation (recent actions plus the current page).
 */
class StepHistory {

    static final String AGENT_PROMPT = """
            You control a web browser to complete a task for the user.
            On every turn you get the task, the actions taken so far and the current page.
            Choose exactly one tool call for the next action.
            Prefer stable selectors: #id, [name=...], text="...", role=button[name="..."].
            If an action failed, try a different selector or approach instead of repeating it.
            Call done when the task is complete, or when it cannot be completed, with success=false.""";

    /** How many past actions are replayed to the model. */
    static final int RECENT_ACTIONS = 15;

    private final List<String> actions = new ArrayList<>();

    void record(int step, String action, String result) {
        actions.add("step %d: %s -> %s".formatted(step, action, result));
    }

    List<String> actions() {
        return List.copyOf(actions);
    }

    List<Message> prompt(String task, PageState page) {
        StringBuilder observation = new StringBuilder();
        observation.append("Previous actions:\n");
        if (actions.isEmpty()) {
            observation.append("(none)\n");
        } else {
            int from = Math.max(0, actions.size() - RECENT_ACTIONS);
            for (String action : actions.subList(from, actions.size())) {
                observation.append("- ").append(action).append('\n');
            }
        }
        observation.append("\nCurrent page:\n")
                .append("URL: ").append(page.url()).append('\n')
                .append("Title: ").append(page.title()).append('\n')
                .append("Content:\n").append(page.text());

        return List.of(
                Message.system(AGENT_PROMPT),
                Message.user("Task:\n" + task),
                Message.user(observation.toString()));
    }
}
