package com.openforge.autopilot.agent.playwright;

import com.openforge.autopilot.llm.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StepHistoryTest {

    private static final PageState PAGE = PageState.of("https://portal.example", "Login", "Enter PAN");

    @Test
    void firstPromptHasNoPreviousActions() {
        List<Message> prompt = new StepHistory().prompt("file my ITR", PAGE);

        assertThat(prompt).extracting(Message::role).containsExactly("system", "user", "user");
        assertThat(prompt.get(0).content()).isEqualTo(StepHistory.AGENT_PROMPT);
        assertThat(prompt.get(2).content())
                .startsWith("Previous actions:\n(none)\n")
                .contains("URL: https://portal.example\nTitle: Login\nContent:\nEnter PAN");
    }

    @Test
    void onlyRecentActionsAreReplayed() {
        StepHistory history = new StepHistory();
        for (int i = 1; i <= StepHistory.RECENT_ACTIONS + 5; i++) {
            history.record(i, "click #b" + i, "Clicked #b" + i);
        }

        String observation = history.prompt("task", PAGE).get(2).content();

        assertThat(history.actions()).hasSize(StepHistory.RECENT_ACTIONS + 5);
        assertThat(observation).doesNotContain("step 5: ").contains("step 6: click #b6 -> Clicked #b6");
        assertThat(observation).contains("- step 20: click #b20 -> Clicked #b20");
    }

    @Test
    void pageTextIsTruncated() {
        PageState state = PageState.of("u", "t", "x".repeat(PageState.MAX_TEXT + 100));

        assertThat(state.text()).hasSize(PageState.MAX_TEXT + "\n…[truncated]".length())
                .endsWith("…[truncated]");
        assertThat(PageState.of("u", "t", null).text()).isEmpty();
    }
}
