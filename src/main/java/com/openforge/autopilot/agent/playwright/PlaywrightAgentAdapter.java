package com.openforge.autopilot.agent.playwright;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.agent.AgentAdapter;
import com.openforge.autopilot.agent.AgentInitializationException;
import com.openforge.autopilot.agent.BrowserAgent;
import com.openforge.autopilot.agent.SessionContext;
import com.openforge.autopilot.config.AutomationProperties;
import com.openforge.autopilot.llm.LlmRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Starts one Chromium-backed {@link LlmBrowserAgent} per session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightAgentAdapter implements AgentAdapter {

    private final LlmRouter            llmRouter;
    private final ObjectMapper         objectMapper;
    private final AutomationProperties properties;

    @Override
    public BrowserAgent initialize(SessionContext context) {
        AutomationProperties.Browser browser = properties.browser();
        LlmBrowserAgent agent = new LlmBrowserAgent(
                context.sessionId(),
                new PlaywrightPageDriver(context.sessionId(), browser),
                llmRouter,
                objectMapper,
                properties.maxSteps(),
                browser.actionTimeout());
        try {
            agent.launch(browser.startUrl(), properties.initTimeout());
            return agent;
        } catch (AgentInitializationException e) {
            log.error("[Agent:{}] Initialization failed: {}", context.sessionId(), e.getMessage());
            agent.close();
            throw e;
        }
    }
}
