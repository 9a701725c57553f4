package com.openforge.autopilot.agent;

/**
 * Boundary to the external task-execution agent.
 *
 * One {@link BrowserAgent} is created per session and owned exclusively by
 * that session's orchestrator.
 */
public interface AgentAdapter {

    /**
     * Starts a fresh agent for the given session.
     *
     * @throws AgentInitializationException when the agent or its browser cannot be started
     */
    BrowserAgent initialize(SessionContext context);
}
