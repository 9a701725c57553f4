package com.openforge.autopilot.agent;

/**
 * What an agent needs to know about the session it serves.
 *
 * @param sessionId owning session, used as the agent's source label
 */
public record SessionContext(String sessionId) {}
