package com.openforge.autopilot.reply;

/**
 * Produces a direct answer to a chat message that needs no automation.
 */
public interface ReplyGenerator {

    /**
     * @param text    the user's message
     * @param history the session's conversation so far; implementations append
     *                the new turns only when a reply is produced
     * @throws ReplyGenerationException when no reply could be produced
     */
    String reply(String text, ConversationHistory history);
}
