package com.openforge.autopilot.reply;

import com.openforge.autopilot.llm.LlmRouter;
import com.openforge.autopilot.llm.model.ChatRequest;
import com.openforge.autopilot.llm.model.ChatResponse;
import com.openforge.autopilot.llm.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ReplyGenerator} backed by the routed LLM providers.
 *
 * Request layout: [system prompt, history…, user message].
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmReplyGenerator implements ReplyGenerator {

    static final String SYSTEM_PROMPT = """
            You are a helpful AI assistant for LegalEase, specializing in legal automation, \
            tax filing, and document processing. When users ask about tax filing or automation \
            tasks, guide them appropriately. Be concise and helpful.""";

    private static final double TEMPERATURE = 0.7;
    private static final int    MAX_TOKENS  = 200;

    private final LlmRouter llmRouter;

    @Override
    public String reply(String text, ConversationHistory history) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(SYSTEM_PROMPT));
        messages.addAll(history.messages());
        messages.add(Message.user(text));

        String content;
        try {
            ChatResponse response = llmRouter.chat(ChatRequest.conversation(messages, TEMPERATURE, MAX_TOKENS));
            content = response.firstMessage().content();
        } catch (RuntimeException e) {
            log.error("[Reply] LLM call failed: {}", e.getMessage());
            throw new ReplyGenerationException("Chat reply failed: " + e.getMessage(), e);
        }
        if (content == null || content.isBlank()) {
            throw new ReplyGenerationException("Chat reply was empty", null);
        }

        history.append(text, content);
        return content;
    }
}
