package com.openforge.autopilot.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * OpenAI-compatible providers used by the reply generator and the browser agent.
 *
 * agent:
 *   llm:
 *     primary:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: ${OPENAI_API_KEY}
 *       model: gpt-4.1
 *     fallback:
 *       name: openai-mini
 *       base-url: https://api.openai.com/v1
 *       api-key: ${OPENAI_API_KEY}
 *       model: gpt-4.1-mini
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {}
}
