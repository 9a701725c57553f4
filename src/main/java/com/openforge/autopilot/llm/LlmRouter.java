package com.openforge.autopilot.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.llm.model.ChatRequest;
import com.openforge.autopilot.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Function;

/**
 * Single entry point to the LLM for the two places that need one:
 *
 *   LlmReplyGenerator  → short conversational replies, one call per chat message
 *   LlmBrowserAgent    → one tool decision per browser step, many per automation run
 *
 * Providers are tried in order (primary, then fallback). Each has its own
 * circuit breaker and retry, named "llm-primary" and "llm-fallback" in the
 * Resilience4j registries, so a primary outage during a long automation run
 * stops costing a failed call per step once its breaker opens.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    /** One configured provider with its resilience decorators. */
    record Provider(String label,
                    String model,
                    Function<ChatRequest, ChatResponse> endpoint,
                    CircuitBreaker circuitBreaker,
                    Retry retry) {

        ChatResponse call(ChatRequest request) {
            ChatRequest routed = request.withModel(model);
            return CircuitBreaker.decorateSupplier(circuitBreaker,
                    Retry.decorateSupplier(retry, () -> endpoint.apply(routed))).get();
        }
    }

    private final List<Provider> providers;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreakerRegistry circuitBreakers,
                     RetryRegistry retries) {
        this(List.of(
                provider("primary", new LlmClient(httpClient, objectMapper, properties.primary()),
                        circuitBreakers, retries),
                provider("fallback", new LlmClient(httpClient, objectMapper, properties.fallback()),
                        circuitBreakers, retries)));
    }

    LlmRouter(List<Provider> providers) {
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one LLM provider is required");
        }
        this.providers = List.copyOf(providers);
    }

    /**
     * Sends {@code request} to the first provider that answers. The request's
     * model is replaced by each provider's configured model.
     *
     * @throws LlmClient.LlmException when every provider failed or was short-circuited;
     *                                the cause is the last provider's failure
     */
    public ChatResponse chat(ChatRequest request) {
        RuntimeException last = null;
        for (Provider provider : providers) {
            try {
                ChatResponse response = provider.call(request);
                if (last != null) {
                    log.info("[LlmRouter] Served by {} provider ({})", provider.label(), provider.model());
                }
                return response;
            } catch (RuntimeException e) {
                log.warn("[LlmRouter] {} provider failed ({}): {}",
                        provider.label(), e.getClass().getSimpleName(), e.getMessage());
                last = e;
            }
        }
        throw new LlmClient.LlmException(
                "All LLM providers failed, last error: " + last.getMessage(), last);
    }

    private static Provider provider(String label, LlmClient client,
                                     CircuitBreakerRegistry circuitBreakers, RetryRegistry retries) {
        String name = "llm-" + label;
        return new Provider(label, client.modelName(), client::chat,
                circuitBreakers.circuitBreaker(name), retries.retry(name));
    }
}
