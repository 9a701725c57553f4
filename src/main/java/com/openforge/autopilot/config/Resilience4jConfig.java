package com.openforge.autopilot.config;

import com.openforge.autopilot.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Resilience4j registries for LLM calls. LlmRouter takes one breaker and one
 * retry per provider from them ("llm-primary", "llm-fallback").
 *
 * Tuned for the browser agent, which asks for one decision per step: a
 * provider that answers slower than {@link #SLOW_DECISION} stalls every step of
 * a run and is treated as failing.
 */
@Configuration
public class Resilience4jConfig {

    static final Duration SLOW_DECISION = Duration.ofSeconds(45);

    @Bean
    public CircuitBreakerRegistry llmCircuitBreakers() {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .slowCallDurationThreshold(SLOW_DECISION)
                .slowCallRateThreshold(80)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(2)
                .build());
    }

    /** One quick retry, only for failures a second attempt can fix. */
    @Bean
    public RetryRegistry llmRetries() {
        return RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(500))
                .retryExceptions(IOException.class, LlmClient.LlmRateLimitException.class)
                .build());
    }
}
