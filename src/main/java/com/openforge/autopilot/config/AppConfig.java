package com.openforge.autopilot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - automationExecutor → one task per in-flight automation run
 *  - telemetryExecutor  → one long-lived task per open session
 *  - HttpClient         → the only HTTP engine for LLM calls
 *  - ObjectMapper       → snake_case wire format, ISO-8601 instants, tolerant reads
 *
 * Each session holds one telemetry thread for its whole life and at most one
 * automation thread, so both pools are unbounded cached pools.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(AutomationProperties.class)
public class AppConfig {

    @Bean
    public ExecutorService automationExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("automation-"));
    }

    @Bean
    public ExecutorService telemetryExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("telemetry-"));
    }

    /**
     * Shared HttpClient; per-request read timeouts are set by LlmClient.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return jsonMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The mapper used on the wire and for OpenAI-compatible JSON:
     *  - snake_case property names (session_id, tool_calls …)
     *  - ISO-8601 dates, not timestamps
     *  - unknown properties ignored
     */
    public static ObjectMapper jsonMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
