package com.openforge.autopilot.config;

import com.openforge.autopilot.error.ErrorPolicy;
import com.openforge.autopilot.error.ErrorType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Session and agent tuning, read from application.yml under "agent.automation":
 *
 * agent:
 *   automation:
 *     init-timeout: 60s
 *     run-timeout: 15m
 *     close-timeout: 10s
 *     idle-timeout: 30m          # 0 disables the idle reaper
 *     max-steps: 50
 *     capabilities: [tax_filing, form_filling, document_processing]
 *     fatal-error-types: [agent, browser]
 *     telemetry:
 *       interval: 1s
 *       jpeg-quality: 70
 *     browser:
 *       headless: true
 *       viewport-width: 1920
 *       viewport-height: 1080
 *       action-timeout: 30s
 *       start-url: about:blank
 */
@Validated
@ConfigurationProperties(prefix = "agent.automation")
public record AutomationProperties(
        @DefaultValue("60s") Duration initTimeout,
        @DefaultValue("15m") Duration runTimeout,
        @DefaultValue("10s") Duration closeTimeout,
        @DefaultValue("30m") Duration idleTimeout,
        @DefaultValue("50")  @Min(1) int maxSteps,
        @DefaultValue({"tax_filing", "form_filling", "document_processing"}) @NotEmpty List<String> capabilities,
        @DefaultValue({"agent", "browser"}) Set<ErrorType> fatalErrorTypes,
        @DefaultValue @Valid Telemetry telemetry,
        @DefaultValue @Valid Browser   browser
) {

    public record Telemetry(
            @DefaultValue("1s") Duration interval,
            @DefaultValue("70") @Min(1) @Max(100) int jpegQuality
    ) {}

    public record Browser(
            @DefaultValue("true")        boolean  headless,
            @DefaultValue("1920")        @Min(1) int viewportWidth,
            @DefaultValue("1080")        @Min(1) int viewportHeight,
            @DefaultValue("30s")         Duration actionTimeout,
            @DefaultValue("about:blank") String   startUrl
    ) {}

    public ErrorPolicy errorPolicy() {
        return new ErrorPolicy(fatalErrorTypes);
    }
}
