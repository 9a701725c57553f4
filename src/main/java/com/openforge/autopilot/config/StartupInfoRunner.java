package com.openforge.autopilot.config;

import com.openforge.autopilot.llm.LlmProperties;
import com.openforge.autopilot.web.WebSocketConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready:
 * the WebSocket endpoint, session tuning, browser mode and both LLM providers
 * (API keys masked).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final AutomationProperties automationProperties;
    private final LlmProperties        llmProperties;
    private final Environment          env;

    @Override
    public void run(ApplicationArguments args) {
        String port = env.getProperty("server.port", "8080");
        AutomationProperties.Browser   browser   = automationProperties.browser();
        AutomationProperties.Telemetry telemetry = automationProperties.telemetry();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Autopilot : Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    WebSocket      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Sessions                                                ║
                ║    Init timeout   : {}
                ║    Run timeout    : {}   max-steps={}
                ║    Idle timeout   : {}
                ║    Fatal errors   : {}
                ║    Telemetry      : every {}  jpeg-quality={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Browser (Playwright / Chromium)                         ║
                ║    Headless       : {}
                ║    Viewport       : {}x{}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}  [{}]  key={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                WebSocketConfig.ENDPOINT,
                System.getProperty("java.version"),

                automationProperties.initTimeout(),
                automationProperties.runTimeout(), automationProperties.maxSteps(),
                automationProperties.idleTimeout().isZero() ? "disabled" : automationProperties.idleTimeout(),
                automationProperties.fatalErrorTypes(),
                telemetry.interval(), telemetry.jpegQuality(),

                browser.headless() ? "✔ yes" : "✘ no",
                browser.viewportWidth(), browser.viewportHeight(),

                llmProperties.primary().name(),
                llmProperties.primary().model(),
                maskKey(llmProperties.primary().apiKey()),

                llmProperties.fallback().name(),
                llmProperties.fallback().model(),
                maskKey(llmProperties.fallback().apiKey())
        );
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
