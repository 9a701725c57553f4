package com.openforge.autopilot.agent.playwright;

import com.fasterxml.jackson.databind.JsonNode;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.ScreenshotType;
import com.openforge.autopilot.agent.BrowserException;
import com.openforge.autopilot.config.AutomationProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link PageDriver} over a Chromium instance launched by Playwright.
 *
 * One Playwright, one browser, one context and one page per driver.
 */
@Slf4j
class PlaywrightPageDriver implements PageDriver {

    private static final int SCROLL_PIXELS = 800;

    private final String                       sessionId;
    private final AutomationProperties.Browser config;

    private Playwright     playwright;
    private Browser        browser;
    private BrowserContext context;
    private Page           page;

    PlaywrightPageDriver(String sessionId, AutomationProperties.Browser config) {
        this.sessionId = sessionId;
        this.config    = config;
    }

    @Override
    public void open(String startUrl) {
        playwright = Playwright.create();
        browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(config.headless())
                .setArgs(List.of(
                        "--no-sandbox",
                        "--disable-setuid-sandbox",
                        "--disable-dev-shm-usage",
                        "--disable-gpu",
                        "--window-size=%d,%d".formatted(config.viewportWidth(), config.viewportHeight()))));
        context = browser.newContext(new Browser.NewContextOptions()
                .setViewportSize(config.viewportWidth(), config.viewportHeight())
                .setIgnoreHTTPSErrors(true)
                .setBypassCSP(true)
                .setJavaScriptEnabled(true));
        context.setDefaultTimeout(config.actionTimeout().toMillis());
        context.setDefaultNavigationTimeout(config.actionTimeout().toMillis());
        page = context.newPage();
        if (startUrl != null && !startUrl.isBlank()) {
            page.navigate(startUrl);
        }
        log.info("[Browser:{}] Chromium ready (headless={}, viewport={}x{})", sessionId,
                config.headless(), config.viewportWidth(), config.viewportHeight());
    }

    @Override
    public boolean hasPage() {
        return page != null && !page.isClosed();
    }

    @Override
    public String url() {
        return hasPage() ? page.url() : null;
    }

    @Override
    public String title() {
        if (!hasPage()) return null;
        try {
            return page.title();
        } catch (PlaywrightException e) {
            return null;
        }
    }

    @Override
    public PageState state() {
        ensureAlive();
        String text;
        try {
            text = page.innerText("body");
        } catch (PlaywrightException e) {
            text = "";
        }
        return PageState.of(page.url(), title(), text);
    }

    @Override
    public String perform(String tool, JsonNode arguments) {
        ensureAlive();
        try {
            return switch (tool) {
                case BrowserTools.NAVIGATE -> {
                    String url = required(arguments, "url");
                    page.navigate(url);
                    yield "Navigated to " + page.url();
                }
                case BrowserTools.CLICK -> {
                    String selector = required(arguments, "selector");
                    page.locator(selector).first().click();
                    yield "Clicked " + selector;
                }
                case BrowserTools.FILL -> {
                    String selector = required(arguments, "selector");
                    page.locator(selector).first().fill(required(arguments, "value"));
                    yield "Filled " + selector;
                }
                case BrowserTools.SELECT_OPTION -> {
                    String selector = required(arguments, "selector");
                    String value    = required(arguments, "value");
                    page.locator(selector).first().selectOption(value);
                    yield "Selected " + value + " in " + selector;
                }
                case BrowserTools.PRESS -> {
                    String key = required(arguments, "key");
                    String selector = arguments.path("selector").asText("");
                    if (selector.isBlank()) {
                        page.keyboard().press(key);
                    } else {
                        page.locator(selector).first().press(key);
                    }
                    yield "Pressed " + key;
                }
                case BrowserTools.SCROLL -> {
                    boolean up = "up".equalsIgnoreCase(arguments.path("direction").asText("down"));
                    page.mouse().wheel(0, up ? -SCROLL_PIXELS : SCROLL_PIXELS);
                    yield "Scrolled " + (up ? "up" : "down");
                }
                case BrowserTools.WAIT -> {
                    int seconds = Math.max(1, Math.min(10, arguments.path("seconds").asInt(1)));
                    page.waitForTimeout(seconds * 1000.0);
                    yield "Waited " + seconds + "s";
                }
                default -> "error: unknown action " + tool;
            };
        } catch (IllegalArgumentException e) {
            return "error: " + e.getMessage();
        } catch (PlaywrightException e) {
            ensureAlive();
            return "error: " + firstLine(e.getMessage());
        }
    }

    @Override
    public byte[] screenshot(int jpegQuality) {
        ensureAlive();
        return page.screenshot(new Page.ScreenshotOptions()
                .setType(ScreenshotType.JPEG)
                .setQuality(jpegQuality)
                .setFullPage(false));
    }

    @Override
    public void close() {
        try {
            if (context != null) context.close();
        } catch (PlaywrightException e) {
            log.warn("[Browser:{}] Error closing context: {}", sessionId, firstLine(e.getMessage()));
        }
        try {
            if (browser != null) browser.close();
        } catch (PlaywrightException e) {
            log.warn("[Browser:{}] Error closing browser: {}", sessionId, firstLine(e.getMessage()));
        }
        try {
            if (playwright != null) playwright.close();
        } catch (PlaywrightException e) {
            log.warn("[Browser:{}] Error closing Playwright: {}", sessionId, firstLine(e.getMessage()));
        }
        page = null;
        log.info("[Browser:{}] Closed", sessionId);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void ensureAlive() {
        if (page == null || page.isClosed() || browser == null || !browser.isConnected()) {
            throw new BrowserException("Browser page is no longer available", null);
        }
    }

    private static String required(JsonNode arguments, String name) {
        String value = arguments.path(name).asText("");
        if (value.isBlank()) {
            throw new IllegalArgumentException("missing argument '" + name + "'");
        }
        return value;
    }

    private static String firstLine(String message) {
        if (message == null) return "unknown browser error";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
