package com.openforge.autopilot.agent.playwright;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.agent.AgentInitializationException;
import com.openforge.autopilot.agent.AgentResult;
import com.openforge.autopilot.agent.AgentRunException;
import com.openforge.autopilot.agent.BrowserAgent;
import com.openforge.autopilot.agent.BrowserException;
import com.openforge.autopilot.agent.StepObserver;
import com.openforge.autopilot.llm.LlmClient;
import com.openforge.autopilot.llm.LlmRouter;
import com.openforge.autopilot.llm.model.ChatRequest;
import com.openforge.autopilot.llm.model.ChatResponse;
import com.openforge.autopilot.llm.model.ToolCall;
import com.openforge.autopilot.telemetry.CaptureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BrowserAgent} that lets the LLM drive a {@link PageDriver} one tool call at a time.
 *
 * Run loop, per step:
 *   1. stop requested?         → return a stopped result
 *   2. onStepStart
 *   3. read the page            (browser thread)
 *   4. ask the model for a tool (calling thread)
 *   5. perform it               (browser thread)
 *   6. record the result, onStepEnd
 *   7. "done" tool              → return its result
 *
 * Every driver call is confined to one single-threaded executor, so agent
 * actions and telemetry captures from other threads queue up instead of
 * touching Playwright concurrently.
 */
@Slf4j
public class LlmBrowserAgent implements BrowserAgent {

    private static final double   DECISION_TEMPERATURE = 0.1;
    private static final Duration CALL_MARGIN          = Duration.ofSeconds(15);
    private static final Duration CLOSE_TIMEOUT        = Duration.ofSeconds(10);

    private final String          sessionId;
    private final PageDriver      driver;
    private final LlmRouter       llmRouter;
    private final ObjectMapper    objectMapper;
    private final int             maxSteps;
    private final Duration        callTimeout;
    private final ExecutorService browserThread;

    private final AtomicBoolean closed  = new AtomicBoolean();
    private final AtomicBoolean running = new AtomicBoolean();

    // Cached page info so readers on other threads never touch the driver
    private volatile boolean       pageReady;
    private volatile String        url;
    private volatile String        title;
    private volatile String        stepLabel;
    private volatile String        lastAction;
    private volatile AtomicBoolean activeStop;

    LlmBrowserAgent(String sessionId,
                    PageDriver driver,
                    LlmRouter llmRouter,
                    ObjectMapper objectMapper,
                    int maxSteps,
                    Duration actionTimeout) {
        this.sessionId     = sessionId;
        this.driver        = driver;
        this.llmRouter     = llmRouter;
        this.objectMapper  = objectMapper;
        this.maxSteps      = maxSteps;
        this.callTimeout   = actionTimeout.plus(CALL_MARGIN);
        this.browserThread = Executors.newSingleThreadExecutor(
                new CustomizableThreadFactory("browser-" + shortId(sessionId) + "-"));
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Launches the browser and waits for the first page.
     *
     * @throws AgentInitializationException on failure or when {@code timeout} elapses
     */
    void launch(String startUrl, Duration timeout) {
        try {
            onBrowser(() -> {
                driver.open(startUrl);
                refreshPageInfo();
                return null;
            }, timeout);
            pageReady = true;
            log.info("[Agent:{}] Browser agent initialized", sessionId);
        } catch (RuntimeException e) {
            throw new AgentInitializationException(
                    "Failed to initialize automation agent: " + e.getMessage(), e);
        }
    }

    @Override
    public AgentResult run(String task, StepObserver observer) {
        if (!running.compareAndSet(false, true)) {
            throw new AgentRunException("Agent is already running a task");
        }
        AtomicBoolean stop = new AtomicBoolean();
        activeStop = stop;
        StepHistory history = new StepHistory();
        log.info("[Agent:{}] Run started, maxSteps={}", sessionId, maxSteps);
        try {
            for (int step = 1; step <= maxSteps; step++) {
                if (stop.get()) {
                    log.info("[Agent:{}] Stop observed before step {}", sessionId, step);
                    return AgentResult.stopped(step - 1, history.actions());
                }
                stepLabel = String.valueOf(step);
                observer.onStepStart(this);

                PageState page = onBrowser(driver::state, callTimeout);
                Optional<ToolCall> decision = decide(task, history, page);

                if (decision.isEmpty()) {
                    record(history, step, "none", "error: the model chose no action");
                    observer.onStepEnd(this);
                    continue;
                }

                String   tool      = decision.get().function().name();
                JsonNode arguments = parseArguments(decision.get());

                if (BrowserTools.DONE.equals(tool)) {
                    String  result  = arguments.path("result").asText("Task finished");
                    boolean success = arguments.path("success").asBoolean(true);
                    record(history, step, BrowserTools.DONE, result);
                    observer.onStepEnd(this);
                    log.info("[Agent:{}] Run finished at step {} success={}", sessionId, step, success);
                    return AgentResult.done(result, success, step, history.actions());
                }

                String outcome = onBrowser(() -> {
                    String r = driver.perform(tool, arguments);
                    refreshPageInfo();
                    return r;
                }, callTimeout);
                record(history, step, tool + " " + arguments, outcome);
                observer.onStepEnd(this);
            }

            if (stop.get()) {
                return AgentResult.stopped(maxSteps, history.actions());
            }
            throw new AgentRunException("Task did not finish within %d steps".formatted(maxSteps),
                    null, Map.of("max_steps", maxSteps, "actions", history.actions()));
        } finally {
            activeStop = null;
            stepLabel  = null;
            running.set(false);
        }
    }

    @Override
    public void stop() {
        AtomicBoolean stop = activeStop;
        if (stop != null) {
            stop.set(true);
            log.info("[Agent:{}] Stop requested", sessionId);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        stop();
        pageReady = false;
        try {
            Future<?> closing = browserThread.submit(driver::close);
            closing.get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Agent:{}] Interrupted while closing the browser", sessionId);
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.warn("[Agent:{}] Browser did not close cleanly: {}", sessionId, e.toString());
        } finally {
            browserThread.shutdownNow();
        }
    }

    // ── Observation ──────────────────────────────────────────────────────────

    @Override
    public boolean hasPageContext() {
        return pageReady && !closed.get();
    }

    @Override
    public Optional<String> currentUrl() {
        return Optional.ofNullable(url);
    }

    @Override
    public Optional<String> currentTitle() {
        return Optional.ofNullable(title);
    }

    @Override
    public Optional<String> currentStepLabel() {
        return Optional.ofNullable(stepLabel);
    }

    @Override
    public Optional<String> lastActionResult() {
        return Optional.ofNullable(lastAction);
    }

    @Override
    public Optional<byte[]> captureScreenshot(int quality) {
        if (!hasPageContext()) return Optional.empty();
        try {
            return Optional.of(onBrowser(() -> driver.screenshot(quality), callTimeout));
        } catch (RuntimeException e) {
            throw new CaptureException("Screenshot capture failed: " + e.getMessage(), e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Optional<ToolCall> decide(String task, StepHistory history, PageState page) {
        ChatResponse response;
        try {
            response = llmRouter.chat(ChatRequest.toolDecision(
                    history.prompt(task, page), BrowserTools.definitions(), DECISION_TEMPERATURE));
        } catch (LlmClient.LlmException e) {
            throw new AgentRunException("Agent could not decide the next action: " + e.getMessage(), e);
        }
        if (!response.hasToolCalls()) {
            log.warn("[Agent:{}] Model answered without a tool call", sessionId);
            return Optional.empty();
        }
        return Optional.of(response.firstMessage().toolCalls().get(0));
    }

    private JsonNode parseArguments(ToolCall call) {
        String raw = call.function().arguments();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("[Agent:{}] Unparseable tool arguments: {}", sessionId, raw);
            return objectMapper.createObjectNode();
        }
    }

    private void record(StepHistory history, int step, String action, String outcome) {
        lastAction = outcome;
        history.record(step, action, outcome);
        log.debug("[Agent:{}] step {}: {} -> {}", sessionId, step, action, outcome);
    }

    /** Runs on the browser thread only. */
    private void refreshPageInfo() {
        url   = driver.url();
        title = driver.title();
    }

    /**
     * Runs {@code call} on the browser thread and waits for it.
     * Unchecked exceptions thrown by the call are rethrown unchanged.
     */
    private <T> T onBrowser(Callable<T> call, Duration timeout) {
        if (closed.get()) {
            throw new BrowserException("Browser agent is closed", null);
        }
        Future<T> future;
        try {
            future = browserThread.submit(call);
        } catch (RejectedExecutionException e) {
            throw new BrowserException("Browser thread is no longer accepting work", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new AgentRunException("Browser call failed: " + e.getCause(), e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AgentRunException("Browser call timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AgentRunException("Interrupted while waiting for the browser", e);
        }
    }

    private static String shortId(String sessionId) {
        return sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;
    }
}
