package com.openforge.autopilot.session;

import com.openforge.autopilot.agent.AgentAdapter;
import com.openforge.autopilot.agent.AgentInitializationException;
import com.openforge.autopilot.agent.AgentResult;
import com.openforge.autopilot.agent.AgentRunException;
import com.openforge.autopilot.agent.BrowserAgent;
import com.openforge.autopilot.agent.SessionContext;
import com.openforge.autopilot.agent.StepObserver;
import com.openforge.autopilot.channel.EventChannel;
import com.openforge.autopilot.channel.InboundMessage;
import com.openforge.autopilot.channel.InboundMessageParser;
import com.openforge.autopilot.config.AutomationProperties;
import com.openforge.autopilot.error.AutomationException;
import com.openforge.autopilot.error.ErrorPolicy;
import com.openforge.autopilot.error.ErrorType;
import com.openforge.autopilot.event.SessionEvent;
import com.openforge.autopilot.intent.IntentClassifier;
import com.openforge.autopilot.intent.IntentResult;
import com.openforge.autopilot.intent.TaskDescriptions;
import com.openforge.autopilot.reply.ConversationHistory;
import com.openforge.autopilot.reply.ConversationHistoryRegistry;
import com.openforge.autopilot.reply.ReplyGenerator;
import com.openforge.autopilot.telemetry.CaptureException;
import com.openforge.autopilot.telemetry.TelemetryStream;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Owns one WebSocket session from connect to teardown.
 *
 * Three kinds of work share the session's {@link EventChannel}:
 *   - the command loop   → {@link #handleCommand}, called by the WebSocket container
 *   - the automation run → at most one, on the automation executor
 *   - the telemetry loop → one, on the telemetry executor
 *
 * Session state changes and the events announcing them happen together under
 * {@code stateLock}, so a client never sees a step event after "Task stopped by
 * user". Lock order is always stateLock → channel write lock.
 *
 * Every failure goes through {@link #report}: classify, emit one error event,
 * update the status for non-recoverable categories, tear down on fatal ones.
 */
@Slf4j
public class SessionOrchestrator implements SessionHandle {

    static final String TASK_STOPPED_MESSAGE  = "Task stopped by user";
    static final String NOTHING_RUNNING       = "No automation task is running";
    static final String ALREADY_RUNNING       = "An automation task is already running";
    static final String CHAT_FAILURE_MESSAGE  = "I'm having trouble responding right now. Please try again.";

    /**
     * Everything an orchestrator needs besides its own session and channel.
     * Built once by {@link SessionOrchestratorFactory}.
     */
    public record Collaborators(
            SessionRegistry             registry,
            AgentAdapter                agentAdapter,
            InboundMessageParser        parser,
            IntentClassifier            classifier,
            ReplyGenerator              replyGenerator,
            ConversationHistoryRegistry histories,
            ErrorPolicy                 errorPolicy,
            AutomationProperties        properties,
            Executor                    automationExecutor,
            Executor                    telemetryExecutor,
            Clock                       clock
    ) {}

    private final AutomationSession session;
    private final EventChannel      channel;
    private final Collaborators     c;

    private final Object        stateLock = new Object();
    private final AtomicBoolean closing   = new AtomicBoolean();

    private volatile BrowserAgent    agent;
    private volatile TelemetryStream telemetry;

    // guarded by stateLock
    private AutomationRun activeRun;

    SessionOrchestrator(AutomationSession session, EventChannel channel, Collaborators collaborators) {
        this.session = session;
        this.channel = channel;
        this.c       = collaborators;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Registers the session, starts its agent, greets the client and starts telemetry.
     *
     * @throws AgentInitializationException when the agent cannot be started; the
     *                                      session is already torn down by then
     */
    void open() {
        String id = session.sessionId();
        c.registry().register(this);
        log.info("[Session:{}] Opened, initializing agent", id);

        try {
            agent = reportingErrors(ErrorType.AGENT, this::initializeAgent);
        } catch (RuntimeException e) {
            // no agent means no session, whatever the fatal set says
            close("agent initialization failed");
            throw e;
        }

        channel.send(SessionEvent.connection(session.snapshot(), c.properties().capabilities()));

        AutomationProperties.Telemetry settings = c.properties().telemetry();
        TelemetryStream stream = new TelemetryStream(
                id,
                agent,
                channel,
                session::snapshot,
                () -> c.registry().contains(id),
                this::reportCaptureFailure,
                settings.interval(),
                settings.jpegQuality(),
                c.clock());
        telemetry = stream;
        if (closing.get()) return;
        stream.start(c.telemetryExecutor());
        log.info("[Session:{}] Ready, telemetry every {}", id, settings.interval());
    }

    @Override
    public void close(String reason) {
        if (!closing.compareAndSet(false, true)) return;
        String id = session.sessionId();
        log.info("[Session:{}] Closing: {}", id, reason);

        AutomationRun run;
        synchronized (stateLock) {
            run = activeRun;
            if (run != null) run.stopped = true;
        }
        BrowserAgent current = agent;
        if (run != null && current != null) {
            current.stop();
        }

        TelemetryStream stream = telemetry;
        if (stream != null) {
            try {
                if (!stream.cancelAndAwait(c.properties().closeTimeout())) {
                    log.warn("[Session:{}] Telemetry did not terminate within {}", id, c.properties().closeTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Session:{}] Interrupted while awaiting telemetry", id);
            }
        }

        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("[Session:{}] Agent close failed: {}", id, e.getMessage());
            }
        }

        c.histories().drop(id);
        c.registry().remove(id);
        channel.close();
        log.info("[Session:{}] Closed", id);
    }

    public boolean isClosed() {
        return closing.get();
    }

    @Override
    public String sessionId() {
        return session.sessionId();
    }

    @Override
    public SessionSnapshot snapshot() {
        return session.snapshot();
    }

    // ── Command loop ─────────────────────────────────────────────────────────

    /**
     * Handles one raw inbound frame. Called sequentially by the WebSocket container.
     *
     * @throws AutomationException after it has been reported to the client
     */
    public void handleCommand(String raw) {
        if (closing.get()) {
            log.debug("[Session:{}] Ignoring command, session is closing", session.sessionId());
            return;
        }
        session.touch();
        InboundMessage message = reportingErrors(ErrorType.MESSAGE, () -> c.parser().parse(raw));
        try {
            switch (message.type()) {
                case STOP_TASK    -> stopTask();
                case CHAT_MESSAGE -> onChatMessage(message.message());
            }
        } catch (AutomationException e) {
            throw e;
        } catch (RuntimeException e) {
            report(e, ErrorType.CONNECTION);
            throw e;
        }
    }

    private void stopTask() {
        AutomationRun run;
        synchronized (stateLock) {
            run = activeRun;
            if (run == null || !run.isLive()) {
                channel.send(SessionEvent.statusUpdate(session.snapshot(), NOTHING_RUNNING));
                return;
            }
            run.stopped = true;
            if (session.status().canTransitionTo(SessionStatus.STOPPED)) {
                session.transitionTo(SessionStatus.STOPPED);
            }
            channel.send(SessionEvent.statusUpdate(session.snapshot(), TASK_STOPPED_MESSAGE));
        }
        log.info("[Session:{}] Task stopped by user", session.sessionId());
        agent.stop();
    }

    private void onChatMessage(String text) {
        IntentResult intent = c.classifier().classify(text);
        log.info("[Session:{}] Intent={} automation={} confidence={}", session.sessionId(),
                intent.intent(), intent.requiresAutomation(), intent.confidence());
        if (intent.requiresAutomation()) {
            startAutomation(text, intent);
        } else {
            reply(text);
        }
    }

    private void reply(String text) {
        channel.send(SessionEvent.typing(session.snapshot()));
        String id = session.sessionId();
        ConversationHistory history = c.histories().forSession(id);
        if (closing.get()) {
            // close() may have dropped the history just before forSession recreated it
            c.histories().drop(id);
            return;
        }
        String answer = reportingErrors(ErrorType.CHAT, () -> c.replyGenerator().reply(text, history));
        channel.send(SessionEvent.chatResponse(session.snapshot(), answer));
    }

    // ── Automation ───────────────────────────────────────────────────────────

    private void startAutomation(String text, IntentResult intent) {
        String description = TaskDescriptions.forIntent(intent, text);
        AutomationRun run = new AutomationRun();
        synchronized (stateLock) {
            if (activeRun != null) {
                report(new TaskAlreadyRunningException(ALREADY_RUNNING, session.snapshot().currentTask()),
                        ErrorType.AUTOMATION);
                return;
            }
            session.beginTask(text);
            activeRun = run;
            channel.send(SessionEvent.automationStarting(session.snapshot(),
                    intent.taskType().wireName(), intent.confidence(), intent.action()));
        }
        log.info("[Session:{}] Dispatching {} automation", session.sessionId(), intent.taskType().wireName());

        Duration timeout = c.properties().runTimeout();
        CompletableFuture<AgentResult> execution;
        try {
            execution = CompletableFuture.supplyAsync(() -> execute(run, description), c.automationExecutor());
        } catch (RejectedExecutionException e) {
            finish(run, null, new AgentRunException("Automation executor rejected the task", e));
            return;
        }
        // the run slot is released only when the agent has actually returned
        execution.whenComplete((result, failure) -> finish(run, result, failure));
        execution.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, failure) -> {
                    if (unwrap(failure) instanceof TimeoutException) {
                        timeOut(run, timeout);
                    }
                });
    }

    /** Runs on the automation executor. Returns null when stopped before the agent started. */
    private AgentResult execute(AutomationRun run, String description) {
        if (!run.isLive()) return null;
        return agent.run(description, new RunObserver(run));
    }

    /**
     * The run exceeded its time budget. Its events are suppressed from now on,
     * but it keeps the run slot until {@link #finish} sees the agent return.
     */
    private void timeOut(AutomationRun run, Duration timeout) {
        synchronized (stateLock) {
            if (!run.isLive()) return;
            run.timedOut = true;
        }
        BrowserAgent current = agent;
        if (current != null) {
            current.stop();
        }
        report(new AgentRunException("Automation task timed out after " + timeout), ErrorType.AUTOMATION);
    }

    /** Called once the agent's run has returned or thrown. */
    private void finish(AutomationRun run, AgentResult result, Throwable failure) {
        Throwable cause = unwrap(failure);
        boolean reportFailure = false;
        synchronized (stateLock) {
            boolean live = run.isLive();
            run.finished = true;
            if (activeRun == run) activeRun = null;

            if (!live) {
                log.debug("[Session:{}] Run ended after it was cancelled: {}", session.sessionId(),
                        cause != null ? cause.toString() : result);
                return;
            }
            if (cause == null) {
                if (result != null && result.stopped()) {
                    session.transitionTo(SessionStatus.STOPPED);
                    channel.send(SessionEvent.statusUpdate(session.snapshot(), TASK_STOPPED_MESSAGE));
                } else {
                    session.transitionTo(SessionStatus.COMPLETED);
                    channel.send(SessionEvent.taskComplete(session.snapshot(), String.valueOf(result)));
                }
            } else {
                reportFailure = true;
            }
        }

        if (reportFailure) {
            report(cause, ErrorType.AUTOMATION);
        } else if (result != null) {
            log.info("[Session:{}] Automation finished in {} step(s)", session.sessionId(), result.steps());
        }
    }

    /** Step callbacks; run on the automation thread and never throw. */
    private final class RunObserver implements StepObserver {

        private final AutomationRun run;

        RunObserver(AutomationRun run) {
            this.run = run;
        }

        @Override
        public void onStepStart(BrowserAgent browserAgent) {
            try {
                synchronized (stateLock) {
                    if (!run.isLive()) return;
                    int step = session.nextStep();
                    session.currentStep(browserAgent.currentStepLabel().orElse(String.valueOf(step)));
                    channel.send(SessionEvent.stepStart(session.snapshot(),
                            browserAgent.currentUrl().orElse(null),
                            browserAgent.currentTitle().orElse(null)));
                }
            } catch (RuntimeException e) {
                log.warn("[Session:{}] Step start callback failed: {}", session.sessionId(), e.getMessage());
            }
        }

        @Override
        public void onStepEnd(BrowserAgent browserAgent) {
            try {
                synchronized (stateLock) {
                    if (!run.isLive()) return;
                    channel.send(SessionEvent.stepComplete(session.snapshot(),
                            browserAgent.currentUrl().orElse(null),
                            browserAgent.currentTitle().orElse(null),
                            browserAgent.lastActionResult().orElse(null)));
                }
            } catch (RuntimeException e) {
                log.warn("[Session:{}] Step end callback failed: {}", session.sessionId(), e.getMessage());
            }
        }
    }

    /** One dispatched automation task. Written under stateLock. */
    private final class AutomationRun {
        volatile boolean stopped;
        volatile boolean timedOut;
        volatile boolean finished;

        boolean isLive() {
            return !stopped && !timedOut && !finished && !closing.get();
        }
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
    }

    // ── Agent start-up ───────────────────────────────────────────────────────

    private BrowserAgent initializeAgent() {
        Duration timeout = c.properties().initTimeout();
        CompletableFuture<BrowserAgent> init = CompletableFuture.supplyAsync(
                () -> c.agentAdapter().initialize(new SessionContext(session.sessionId())),
                c.automationExecutor());
        try {
            return init.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // a late agent must still release its browser
            init.thenAccept(BrowserAgent::close);
            throw new AgentInitializationException("Agent initialization timed out after " + timeout, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AgentInitializationException aie) throw aie;
            throw new AgentInitializationException(
                    "Failed to initialize automation agent: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentInitializationException("Interrupted while initializing the agent", e);
        }
    }

    // ── Error funnel ─────────────────────────────────────────────────────────

    /**
     * Runs {@code action}; any failure is reported and then rethrown.
     *
     * @param fallback category for failures outside the {@link AutomationException} hierarchy
     */
    <T> T reportingErrors(ErrorType fallback, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            report(e, fallback);
            throw e;
        }
    }

    private void reportCaptureFailure(CaptureException e) {
        report(e, ErrorType.SCREENSHOT);
    }

    private void report(Throwable failure, ErrorType fallback) {
        String     id      = session.sessionId();
        ErrorType  type    = c.errorPolicy().classify(failure, fallback);
        boolean    recoverable = failure instanceof AutomationException ae ? ae.recoverable() : type.recoverable();
        boolean    fatal   = !recoverable && c.errorPolicy().isFatal(type);
        String     message = type == ErrorType.CHAT ? CHAT_FAILURE_MESSAGE : failure.getMessage();

        if (recoverable) {
            log.warn("[Session:{}] {} error: {}", id, type.wireName(), failure.getMessage());
        } else {
            log.error("[Session:{}] {} error (fatal={}): {}", id, type.wireName(), fatal,
                    failure.getMessage(), failure);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception", failure.getClass().getSimpleName());
        details.put("session_id", id);
        details.put("message", String.valueOf(failure.getMessage()));
        if (failure instanceof AutomationException ae) {
            details.putAll(ae.details());
        }

        synchronized (stateLock) {
            if (!recoverable && !closing.get()) {
                session.fail(message);
            }
            channel.send(SessionEvent.error(session.snapshot(), message, type.wireName(),
                    recoverable, details));
        }

        if (fatal) {
            close("fatal " + type.wireName() + " error");
        }
    }
}
