package com.openforge.autopilot.telemetry;

import com.openforge.autopilot.agent.BrowserAgent;
import com.openforge.autopilot.channel.EventChannel;
import com.openforge.autopilot.event.SessionEvent;
import com.openforge.autopilot.session.SessionSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Background screenshot loop of one session.
 *
 * Loop shape:
 *   while not cancelled:
 *     1. session no longer registered → exit
 *     2. agent has no page yet        → skip this tick
 *     3. capture JPEG + url + title   → screenshot event
 *        capture failed               → hand to the error sink, keep looping
 *     4. wait one interval (woken early by cancel)
 *
 * Cancellation is cooperative: {@link #cancelAndAwait} signals the loop and
 * blocks until the loop thread has really exited, so the caller can release
 * the channel and the agent afterwards without racing a last write.
 */
@Slf4j
public class TelemetryStream implements Runnable {

    private final String                    sessionId;
    private final BrowserAgent              agent;
    private final EventChannel              channel;
    private final Supplier<SessionSnapshot> state;
    private final BooleanSupplier           registered;
    private final Consumer<CaptureException> errorSink;
    private final Duration                  interval;
    private final int                       jpegQuality;
    private final Clock                     clock;

    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final CountDownLatch terminated   = new CountDownLatch(1);
    private final AtomicBoolean  started      = new AtomicBoolean();

    public TelemetryStream(String sessionId,
                           BrowserAgent agent,
                           EventChannel channel,
                           Supplier<SessionSnapshot> state,
                           BooleanSupplier registered,
                           Consumer<CaptureException> errorSink,
                           Duration interval,
                           int jpegQuality,
                           Clock clock) {
        this.sessionId   = sessionId;
        this.agent       = agent;
        this.channel     = channel;
        this.state       = state;
        this.registered  = registered;
        this.errorSink   = errorSink;
        this.interval    = interval;
        this.jpegQuality = jpegQuality;
        this.clock       = clock;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /** Schedules the loop once. Later calls are ignored. */
    public void start(Executor executor) {
        if (!started.compareAndSet(false, true)) return;
        try {
            executor.execute(this);
        } catch (RejectedExecutionException e) {
            log.error("[Telemetry:{}] Executor rejected the stream: {}", sessionId, e.getMessage());
            terminated.countDown();
        }
    }

    /**
     * Signals the loop to stop and waits until it has exited.
     *
     * @return true when the loop is known to be terminated (or never started)
     */
    public boolean cancelAndAwait(Duration timeout) throws InterruptedException {
        cancelSignal.countDown();
        if (!started.get()) return true;
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isCancelled() {
        return cancelSignal.getCount() == 0;
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    // ── Loop ─────────────────────────────────────────────────────────────────

    @Override
    public void run() {
        log.debug("[Telemetry:{}] Stream started, interval={}", sessionId, interval);
        try {
            while (!isCancelled()) {
                if (!registered.getAsBoolean()) {
                    log.debug("[Telemetry:{}] Session no longer registered, exiting", sessionId);
                    break;
                }
                if (agent.hasPageContext()) {
                    tick();
                }
                if (cancelSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("[Telemetry:{}] Stream died: {}", sessionId, e.getMessage(), e);
        } finally {
            terminated.countDown();
            log.debug("[Telemetry:{}] Stream terminated", sessionId);
        }
    }

    private void tick() {
        Optional<TelemetrySnapshot> snapshot;
        try {
            snapshot = capture();
        } catch (CaptureException e) {
            log.error("[Telemetry:{}] Screenshot capture error: {}", sessionId, e.getMessage());
            if (!isCancelled()) {
                errorSink.accept(e);
            }
            return;
        }
        snapshot.ifPresent(s -> {
            if (!isCancelled()) {
                channel.send(SessionEvent.screenshot(state.get(), s.base64(), s.url(), s.title()));
            }
        });
    }

    /** One capture; empty when the page disappeared between the readiness check and now. */
    Optional<TelemetrySnapshot> capture() {
        try {
            Optional<byte[]> jpeg = agent.captureScreenshot(jpegQuality);
            if (jpeg.isEmpty()) return Optional.empty();
            return Optional.of(new TelemetrySnapshot(
                    jpeg.get(),
                    agent.currentUrl().orElse(null),
                    agent.currentTitle().orElse(null),
                    clock.instant()));
        } catch (CaptureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CaptureException("Screenshot capture failed: " + e.getMessage(), e);
        }
    }
}
