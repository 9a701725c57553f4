package com.openforge.autopilot.telemetry;

import com.openforge.autopilot.event.EventType;
import com.openforge.autopilot.event.SessionEvent;
import com.openforge.autopilot.session.SessionSnapshot;
import com.openforge.autopilot.session.SessionStatus;
import com.openforge.autopilot.support.FakeBrowserAgent;
import com.openforge.autopilot.support.RecordingEventChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryStreamTest {

    private static final Duration WAIT     = Duration.ofSeconds(5);
    private static final Duration INTERVAL = Duration.ofMillis(20);

    private final RecordingEventChannel   channel    = new RecordingEventChannel();
    private final AtomicBoolean           registered = new AtomicBoolean(true);
    private final List<CaptureException>  errors     = new CopyOnWriteArrayList<>();
    private final SessionSnapshot         state      = new SessionSnapshot(
            "s-1", SessionStatus.CONNECTED, null, 0, null, null, Instant.now());

    private ExecutorService executor;
    private FakeBrowserAgent agent;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        agent = new FakeBrowserAgent();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private TelemetryStream stream() {
        return new TelemetryStream("s-1", agent, channel, () -> state, registered::get,
                errors::add, INTERVAL, 70, Clock.systemUTC());
    }

    @Test
    void emitsScreenshotEventsWithPageDetails() throws Exception {
        agent.withPage().screenshots(() -> Optional.of("jpeg".getBytes()));
        TelemetryStream stream = stream();

        stream.start(executor);
        SessionEvent shot = channel.await(EventType.SCREENSHOT, WAIT);
        stream.cancelAndAwait(WAIT);

        assertThat(Base64.getDecoder().decode(shot.screenshot())).isEqualTo("jpeg".getBytes());
        assertThat(shot.title()).isEqualTo("Income Tax Portal");
        assertThat(shot.sessionId()).isEqualTo("s-1");
        assertThat(shot.message()).isEqualTo("Screenshot update");
    }

    @Test
    void waitsWhileTheAgentHasNoPage() throws Exception {
        TelemetryStream stream = stream();

        stream.start(executor);
        Thread.sleep(150);
        stream.cancelAndAwait(WAIT);

        assertThat(channel.events()).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    void captureFailureGoesToTheErrorSinkAndLoopKeepsRunning() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        agent.withPage().screenshots(() -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new IllegalStateException("page is navigating");
            }
            return Optional.of(new byte[]{7});
        });
        TelemetryStream stream = stream();

        stream.start(executor);
        channel.await(EventType.SCREENSHOT, WAIT);
        stream.cancelAndAwait(WAIT);

        assertThat(errors).hasSize(2);
        assertThat(errors.get(0)).hasMessageContaining("page is navigating");
        assertThat(errors.get(0).errorType().wireName()).isEqualTo("screenshot");
    }

    @Test
    void cancelAndAwaitReturnsOnlyAfterTheLoopExited() throws Exception {
        agent.withPage();
        TelemetryStream stream = stream();
        stream.start(executor);
        channel.await(EventType.SCREENSHOT, WAIT);

        boolean terminated = stream.cancelAndAwait(WAIT);
        int count = channel.events().size();
        Thread.sleep(100);

        assertThat(terminated).isTrue();
        assertThat(stream.isCancelled()).isTrue();
        assertThat(stream.isTerminated()).isTrue();
        assertThat(channel.events()).hasSize(count);
    }

    @Test
    void exitsOnItsOwnOnceTheSessionIsDeregistered() throws Exception {
        agent.withPage();
        TelemetryStream stream = stream();
        stream.start(executor);
        channel.await(EventType.SCREENSHOT, WAIT);

        registered.set(false);
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!stream.isTerminated() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        assertThat(stream.isTerminated()).isTrue();
        assertThat(stream.isCancelled()).isFalse();
    }

    @Test
    void cancellingAStreamThatNeverStartedReturnsImmediately() throws Exception {
        assertThat(stream().cancelAndAwait(Duration.ofMillis(10))).isTrue();
    }

    @Test
    void startIsOneShot() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        TelemetryStream stream = stream();

        stream.start(task -> {
            executions.incrementAndGet();
            executor.execute(task);
        });
        stream.start(task -> executions.incrementAndGet());
        stream.cancelAndAwait(WAIT);

        assertThat(executions).hasValue(1);
    }

    @Test
    void captureWrapsUnexpectedFailures() {
        agent.withPage().screenshots(() -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> stream().capture())
                .isInstanceOf(CaptureException.class)
                .hasMessageContaining("boom");
    }
}
