package com.openforge.autopilot.support;

import com.openforge.autopilot.agent.AgentResult;
import com.openforge.autopilot.agent.BrowserAgent;
import com.openforge.autopilot.agent.StepObserver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scriptable {@link BrowserAgent}.
 *
 * A run performs {@code steps} steps, calling the observer around each one.
 * A step can be held open with {@link #holdStep(int)} until {@link #releaseStep()},
 * and the run can be made to fail with {@link #failWith}.
 */
public class FakeBrowserAgent implements BrowserAgent {

    private final List<String>  tasks      = new CopyOnWriteArrayList<>();
    private final AtomicInteger stopCalls  = new AtomicInteger();
    private final AtomicInteger closeCalls = new AtomicInteger();

    private volatile int      steps = 2;
    private volatile String   result = "Task finished";
    private volatile RuntimeException failure;
    private volatile int      heldStep = -1;
    private volatile boolean  stopRequested;
    private volatile boolean  pageContext;
    private volatile String   stepLabel;
    private volatile Supplier<Optional<byte[]>> screenshots = () -> Optional.of(new byte[]{1, 2, 3});

    private final CountDownLatch stepHeld    = new CountDownLatch(1);
    private final CountDownLatch stepRelease = new CountDownLatch(1);
    private final CountDownLatch runEnded    = new CountDownLatch(1);

    public FakeBrowserAgent steps(int steps) {
        this.steps = steps;
        return this;
    }

    public FakeBrowserAgent result(String result) {
        this.result = result;
        return this;
    }

    public FakeBrowserAgent failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    /** Blocks the run inside {@code step}, between onStepStart and onStepEnd. */
    public FakeBrowserAgent holdStep(int step) {
        this.heldStep = step;
        return this;
    }

    public FakeBrowserAgent withPage() {
        this.pageContext = true;
        return this;
    }

    public FakeBrowserAgent screenshots(Supplier<Optional<byte[]>> screenshots) {
        this.screenshots = screenshots;
        return this;
    }

    public boolean awaitStepHeld(long millis) throws InterruptedException {
        return stepHeld.await(millis, TimeUnit.MILLISECONDS);
    }

    public void releaseStep() {
        stepRelease.countDown();
    }

    public boolean awaitRunEnded(long millis) throws InterruptedException {
        return runEnded.await(millis, TimeUnit.MILLISECONDS);
    }

    public List<String> tasks() {
        return new ArrayList<>(tasks);
    }

    public int stopCalls() {
        return stopCalls.get();
    }

    public int closeCalls() {
        return closeCalls.get();
    }

    @Override
    public AgentResult run(String task, StepObserver observer) {
        tasks.add(task);
        stopRequested = false;
        List<String> actions = new ArrayList<>();
        try {
            for (int step = 1; step <= steps; step++) {
                if (stopRequested) {
                    return AgentResult.stopped(step - 1, actions);
                }
                stepLabel = String.valueOf(step);
                observer.onStepStart(this);
                if (step == heldStep) {
                    stepHeld.countDown();
                    try {
                        stepRelease.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                if (failure != null) {
                    throw failure;
                }
                actions.add("action " + step);
                observer.onStepEnd(this);
            }
            if (stopRequested) {
                return AgentResult.stopped(steps, actions);
            }
            return AgentResult.done(result, true, steps, actions);
        } finally {
            runEnded.countDown();
        }
    }

    @Override
    public void stop() {
        stopCalls.incrementAndGet();
        stopRequested = true;
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
        pageContext = false;
    }

    @Override
    public boolean hasPageContext() {
        return pageContext;
    }

    @Override
    public Optional<String> currentUrl() {
        return Optional.of("https://portal.example/step/" + stepLabel);
    }

    @Override
    public Optional<String> currentTitle() {
        return Optional.of("Income Tax Portal");
    }

    @Override
    public Optional<String> currentStepLabel() {
        return Optional.ofNullable(stepLabel);
    }

    @Override
    public Optional<String> lastActionResult() {
        return stepLabel == null ? Optional.empty() : Optional.of("action " + stepLabel);
    }

    @Override
    public Optional<byte[]> captureScreenshot(int quality) {
        return screenshots.get();
    }
}
