package com.openforge.autopilot.agent;

import java.util.Optional;

/**
 * Handle to one running agent and the browser it drives.
 *
 * The accessors are best-effort: before the agent has a page, or while the
 * browser is busy, they return empty. Callers treat empty as "not ready yet",
 * never as an error.
 */
public interface BrowserAgent {

    /**
     * Runs {@code task} to completion, reporting each step to {@code observer}.
     *
     * @throws AgentRunException when the task fails ({@link BrowserException} when the
     *                           browser itself is gone)
     */
    AgentResult run(String task, StepObserver observer);

    /** Asks a running task to stop after the current step. Safe to call at any time. */
    void stop();

    /** Releases the browser. Idempotent. */
    void close();

    boolean hasPageContext();

    Optional<String> currentUrl();

    Optional<String> currentTitle();

    /** Label of the step in progress, e.g. "3". */
    Optional<String> currentStepLabel();

    /** Result text of the most recently recorded action. */
    Optional<String> lastActionResult();

    /**
     * Captures the visible viewport as JPEG.
     *
     * @param quality JPEG quality, 0–100
     * @return empty when there is no page yet
     * @throws com.openforge.autopilot.telemetry.CaptureException when the page exists but capture failed
     */
    Optional<byte[]> captureScreenshot(int quality);
}
