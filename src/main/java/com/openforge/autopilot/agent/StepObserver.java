package com.openforge.autopilot.agent;

/**
 * Step callbacks invoked by a running {@link BrowserAgent}.
 *
 * Implementations must not throw: a failure while reporting a step is logged
 * by the implementation and never aborts the agent's run.
 */
public interface StepObserver {

    /** Called before the agent decides and performs step N. */
    void onStepStart(BrowserAgent agent);

    /** Called after step N was performed and recorded. */
    void onStepEnd(BrowserAgent agent);

    StepObserver NONE = new StepObserver() {
        @Override
        public void onStepStart(BrowserAgent agent) {}

        @Override
        public void onStepEnd(BrowserAgent agent) {}
    };
}
