package com.openforge.autopilot.intent;

/**
 * Routing decision for one chat message.
 *
 * @param intent             what the user is after
 * @param requiresAutomation true → dispatch to the browser agent; false → reply directly
 * @param taskType           task family used to pick the task template
 * @param action             optional refinement inside the task family (e.g. "start_filing")
 * @param confidence         fixed per-rule constant in [0, 1]
 */
public record IntentResult(
        Intent   intent,
        boolean  requiresAutomation,
        TaskType taskType,
        String   action,
        double   confidence
) {}
