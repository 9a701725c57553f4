package com.openforge.autopilot.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.autopilot.session.SessionSnapshot;
import com.openforge.autopilot.session.SessionStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The single envelope sent over a session's WebSocket.
 *
 * The first nine fields mirror the session state at the moment the event was
 * produced and are always serialized, even when null. The remaining fields are
 * type-specific and omitted when absent.
 *
 * Property names are written in snake_case by the shared ObjectMapper
 * (session_id, current_task, error_type …).
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionEvent(
        @JsonInclude(JsonInclude.Include.ALWAYS) EventType     type,
        @JsonInclude(JsonInclude.Include.ALWAYS) String        message,
        @JsonInclude(JsonInclude.Include.ALWAYS) Instant       timestamp,
        @JsonInclude(JsonInclude.Include.ALWAYS) String        sessionId,
        @JsonInclude(JsonInclude.Include.ALWAYS) SessionStatus status,
        @JsonInclude(JsonInclude.Include.ALWAYS) String        currentTask,
        @JsonInclude(JsonInclude.Include.ALWAYS) int           stepCount,
        @JsonInclude(JsonInclude.Include.ALWAYS) String        currentStep,
        @JsonInclude(JsonInclude.Include.ALWAYS) String        error,

        String              errorType,
        Boolean             recoverable,
        Map<String, Object> details,
        String              url,
        String              title,
        String              screenshot,
        String              result,
        String              step,
        String              action,
        List<String>        capabilities,
        String              taskType,
        Double              confidence
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static SessionEvent connection(SessionSnapshot state, List<String> capabilities) {
        return of(EventType.CONNECTION, state, "Connected to automation service")
                .capabilities(List.copyOf(capabilities))
                .build();
    }

    public static SessionEvent statusUpdate(SessionSnapshot state, String message) {
        return of(EventType.STATUS_UPDATE, state, message).build();
    }

    public static SessionEvent automationStarting(SessionSnapshot state, String taskType,
                                                  double confidence, String action) {
        String message = "Starting %s automation... (Confidence: %.0f%%)"
                .formatted(taskType, confidence * 100);
        return of(EventType.STATUS_UPDATE, state, message)
                .taskType(taskType)
                .confidence(confidence)
                .action(action)
                .build();
    }

    public static SessionEvent typing(SessionSnapshot state) {
        return of(EventType.TYPING, state, "Thinking...").build();
    }

    public static SessionEvent chatResponse(SessionSnapshot state, String reply) {
        return of(EventType.CHAT_RESPONSE, state, reply).build();
    }

    public static SessionEvent stepStart(SessionSnapshot state, String url, String title) {
        return of(EventType.STEP_START, state, "Starting step " + state.stepCount())
                .url(url)
                .title(title)
                .step(state.currentStep())
                .build();
    }

    public static SessionEvent stepComplete(SessionSnapshot state, String url, String title,
                                            String lastAction) {
        return of(EventType.STEP_COMPLETE, state, "Completed step " + state.stepCount())
                .url(url)
                .title(title)
                .action(lastAction)
                .build();
    }

    public static SessionEvent taskComplete(SessionSnapshot state, String result) {
        return of(EventType.TASK_COMPLETE, state, "Task completed successfully")
                .result(result)
                .build();
    }

    public static SessionEvent screenshot(SessionSnapshot state, String base64Jpeg,
                                          String url, String title) {
        return of(EventType.SCREENSHOT, state, "Screenshot update")
                .screenshot(base64Jpeg)
                .url(url)
                .title(title)
                .build();
    }

    public static SessionEvent error(SessionSnapshot state, String message, String errorType,
                                     boolean recoverable, Map<String, Object> details) {
        return of(EventType.ERROR, state, message)
                .errorType(errorType)
                .recoverable(recoverable)
                .details(details)
                .build();
    }

    private static SessionEventBuilder of(EventType type, SessionSnapshot state, String message) {
        return SessionEvent.builder()
                .type(type)
                .message(message)
                .timestamp(Instant.now())
                .sessionId(state.sessionId())
                .status(state.status())
                .currentTask(state.currentTask())
                .stepCount(state.stepCount())
                .currentStep(state.currentStep())
                .error(state.error());
    }
}
