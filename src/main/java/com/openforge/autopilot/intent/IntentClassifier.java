package com.openforge.autopilot.intent;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-based router from free text to an {@link IntentResult}.
 *
 * Groups are scanned in priority order and the first match wins:
 *   1. filing:   tax / ITR vocabulary, refined by an action scan
 *   2. form:     generic government-form vocabulary
 *   3. help:     guidance questions
 *   4. default:  plain chat
 *
 * Matching is case-insensitive substring search; confidences are constants,
 * so the same text always yields the same result.
 */
@Component
public class IntentClassifier {

    static final List<String> FILING_KEYWORDS = List.of(
            "tax", "itr", "income tax", "filing", "return", "assessment", "tax return", "file itr");
    static final List<String> FORM_KEYWORDS = List.of(
            "form", "application", "government", "fill", "submit", "portal", "government portal");
    static final List<String> HELP_KEYWORDS = List.of(
            "help", "guide", "how", "what", "explain", "understand", "learn");

    private static final List<String> START_ACTIONS    = List.of("start", "begin", "file", "submit");
    private static final List<String> STATUS_ACTIONS   = List.of("check", "status", "verify", "review");
    private static final List<String> GUIDANCE_ACTIONS = List.of("help", "guide", "how", "explain", "understand");

    public static final String ACTION_START_FILING = "start_filing";
    public static final String ACTION_CHECK_STATUS = "check_status";
    public static final String ACTION_HELP_GUIDE   = "help_guide";

    public IntentResult classify(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);

        if (containsAny(lower, FILING_KEYWORDS)) {
            return classifyFiling(lower);
        }
        if (containsAny(lower, FORM_KEYWORDS)) {
            return new IntentResult(Intent.FORM_FILLING, true, TaskType.FORM_FILLING, null, 0.8);
        }
        if (containsAny(lower, HELP_KEYWORDS)) {
            return new IntentResult(Intent.HELP, false, TaskType.CHAT, null, 0.6);
        }
        return new IntentResult(Intent.CHAT, false, TaskType.CHAT, null, 0.5);
    }

    private IntentResult classifyFiling(String lower) {
        if (containsAny(lower, START_ACTIONS)) {
            return new IntentResult(Intent.TAX_FILING, true, TaskType.TAX_FILING, ACTION_START_FILING, 0.95);
        }
        if (containsAny(lower, STATUS_ACTIONS)) {
            return new IntentResult(Intent.TAX_FILING, true, TaskType.TAX_FILING, ACTION_CHECK_STATUS, 0.8);
        }
        if (containsAny(lower, GUIDANCE_ACTIONS)) {
            // questions about filing are answered, not automated
            return new IntentResult(Intent.HELP, false, TaskType.CHAT, ACTION_HELP_GUIDE, 0.7);
        }
        return new IntentResult(Intent.TAX_FILING, true, TaskType.TAX_FILING, null, 0.9);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }
}
