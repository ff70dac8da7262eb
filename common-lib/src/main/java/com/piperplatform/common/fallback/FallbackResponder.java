package com.piperplatform.common.fallback;

import com.piperplatform.common.model.Outcome;
import com.piperplatform.common.model.SafetyLevel;
import com.piperplatform.common.prompt.PromptBuilder;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic coaching text used whenever generation is skipped, fails or is rejected,
 * and the choice-prompt enforcement applied to every emitted line.
 */
public final class FallbackResponder {

    static final String CORRECT_LINE          = "Great job! You got it!";
    static final String INACTIVE_LINE         = "Are you still there? Take your time!";
    static final String RETRY_LINE            = "I heard you! Let's try again!";
    static final String ENCOURAGE_CHOICE_LINE = "I heard you! Good try!";

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?\\s]+$");

    private FallbackResponder() {}

    /**
     * @param outcome what happened this turn
     * @param level   assessed level
     * @return a short line; ends with the choice prompt for a miss at YELLOW or above
     */
    public static String fallbackLine(Outcome outcome, SafetyLevel level) {
        boolean choices = level.isAtLeast(SafetyLevel.YELLOW);
        return switch (outcome) {
            case CORRECT_RESPONSE   -> CORRECT_LINE;
            case CHILD_INACTIVE     -> choices ? withChoice(INACTIVE_LINE) : INACTIVE_LINE;
            case INCORRECT_RESPONSE -> choices ? withChoice(ENCOURAGE_CHOICE_LINE) : RETRY_LINE;
        };
    }

    /**
     * Appends the choice prompt unless the line already ends with it.
     */
    public static String ensureChoicePrompt(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (endsWithChoicePrompt(trimmed)) {
            return trimmed;
        }
        String body = TRAILING_PUNCTUATION.matcher(trimmed).replaceAll("");
        return body.isEmpty() ? PromptBuilder.CHOICE_PROMPT : body + "! " + PromptBuilder.CHOICE_PROMPT;
    }

    public static boolean endsWithChoicePrompt(String line) {
        return line != null && line.trim().toLowerCase(Locale.ROOT)
            .endsWith(PromptBuilder.CHOICE_PROMPT.toLowerCase(Locale.ROOT));
    }

    private static String withChoice(String line) {
        return line + " " + PromptBuilder.CHOICE_PROMPT;
    }
}
