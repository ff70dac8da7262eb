package com.piperplatform.common.validation;

import com.piperplatform.common.model.CoachGeneration;
import com.piperplatform.common.model.ResponseConstraints;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic checks of a generated coaching line against its {@link ResponseConstraints}.
 *
 * <ul>
 *   <li>{@code length_appropriate}: at most {@value #MAX_WORDS} words</li>
 *   <li>{@code no_forbidden_words}: no forbidden word as a case-insensitive substring</li>
 *   <li>{@code non_judgmental}: no judgmental phrasing</li>
 *   <li>{@code sentences_within_limit}: sentence count (split on . ! ?) within the limit</li>
 *   <li>{@code choices_included}: non-empty choice presentation when choices are required</li>
 * </ul>
 */
public final class ResponseValidator {

    public static final int MAX_WORDS = 30;

    public static final String LENGTH_APPROPRIATE     = "length_appropriate";
    public static final String NO_FORBIDDEN_WORDS     = "no_forbidden_words";
    public static final String NON_JUDGMENTAL         = "non_judgmental";
    public static final String SENTENCES_WITHIN_LIMIT = "sentences_within_limit";
    public static final String CHOICES_INCLUDED       = "choices_included";

    private static final List<Pattern> JUDGMENTAL_PATTERNS = List.of(
        Pattern.compile("you\\s+(should|must|need\\s+to)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("that'?s\\s+(wrong|incorrect|bad)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(try\\s+harder|focus\\s+better)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("why\\s+(did|didn't)\\s+you", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern WORD_SPLIT     = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");

    private ResponseValidator() {}

    public static ValidationResult validate(CoachGeneration candidate, ResponseConstraints constraints) {
        String line = candidate.coachLine() == null ? "" : candidate.coachLine();

        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(LENGTH_APPROPRIATE, wordCount(line) <= MAX_WORDS);
        checks.put(NO_FORBIDDEN_WORDS, !containsForbiddenWord(line, constraints.forbiddenWords()));
        checks.put(NON_JUDGMENTAL, !isJudgmental(line));
        checks.put(SENTENCES_WITHIN_LIMIT, sentenceCount(line) <= constraints.maxSentences());
        checks.put(CHOICES_INCLUDED, !constraints.mustOfferChoices()
            || (candidate.choicePresentation() != null && !candidate.choicePresentation().isBlank()));

        List<String> failed = checks.entrySet().stream()
            .filter(e -> !e.getValue())
            .map(Map.Entry::getKey)
            .toList();

        boolean valid = failed.isEmpty() && !line.isBlank();
        String reason = null;
        if (line.isBlank()) {
            reason = "Empty coach line";
        } else if (!failed.isEmpty()) {
            reason = "Failed checks: " + String.join(", ", failed);
        }
        return new ValidationResult(valid, Collections.unmodifiableMap(checks), failed, reason);
    }

    static int wordCount(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() ? 0 : WORD_SPLIT.split(trimmed).length;
    }

    static int sentenceCount(String line) {
        int count = 0;
        for (String part : SENTENCE_SPLIT.split(line)) {
            if (!part.isBlank()) count++;
        }
        return count;
    }

    static boolean containsForbiddenWord(String line, List<String> forbiddenWords) {
        String text = line.toLowerCase(Locale.ROOT);
        return forbiddenWords.stream()
            .anyMatch(word -> text.contains(word.toLowerCase(Locale.ROOT)));
    }

    static boolean isJudgmental(String line) {
        return JUDGMENTAL_PATTERNS.stream().anyMatch(p -> p.matcher(line).find());
    }
}
