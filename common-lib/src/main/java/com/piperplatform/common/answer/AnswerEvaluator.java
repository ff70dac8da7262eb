package com.piperplatform.common.answer;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Judges a transcription against a card's target answers.
 *
 * <p>Speech-to-text output is noisy, so matching is lenient:
 * <ol>
 *   <li>exact match, case-insensitive</li>
 *   <li>the transcription contains the target ("it's cold!" matches "cold")</li>
 *   <li>the target contains the transcription, when the transcription has at least
 *       {@value #MIN_PARTIAL_LENGTH} characters ("the cold" target matches "cold")</li>
 *   <li>the transcription contains a known mis-hearing of the target ("called" for "cold")</li>
 * </ol>
 *
 * <p>For word-meaning categories (opposites, synonyms) a miss here may still be a
 * synonym of the target; {@link #supportsSimilarityCheck} tells the caller when a
 * semantic check is worth making.
 */
public final class AnswerEvaluator {

    static final int MIN_PARTIAL_LENGTH = 3;

    private static final Map<String, List<String>> MISHEARINGS = Map.ofEntries(
        Map.entry("cold",   List.of("called", "coal")),
        Map.entry("hot",    List.of("hat", "hut")),
        Map.entry("big",    List.of("beg", "bag")),
        Map.entry("small",  List.of("smell", "mall")),
        Map.entry("fast",   List.of("fist", "fest")),
        Map.entry("slow",   List.of("slew")),
        Map.entry("sad",    List.of("said", "sat")),
        Map.entry("tall",   List.of("toll", "tale")),
        Map.entry("short",  List.of("shirt", "shot")),
        Map.entry("light",  List.of("lite", "lit")),
        Map.entry("dark",   List.of("dock", "dork")),
        Map.entry("hard",   List.of("heart")),
        Map.entry("soft",   List.of("sought")),
        Map.entry("clean",  List.of("clene")),
        Map.entry("dirty",  List.of("thirty")),
        Map.entry("new",    List.of("knew", "nu")),
        Map.entry("old",    List.of("owed")),
        Map.entry("wet",    List.of("what")),
        Map.entry("dry",    List.of("dri", "try")),
        Map.entry("full",   List.of("fool")),
        Map.entry("empty",  List.of("empti")),
        Map.entry("loud",   List.of("allowed")),
        Map.entry("quiet",  List.of("quite")),
        Map.entry("heavy",  List.of("heave")),
        Map.entry("open",   List.of("opened")),
        Map.entry("closed", List.of("close")),
        Map.entry("down",   List.of("downed")),
        Map.entry("good",   List.of("could", "wood")),
        Map.entry("bad",    List.of("bed", "bat"))
    );

    private static final Set<String> SIMILARITY_CATEGORIES = Set.of(
        "adjectives - opposites",
        "descriptive words - opposites",
        "antonyms",
        "antonym name one - middle",
        "synonym name one - elementary",
        "synonym-name one - middle",
        "synonyms level 1"
    );

    private AnswerEvaluator() {}

    public static boolean isCorrect(String transcription, List<String> targetAnswers) {
        if (transcription == null || targetAnswers == null) {
            return false;
        }
        String heard = normalize(transcription);
        if (heard.isEmpty()) {
            return false;
        }
        return targetAnswers.stream()
            .map(AnswerEvaluator::normalize)
            .filter(target -> !target.isEmpty())
            .anyMatch(target -> matches(heard, target));
    }

    /** Categories whose answers are single descriptive words, matched case-insensitively. */
    public static boolean supportsSimilarityCheck(String category) {
        return SIMILARITY_CATEGORIES.contains(normalize(category));
    }

    static boolean matches(String heard, String target) {
        if (heard.equals(target) || heard.contains(target)) {
            return true;
        }
        if (target.contains(heard) && heard.length() >= MIN_PARTIAL_LENGTH) {
            return true;
        }
        return mishearingsOf(target).stream().anyMatch(heard::contains);
    }

    static List<String> mishearingsOf(String target) {
        return MISHEARINGS.getOrDefault(target, List.of());
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
