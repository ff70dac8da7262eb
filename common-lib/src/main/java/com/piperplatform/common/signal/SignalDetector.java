package com.piperplatform.common.signal;

import com.piperplatform.common.event.SafetyEvent;
import com.piperplatform.common.model.AudioCues;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.Signal;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure stateless detector that turns one {@link SafetyEvent} into a set of
 * behavioral {@link Signal}s.
 *
 * <p>Rules are applied independently; several signals may fire together:
 * <ol>
 *   <li>Audio cues map 1:1 to SCREAMING, CRYING, PROLONGED_SILENCE.</li>
 *   <li>Text cues map to WANTS_BREAK, WANTS_QUIT, FRUSTRATION, DISTRESS, either
 *       supplied by an external classifier or derived here from keyword rules.</li>
 *   <li>An incorrect response equal to the previous response is REPETITIVE_RESPONSE.</li>
 * </ol>
 *
 * <p>Returned sets iterate in {@link Signal} declaration order. No logging. No side-effects.
 */
public final class SignalDetector {

    private static final Pattern SCREAM_SOUND = Pattern.compile("a{2,}h+", Pattern.CASE_INSENSITIVE);
    private static final Pattern PUNCTUATION  = Pattern.compile("[,!?.]");
    private static final Pattern WHITESPACE   = Pattern.compile("\\s+");

    private SignalDetector() {}

    /**
     * Deterministic detection using the keyword path for text cues.
     *
     * @param event validated event
     * @return signals in declaration order; empty when nothing fired
     */
    public static Set<Signal> detect(SafetyEvent event) {
        Set<Signal> text = event.isResponse() ? detectTextSignals(event.response()) : Set.of();
        return detect(event, text);
    }

    /**
     * Detection with text cues already classified externally.
     *
     * @param event       validated event
     * @param textSignals text-derived signals from the classifier; non-text entries are ignored
     */
    public static Set<Signal> detect(SafetyEvent event, Set<Signal> textSignals) {
        EnumSet<Signal> signals = EnumSet.noneOf(Signal.class);

        AudioCues cues = event.audioCues();
        if (cues.screaming())        signals.add(Signal.SCREAMING);
        if (cues.crying())           signals.add(Signal.CRYING);
        if (cues.prolongedSilence()) signals.add(Signal.PROLONGED_SILENCE);

        if (textSignals != null) {
            textSignals.stream()
                .filter(SignalDetector::isTextSignal)
                .forEach(signals::add);
        }

        if (isRepetition(event)) {
            signals.add(Signal.REPETITIVE_RESPONSE);
        }
        return Collections.unmodifiableSet(signals);
    }

    /**
     * Keyword rules for text cues. Frustration only fires when no distress pattern matched.
     */
    public static Set<Signal> detectTextSignals(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return Set.of();
        }
        String text       = responseText.trim().toLowerCase(Locale.ROOT);
        String normalized = WHITESPACE.matcher(PUNCTUATION.matcher(text).replaceAll(" ")).replaceAll(" ");

        EnumSet<Signal> signals = EnumSet.noneOf(Signal.class);

        if (text.contains("break") || text.contains("stop") || text.contains("tired")) {
            signals.add(Signal.WANTS_BREAK);
        }
        if (text.contains("done") || text.contains("quit") || text.contains("no more")) {
            signals.add(Signal.WANTS_QUIT);
        }

        boolean distress = normalized.contains("no no no")
            || text.contains("scream")
            || text.contains("yell")
            || SCREAM_SOUND.matcher(text).find()
            || text.contains("[crying]");
        if (distress) {
            signals.add(Signal.DISTRESS);
        } else if (text.contains("ugh") || text.contains("argh")) {
            signals.add(Signal.FRUSTRATION);
        }
        return Collections.unmodifiableSet(signals);
    }

    /**
     * Appends state-derived signals after the state update. The input set is not modified.
     */
    public static Set<Signal> withStateSignals(Set<Signal> signals, BehaviorState state) {
        if (state.consecutiveErrors() < 3) {
            return signals;
        }
        EnumSet<Signal> merged = signals.isEmpty()
            ? EnumSet.noneOf(Signal.class) : EnumSet.copyOf(signals);
        merged.add(Signal.CONSECUTIVE_ERRORS);
        return Collections.unmodifiableSet(merged);
    }

    /** Strictly consecutive: only the immediately preceding response is compared. */
    static boolean isRepetition(SafetyEvent event) {
        if (!event.isResponse() || event.correct()) {
            return false;
        }
        return sameAnswer(event.response(), event.previousResponse());
    }

    /** Case- and surrounding-whitespace-insensitive comparison; blank never matches. */
    public static boolean sameAnswer(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            return false;
        }
        return a.trim().equalsIgnoreCase(b.trim());
    }

    private static boolean isTextSignal(Signal signal) {
        return switch (signal) {
            case WANTS_BREAK, WANTS_QUIT, FRUSTRATION, DISTRESS -> true;
            case SCREAMING, CRYING, PROLONGED_SILENCE, REPETITIVE_RESPONSE, CONSECUTIVE_ERRORS -> false;
        };
    }
}
