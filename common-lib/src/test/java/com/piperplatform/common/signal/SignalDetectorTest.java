package com.piperplatform.common.signal;

import com.piperplatform.common.event.SafetyEvent;
import com.piperplatform.common.model.AudioCues;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link SignalDetector}.
 */
class SignalDetectorTest {

    @Nested
    @DisplayName("detect(): audio cues")
    class AudioCueTests {

        @Test
        @DisplayName("no cues and neutral text → empty set")
        void neutralResponse_noSignals() {
            assertTrue(SignalDetector.detect(SafetyEvent.response("cold", true)).isEmpty());
        }

        @Test
        @DisplayName("audio flags map 1:1 to SCREAMING, CRYING, PROLONGED_SILENCE")
        void audioFlags_mapOneToOne() {
            SafetyEvent event = SafetyEvent.response("cat", false, null, null,
                new AudioCues(true, true, true));

            assertEquals(List.of(Signal.SCREAMING, Signal.CRYING, Signal.PROLONGED_SILENCE),
                List.copyOf(SignalDetector.detect(event)));
        }

        @Test
        @DisplayName("inactivity event carries no text signals")
        void inactivity_noTextSignals() {
            assertTrue(SignalDetector.detect(SafetyEvent.inactivity("stop", "stop")).isEmpty());
        }
    }

    @Nested
    @DisplayName("detectTextSignals(): keyword rules")
    class KeywordTests {

        @Test
        @DisplayName("'I need a break' → WANTS_BREAK")
        void breakKeyword() {
            assertEquals(Set.of(Signal.WANTS_BREAK), SignalDetector.detectTextSignals("I need a break"));
        }

        @Test
        @DisplayName("'I'm done' → WANTS_QUIT")
        void quitKeyword() {
            assertEquals(Set.of(Signal.WANTS_QUIT), SignalDetector.detectTextSignals("I'm done"));
        }

        @Test
        @DisplayName("'stop, no more' → WANTS_BREAK and WANTS_QUIT together")
        void breakAndQuit_bothFire() {
            assertEquals(Set.of(Signal.WANTS_BREAK, Signal.WANTS_QUIT),
                SignalDetector.detectTextSignals("stop, no more"));
        }

        @Test
        @DisplayName("'No, no, no!' → DISTRESS after punctuation normalization")
        void noNoNo_distress() {
            assertEquals(Set.of(Signal.DISTRESS), SignalDetector.detectTextSignals("No, no, no!"));
        }

        @Test
        @DisplayName("'aaaahhh' → DISTRESS")
        void screamSound_distress() {
            assertTrue(SignalDetector.detectTextSignals("aaaahhh").contains(Signal.DISTRESS));
        }

        @Test
        @DisplayName("'ugh' → FRUSTRATION")
        void ugh_frustration() {
            assertEquals(Set.of(Signal.FRUSTRATION), SignalDetector.detectTextSignals("ugh"));
        }

        @Test
        @DisplayName("distress suppresses frustration")
        void distress_suppressesFrustration() {
            Set<Signal> signals = SignalDetector.detectTextSignals("argh [crying]");
            assertTrue(signals.contains(Signal.DISTRESS));
            assertFalse(signals.contains(Signal.FRUSTRATION));
        }

        @Test
        @DisplayName("blank text → empty set")
        void blank_empty() {
            assertTrue(SignalDetector.detectTextSignals("  ").isEmpty());
        }
    }

    @Nested
    @DisplayName("repetition")
    class RepetitionTests {

        @Test
        @DisplayName("same wrong answer as previous → REPETITIVE_RESPONSE")
        void sameWrongAnswer_repetitive() {
            SafetyEvent event = SafetyEvent.response("hot", false, "hot", null, AudioCues.NONE);
            assertEquals(Set.of(Signal.REPETITIVE_RESPONSE), SignalDetector.detect(event));
        }

        @Test
        @DisplayName("comparison ignores case and surrounding whitespace")
        void repetition_caseInsensitive() {
            SafetyEvent event = SafetyEvent.response(" Hot ", false, "hot", null, AudioCues.NONE);
            assertTrue(SignalDetector.detect(event).contains(Signal.REPETITIVE_RESPONSE));
        }

        @Test
        @DisplayName("correct repeated answer is not repetitive")
        void correctRepeat_notRepetitive() {
            SafetyEvent event = SafetyEvent.response("cold", true, "cold", null, AudioCues.NONE);
            assertFalse(SignalDetector.detect(event).contains(Signal.REPETITIVE_RESPONSE));
        }

        @Test
        @DisplayName("non-consecutive repeat (attempts 1 and 3) is not repetitive")
        void nonConsecutive_notRepetitive() {
            SafetyEvent event = SafetyEvent.response("hot", false, "warm", "hot", AudioCues.NONE);
            assertFalse(SignalDetector.detect(event).contains(Signal.REPETITIVE_RESPONSE));
        }
    }

    @Nested
    @DisplayName("detect(event, textSignals): classified path")
    class ClassifiedPathTests {

        @Test
        @DisplayName("non-text signals from the classifier are ignored")
        void nonTextSignals_ignored() {
            Set<Signal> classified = Set.of(Signal.WANTS_BREAK, Signal.SCREAMING, Signal.CONSECUTIVE_ERRORS);
            Set<Signal> signals = SignalDetector.detect(SafetyEvent.response("cat", false), classified);
            assertEquals(Set.of(Signal.WANTS_BREAK), signals);
        }

        @Test
        @DisplayName("output iterates in declaration order")
        void stableOrder() {
            SafetyEvent event = SafetyEvent.response("hot", false, "hot", null, AudioCues.screamingOnly());
            Set<Signal> signals = SignalDetector.detect(event, Set.of(Signal.DISTRESS, Signal.WANTS_BREAK));
            assertEquals(List.of(Signal.SCREAMING, Signal.WANTS_BREAK, Signal.DISTRESS, Signal.REPETITIVE_RESPONSE),
                List.copyOf(signals));
        }
    }

    @Nested
    @DisplayName("withStateSignals()")
    class StateSignalTests {

        @Test
        @DisplayName("three consecutive errors → CONSECUTIVE_ERRORS appended")
        void threeErrors_appended() {
            Set<Signal> merged = SignalDetector.withStateSignals(Set.of(),
                BehaviorState.initial().withConsecutiveErrors(3));
            assertEquals(Set.of(Signal.CONSECUTIVE_ERRORS), merged);
        }

        @Test
        @DisplayName("two consecutive errors → set unchanged")
        void twoErrors_unchanged() {
            Set<Signal> input = Set.of(Signal.FRUSTRATION);
            assertSame(input, SignalDetector.withStateSignals(input,
                BehaviorState.initial().withConsecutiveErrors(2)));
        }
    }
}
