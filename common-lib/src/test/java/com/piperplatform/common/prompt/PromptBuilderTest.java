package com.piperplatform.common.prompt;

import com.piperplatform.common.event.SafetyEvent;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.CardContext;
import com.piperplatform.common.model.GenerationRequest;
import com.piperplatform.common.model.Intervention;
import com.piperplatform.common.model.Outcome;
import com.piperplatform.common.model.ResponseConstraints;
import com.piperplatform.common.model.SafetyLevel;
import com.piperplatform.common.model.Signal;
import com.piperplatform.common.model.TaskContext;
import com.piperplatform.common.model.TurnAssessment;
import com.piperplatform.common.planner.SessionPlanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private static final TaskContext TASK = new CardContext("Adjectives - Opposites",
        "What is the opposite of hot?", List.of("cold", "chilly"), List.of("ice cube")).toTaskContext();

    private static ResponseConstraints constraints(SafetyEvent event, SafetyLevel level) {
        return PromptBuilder.buildConstraints(event, level, SessionPlanner.plan(level));
    }

    @Nested
    @DisplayName("buildConstraints()")
    class ConstraintTests {

        @Test
        @DisplayName("correct answer at ORANGE → no choices, no feelings, 2 sentences")
        void correct_noChoicesAtAnyLevel() {
            ResponseConstraints c = constraints(SafetyEvent.response("cold", true), SafetyLevel.ORANGE);
            assertFalse(c.mustOfferChoices());
            assertFalse(c.mustValidateFeelings());
            assertEquals(2, c.maxSentences());
        }

        @Test
        @DisplayName("incorrect at GREEN → retry only, 2 sentences")
        void incorrectGreen() {
            ResponseConstraints c = constraints(SafetyEvent.response("hot", false), SafetyLevel.GREEN);
            assertFalse(c.mustOfferChoices());
            assertEquals(2, c.maxSentences());
        }

        @Test
        @DisplayName("incorrect at YELLOW → choices, 3 sentences, no feelings")
        void incorrectYellow() {
            ResponseConstraints c = constraints(SafetyEvent.response("hot", false), SafetyLevel.YELLOW);
            assertTrue(c.mustOfferChoices());
            assertFalse(c.mustValidateFeelings());
            assertEquals(3, c.maxSentences());
        }

        @Test
        @DisplayName("incorrect at ORANGE → choices and feelings")
        void incorrectOrange() {
            ResponseConstraints c = constraints(SafetyEvent.response("hot", false), SafetyLevel.ORANGE);
            assertTrue(c.mustOfferChoices());
            assertTrue(c.mustValidateFeelings());
        }

        @Test
        @DisplayName("inactivity at YELLOW is a miss → choices required")
        void inactivityYellow() {
            assertTrue(constraints(SafetyEvent.inactivity(null, null), SafetyLevel.YELLOW).mustOfferChoices());
        }

        @Test
        @DisplayName("fixed forbidden list, approach tag and tone from config")
        void fixedFields() {
            ResponseConstraints c = constraints(SafetyEvent.response("hot", false), SafetyLevel.GREEN);
            assertEquals(List.of("wrong", "incorrect", "bad", "no", "try harder", "focus"), c.forbiddenWords());
            assertEquals("describe_what_heard_offer_support", c.requiredApproach());
            assertEquals(SessionPlanner.plan(SafetyLevel.GREEN).avatarTone(), c.tone());
            assertTrue(c.mustBeBrief());
            assertTrue(c.mustNotJudge());
        }
    }

    @Nested
    @DisplayName("build()")
    class BuildTests {

        private GenerationRequest request(SafetyEvent event, BehaviorState state, SafetyLevel level,
                                          Set<Signal> signals) {
            TurnAssessment turn = TurnAssessment.of(event, signals, state, level,
                List.of(Intervention.SKIP_CARD, Intervention.RETRY_CARD), SessionPlanner.plan(level));
            return PromptBuilder.build(turn, TASK);
        }

        @Test
        @DisplayName("context carries child text, targets and attempt = errors + 1")
        void context() {
            GenerationRequest req = request(SafetyEvent.response("warm", false),
                BehaviorState.initial().withConsecutiveErrors(3), SafetyLevel.YELLOW, Set.of());

            assertEquals(Outcome.INCORRECT_RESPONSE, req.context().outcome());
            assertEquals("warm", req.context().childSaid());
            assertEquals("cold, chilly", req.context().targetWas());
            assertEquals(4, req.context().attemptNumber());
        }

        @Test
        @DisplayName("system prompt embeds utterance, target, attempt, card and choice instruction")
        void systemPrompt() {
            String prompt = request(SafetyEvent.response("warm", false),
                BehaviorState.initial().withConsecutiveErrors(3), SafetyLevel.YELLOW, Set.of()).systemPrompt();

            assertTrue(prompt.contains("Child said: \"warm\""));
            assertTrue(prompt.contains("Expected: \"cold, chilly\""));
            assertTrue(prompt.contains("Result: INCORRECT"));
            assertTrue(prompt.contains("Attempt: 4"));
            assertTrue(prompt.contains("Safety Level: YELLOW"));
            assertTrue(prompt.contains("What is the opposite of hot?"));
            assertTrue(prompt.contains("1. SKIP_CARD"));
            assertTrue(prompt.contains("MUST end with \"" + PromptBuilder.CHOICE_PROMPT + "\""));
        }

        @Test
        @DisplayName("no choice instruction for a correct answer")
        void systemPrompt_correct() {
            String prompt = request(SafetyEvent.response("cold", true),
                BehaviorState.initial(), SafetyLevel.GREEN, Set.of()).systemPrompt();

            assertTrue(prompt.contains("Result: CORRECT"));
            assertFalse(prompt.contains("CRITICAL"));
        }

        @Test
        @DisplayName("reasoning names the signals and interventions")
        void reasoning() {
            GenerationRequest req = request(SafetyEvent.response("ugh", false),
                BehaviorState.initial(), SafetyLevel.YELLOW, Set.of(Signal.FRUSTRATION));

            assertEquals("Level YELLOW due to signals: FRUSTRATION", req.reasoning().safetyLevelReason());
            assertEquals("Applying: SKIP_CARD, RETRY_CARD", req.reasoning().interventionsReason());
        }

        @Test
        @DisplayName("same assessment → identical request")
        void deterministic() {
            SafetyEvent event = SafetyEvent.response("warm", false);
            assertEquals(request(event, BehaviorState.initial(), SafetyLevel.GREEN, Set.of()),
                request(event, BehaviorState.initial(), SafetyLevel.GREEN, Set.of()));
        }
    }
}
