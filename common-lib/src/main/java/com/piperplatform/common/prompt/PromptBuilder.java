package com.piperplatform.common.prompt;

import com.piperplatform.common.event.SafetyEvent;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.GenerationRequest;
import com.piperplatform.common.model.Intervention;
import com.piperplatform.common.model.Outcome;
import com.piperplatform.common.model.ResponseConstraints;
import com.piperplatform.common.model.ResponseContext;
import com.piperplatform.common.model.ResponseReasoning;
import com.piperplatform.common.model.SafetyLevel;
import com.piperplatform.common.model.SessionConfig;
import com.piperplatform.common.model.Signal;
import com.piperplatform.common.model.TaskContext;
import com.piperplatform.common.model.TurnAssessment;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Assembles the natural-language system prompt and the machine-checkable
 * {@link ResponseConstraints} for one turn.
 *
 * <p>Pure: the same assessment and task always produce the same request.
 */
public final class PromptBuilder {

    public static final String CHOICE_PROMPT = "What would you like to do?";

    private PromptBuilder() {}

    public static GenerationRequest build(TurnAssessment turn, TaskContext task) {
        ResponseContext     context     = buildContext(turn.event(), turn.state(), task);
        ResponseConstraints constraints = buildConstraints(turn.event(), turn.level(), turn.sessionConfig());
        ResponseReasoning   reasoning   = buildReasoning(turn.level(), turn.interventions(), turn.signals());
        String prompt = buildSystemPrompt(turn, context, constraints);
        return new GenerationRequest(prompt, context, constraints, reasoning);
    }

    // ── context / constraints / reasoning ───────────────────────────────────

    public static ResponseContext buildContext(SafetyEvent event, BehaviorState state, TaskContext task) {
        Outcome outcome = outcomeOf(event);
        return new ResponseContext(
            outcome,
            event.response() != null ? event.response() : "",
            task != null && task.targetAnswer() != null ? task.targetAnswer() : "",
            state.consecutiveErrors() + 1,
            task);
    }

    /**
     * Choices are required for a miss (incorrect answer or inactivity) at YELLOW or above;
     * feelings must be validated for a miss at ORANGE or above.
     */
    public static ResponseConstraints buildConstraints(SafetyEvent event, SafetyLevel level, SessionConfig config) {
        boolean miss          = event.isMiss();
        boolean offerChoices  = miss && level.isAtLeast(SafetyLevel.YELLOW);
        boolean validateFeels = miss && level.isAtLeast(SafetyLevel.ORANGE);
        return new ResponseConstraints(
            true,
            true,
            offerChoices,
            validateFeels,
            offerChoices ? 3 : 2,
            ResponseConstraints.FORBIDDEN_WORDS,
            ResponseConstraints.REQUIRED_APPROACH,
            config.avatarTone());
    }

    public static ResponseReasoning buildReasoning(SafetyLevel level, List<Intervention> interventions,
                                                   Set<Signal> signals) {
        String signalList = signals.isEmpty() ? "none"
            : signals.stream().map(Signal::name).collect(Collectors.joining(", "));
        return new ResponseReasoning(
            "Level " + level + " due to signals: " + signalList,
            interventions.isEmpty() ? "No interventions needed"
                : "Applying: " + interventions.stream().map(Intervention::name).collect(Collectors.joining(", ")));
    }

    public static Outcome outcomeOf(SafetyEvent event) {
        return switch (event.type()) {
            case RESPONSE_RECEIVED -> event.correct() ? Outcome.CORRECT_RESPONSE : Outcome.INCORRECT_RESPONSE;
            case INACTIVITY_FIRED  -> Outcome.CHILD_INACTIVE;
        };
    }

    // ── system prompt ───────────────────────────────────────────────────────

    static String buildSystemPrompt(TurnAssessment turn, ResponseContext context,
                                    ResponseConstraints constraints) {
        SessionConfig config = turn.sessionConfig();
        String style    = intensityStyle(config.promptIntensity());
        String guidance = intensityGuidance(config.promptIntensity());
        String rules    = feedbackRules(turn.level(), context.childSaid(), config.promptIntensity());

        String actions = IntStream.range(0, turn.interventions().size())
            .mapToObj(i -> (i + 1) + ". " + turn.interventions().get(i))
            .collect(Collectors.joining("\n"));

        String cardSection = "";
        if (context.task() != null) {
            TaskContext task = context.task();
            cardSection = """

                ## CARD
                - Category: %s
                - Question: %s
                - Pictures: %s
                """.formatted(task.category(), task.question(),
                              task.imageLabels().isEmpty() ? "none" : String.join(", ", task.imageLabels()));
        }

        String feelings = constraints.mustValidateFeelings()
            ? "- Acknowledge that this feels hard before anything else\n" : "";

        String coachExample = constraints.mustOfferChoices()
            ? "I heard '[child_word]'. [encouragement]! " + CHOICE_PROMPT
            : "I heard '[child_word]'. [encouragement]!";

        String choiceWarning = constraints.mustOfferChoices()
            ? "CRITICAL: Your coach_line MUST end with \"" + CHOICE_PROMPT + "\" because choices are being displayed!\n"
            : "";

        return """
            # PIPER - Speech Therapy Coach

            You help children practice speech. %s

            ## SITUATION
            - Child said: "%s"
            - Expected: "%s"
            - Result: %s
            - Attempt: %d
            - Safety Level: %s
            - Tone: %s
            %s
            ## FEEDBACK STYLE
            %s
            ## FEEDBACK RULES
            %s

            ### Never say:
            %s

            ### Never:
            - Explain the answer or give hints
            - Use complex sentences
            - Sound disappointed
            - Use more than %d sentences
            %s
            ## AVAILABLE ACTIONS
            %s

            ## RESPONSE (JSON only)
            {
              "coach_line": "%s",
              "choice_presentation": "%s"
            }
            %s""".formatted(
                style,
                context.childSaid(),
                context.targetWas(),
                resultLabel(context.outcome()),
                context.attemptNumber(),
                turn.level(),
                constraints.tone().label(),
                cardSection,
                guidance,
                rules,
                String.join(", ", constraints.forbiddenWords()),
                constraints.maxSentences(),
                feelings,
                actions,
                coachExample,
                constraints.mustOfferChoices() ? CHOICE_PROMPT : "",
                choiceWarning);
    }

    private static String resultLabel(Outcome outcome) {
        return switch (outcome) {
            case CORRECT_RESPONSE   -> "CORRECT";
            case INCORRECT_RESPONSE -> "INCORRECT";
            case CHILD_INACTIVE     -> "NO RESPONSE";
        };
    }

    static String intensityStyle(int intensity) {
        return switch (intensity) {
            case 0  -> "Keep feedback EXTREMELY brief. One short sentence only.";
            case 1  -> "Keep feedback very short and gentle.";
            case 3  -> "Be encouraging and celebratory!";
            default -> "Keep feedback VERY SHORT and encouraging.";
        };
    }

    static String intensityGuidance(int intensity) {
        return switch (intensity) {
            case 0 -> """
                - Use absolute minimum words
                - No teaching or explaining
                - Just acknowledge and offer choices
                - Focus on comfort, not correction
                """;
            case 1 -> """
                - Use simple, brief sentences
                - Avoid any pressure to perform
                - Gentle encouragement only
                - Don't emphasize the mistake
                """;
            case 3 -> """
                - Use enthusiastic, warm language
                - Celebrate effort and progress
                - Keep energy positive and fun
                """;
            default -> """
                - Simple, clear feedback
                - Brief encouragement
                - Acknowledge what they said
                - Keep it positive
                """;
        };
    }

    static String feedbackRules(SafetyLevel level, String childSaid, int intensity) {
        String word = childSaid == null || childSaid.isBlank() ? "[child_word]" : childSaid;
        boolean minimal = intensity <= 1;

        String correct = minimal
            ? """
              If CORRECT:
              - "I heard '%1$s'. Great!"
              - "You said '%1$s'. Yes!"
              """.formatted(word)
            : """
              If CORRECT:
              - "I heard '%1$s'. Great job!"
              - "You said '%1$s'. Awesome!"
              """.formatted(word);

        String incorrect = switch (level) {
            case GREEN -> """
                If INCORRECT (keep it light):
                - "I heard '%1$s'. Let's try again!"
                - "I heard '%1$s'. One more try!"
                """.formatted(word);
            case YELLOW -> """
                If INCORRECT (encourage and offer choices):
                - "I heard '%1$s'. Good try! %2$s"
                - "I heard '%1$s'. Almost there! %2$s"
                """.formatted(word, CHOICE_PROMPT);
            case ORANGE -> """
                If INCORRECT (be extra gentle and offer choices):
                - "I heard '%1$s'. That's okay! %2$s"
                - "I heard '%1$s'. This one is tricky! %2$s"
                """.formatted(word, CHOICE_PROMPT);
            case RED -> """
                If INCORRECT (focus on comfort and choices):
                - "It's okay. Let's take a moment. %s"
                """.formatted(CHOICE_PROMPT);
        };
        return correct + "\n" + incorrect;
    }
}
