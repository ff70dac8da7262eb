package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Session-level view of one processed event: the {@link UIPackage} plus the
 * bookkeeping the game needs to speak, show choices and log the turn.
 */
public record SafetyGateResult(
    @JsonProperty("uiPackage")              UIPackage    uiPackage,
    @JsonProperty("feedbackText")           String       feedbackText,
    @JsonProperty("choiceMessage")          String       choiceMessage,
    @JsonProperty("shouldSpeak")            boolean      shouldSpeak,
    @JsonProperty("interventionRequired")   boolean      interventionRequired,
    @JsonProperty("isCorrect")              boolean      correct,
    @JsonProperty("childSaid")              String       childSaid,
    @JsonProperty("targetAnswers")          List<String> targetAnswers,
    @JsonProperty("attemptNumber")          int          attemptNumber,
    @JsonProperty("responseHistory")        List<String> responseHistory,
    @JsonProperty("usedFallback")           boolean      usedFallback,
    @JsonProperty("decision")               Decision     decision,
    @JsonProperty("scheduledBreakDue")      boolean      scheduledBreakDue
) {}
