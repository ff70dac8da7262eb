package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Candidate output of the external Response Generator.
 */
public record CoachGeneration(
    @JsonProperty("coach_line")          String coachLine,
    @JsonProperty("choice_presentation") String choicePresentation
) {}
