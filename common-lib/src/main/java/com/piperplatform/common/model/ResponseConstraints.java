package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Machine-checkable rules a generated coaching line must satisfy.
 *
 * @param mustBeBrief          always true
 * @param mustNotJudge         always true
 * @param mustOfferChoices     incorrect (or inactive) at YELLOW or above
 * @param mustValidateFeelings incorrect (or inactive) at ORANGE or above
 * @param maxSentences         2, or 3 when choices are offered
 * @param forbiddenWords       case-insensitive substrings never allowed in the line
 * @param requiredApproach     approach tag handed to the generator
 * @param tone                 tone requested by the session config
 */
public record ResponseConstraints(
    @JsonProperty("mustBeBrief")          boolean      mustBeBrief,
    @JsonProperty("mustNotJudge")         boolean      mustNotJudge,
    @JsonProperty("mustOfferChoices")     boolean      mustOfferChoices,
    @JsonProperty("mustValidateFeelings") boolean      mustValidateFeelings,
    @JsonProperty("maxSentences")         int          maxSentences,
    @JsonProperty("forbiddenWords")       List<String> forbiddenWords,
    @JsonProperty("requiredApproach")     String       requiredApproach,
    @JsonProperty("tone")                 AvatarTone   tone
) {
    public static final List<String> FORBIDDEN_WORDS =
        List.of("wrong", "incorrect", "bad", "no", "try harder", "focus");

    public static final String REQUIRED_APPROACH = "describe_what_heard_offer_support";
}
