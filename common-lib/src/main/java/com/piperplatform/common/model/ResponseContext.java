package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request-scoped context for one generation call.
 *
 * @param outcome       correct, incorrect or inactive
 * @param childSaid     transcribed text, empty for inactivity
 * @param targetWas     expected answer, empty when no card is active
 * @param attemptNumber consecutive errors + 1
 * @param task          card being answered, nullable
 */
public record ResponseContext(
    @JsonProperty("outcome")       Outcome     outcome,
    @JsonProperty("childSaid")     String      childSaid,
    @JsonProperty("targetWas")     String      targetWas,
    @JsonProperty("attemptNumber") int         attemptNumber,
    @JsonProperty("task")          TaskContext task
) {}
