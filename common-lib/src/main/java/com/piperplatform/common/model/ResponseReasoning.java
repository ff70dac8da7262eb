package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ResponseReasoning(
    @JsonProperty("safetyLevelReason")   String safetyLevelReason,
    @JsonProperty("interventionsReason") String interventionsReason
) {}
