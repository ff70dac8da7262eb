package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Final output of one event's processing, handed to the transport layer.
 */
public record UIPackage(
    @JsonProperty("overlay")       Overlay            overlay,
    @JsonProperty("interventions") List<Intervention> interventions,
    @JsonProperty("sessionConfig") SessionConfig      sessionConfig,
    @JsonProperty("speech")        Speech             speech,
    @JsonProperty("choiceMessage") String             choiceMessage
) {
    public record Overlay(
        @JsonProperty("signals")     Set<Signal>   signals,
        @JsonProperty("state")       BehaviorState state,
        @JsonProperty("safetyLevel") SafetyLevel   safetyLevel
    ) {}

    public record Speech(
        @JsonProperty("text") String text
    ) {}

    public SafetyLevel safetyLevel() {
        return overlay.safetyLevel();
    }
}
