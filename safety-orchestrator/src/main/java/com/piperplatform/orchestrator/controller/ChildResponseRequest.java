package com.piperplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.piperplatform.common.model.AudioCues;

/**
 * One transcribed utterance, with optional upstream audio flags.
 */
public record ChildResponseRequest(
    @JsonProperty("transcription") String    transcription,
    @JsonProperty("audioCues")     AudioCues audioCues
) {}
