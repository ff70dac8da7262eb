package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Booleans attached upstream from audio amplitude analysis.
 */
public record AudioCues(
    @JsonProperty("screaming")        boolean screaming,
    @JsonProperty("crying")           boolean crying,
    @JsonProperty("prolongedSilence") boolean prolongedSilence
) {
    public static final AudioCues NONE = new AudioCues(false, false, false);

    public static AudioCues screamingOnly() {
        return new AudioCues(true, false, false);
    }
}
