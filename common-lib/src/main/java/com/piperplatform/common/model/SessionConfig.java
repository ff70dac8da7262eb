package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Presentation and timing parameters derived from the {@link SafetyLevel} alone.
 *
 * @param promptIntensity          0 (minimal) to 3 (celebratory)
 * @param avatarTone               voice/avatar tone
 * @param maxTaskTimeSeconds       total time allowed on one card
 * @param inactivityTimeoutSeconds silence before the "are you there" prompt
 */
public record SessionConfig(
    @JsonProperty("promptIntensity")          int        promptIntensity,
    @JsonProperty("avatarTone")               AvatarTone avatarTone,
    @JsonProperty("maxTaskTimeSeconds")       int        maxTaskTimeSeconds,
    @JsonProperty("inactivityTimeoutSeconds") int        inactivityTimeoutSeconds
) {
    public Duration inactivityTimeout() {
        return Duration.ofSeconds(inactivityTimeoutSeconds);
    }
}
