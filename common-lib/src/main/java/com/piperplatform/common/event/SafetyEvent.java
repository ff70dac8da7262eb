package com.piperplatform.common.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.piperplatform.common.exception.InvalidEventException;
import com.piperplatform.common.model.AudioCues;

/**
 * One interaction unit fed into the safety-gate pipeline.
 *
 * <p>Created by the transport layer per child utterance, or by the session's own
 * inactivity timer. Immutable; validated at construction so a malformed event
 * never reaches the pipeline.
 *
 * @param type                     what happened
 * @param response                 transcribed text; required for {@link EventType#RESPONSE_RECEIVED}
 * @param correct                  whether the response was judged correct; always false for inactivity
 * @param previousResponse         the response before this one, nullable
 * @param previousPreviousResponse the response before that, nullable
 * @param audioCues                upstream audio flags; never null after construction
 */
public record SafetyEvent(
    @JsonProperty("type")                     EventType type,
    @JsonProperty("response")                 String    response,
    @JsonProperty("correct")                  boolean   correct,
    @JsonProperty("previousResponse")         String    previousResponse,
    @JsonProperty("previousPreviousResponse") String    previousPreviousResponse,
    @JsonProperty("audioCues")                AudioCues audioCues
) {
    public SafetyEvent {
        if (type == null) {
            throw new InvalidEventException("event type is required");
        }
        if (type == EventType.RESPONSE_RECEIVED && response == null) {
            throw new InvalidEventException("response event requires the transcribed text");
        }
        if (type == EventType.INACTIVITY_FIRED && correct) {
            throw new InvalidEventException("inactivity event cannot be correct");
        }
        if (audioCues == null) {
            audioCues = AudioCues.NONE;
        }
    }

    public static SafetyEvent response(String response, boolean correct,
                                       String previousResponse, String previousPreviousResponse,
                                       AudioCues audioCues) {
        return new SafetyEvent(EventType.RESPONSE_RECEIVED, response, correct,
            previousResponse, previousPreviousResponse, audioCues);
    }

    public static SafetyEvent response(String response, boolean correct) {
        return response(response, correct, null, null, AudioCues.NONE);
    }

    public static SafetyEvent inactivity(String lastResponse, String responseBeforeLast) {
        return new SafetyEvent(EventType.INACTIVITY_FIRED, null, false,
            lastResponse, responseBeforeLast, AudioCues.NONE);
    }

    @JsonIgnore
    public boolean isResponse() {
        return type == EventType.RESPONSE_RECEIVED;
    }

    @JsonIgnore
    public boolean isInactivity() {
        return type == EventType.INACTIVITY_FIRED;
    }

    /** Incorrect response or inactivity: anything that is not a correct answer. */
    @JsonIgnore
    public boolean isMiss() {
        return !(isResponse() && correct);
    }
}
