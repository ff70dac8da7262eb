package com.piperplatform.common.event;

import com.piperplatform.common.exception.InvalidEventException;
import com.piperplatform.common.model.AudioCues;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SafetyEventTest {

    @Test
    @DisplayName("missing type → InvalidEventException")
    void missingType() {
        InvalidEventException ex = assertThrows(InvalidEventException.class,
            () -> new SafetyEvent(null, "cold", true, null, null, null));
        assertEquals("SafetyEvent", ex.getComponent());
    }

    @Test
    @DisplayName("response event without text → InvalidEventException")
    void responseWithoutText() {
        assertThrows(InvalidEventException.class,
            () -> new SafetyEvent(EventType.RESPONSE_RECEIVED, null, false, null, null, null));
    }

    @Test
    @DisplayName("correct inactivity event → InvalidEventException")
    void correctInactivity() {
        assertThrows(InvalidEventException.class,
            () -> new SafetyEvent(EventType.INACTIVITY_FIRED, null, true, null, null, null));
    }

    @Test
    @DisplayName("null audio cues default to none")
    void defaultCues() {
        assertEquals(AudioCues.NONE, SafetyEvent.response("cold", true, null, null, null).audioCues());
    }

    @Test
    @DisplayName("miss = incorrect response or inactivity")
    void miss() {
        assertFalse(SafetyEvent.response("cold", true).isMiss());
        assertTrue(SafetyEvent.response("hot", false).isMiss());
        assertTrue(SafetyEvent.inactivity(null, null).isMiss());
    }
}
