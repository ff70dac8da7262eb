package com.piperplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.piperplatform.common.model.Intervention.*;
import static org.junit.jupiter.api.Assertions.*;

class DecisionTest {

    @Test
    @DisplayName("RED wins over everything")
    void red() {
        assertEquals(Decision.CALL_GROWNUP_IMMEDIATELY, Decision.resolve(SafetyLevel.RED, List.of(RETRY_CARD)));
    }

    @Test
    @DisplayName("breathing offered → regulation; break offered → break")
    void orange() {
        assertEquals(Decision.TRIGGER_REGULATION_WITH_CHOICES,
            Decision.resolve(SafetyLevel.ORANGE, List.of(BUBBLE_BREATHING, RETRY_CARD, START_BREAK)));
        assertEquals(Decision.START_BREAK_NOW,
            Decision.resolve(SafetyLevel.ORANGE, List.of(RETRY_CARD, START_BREAK)));
    }

    @Test
    @DisplayName("YELLOW → adapt; GREEN → continue")
    void lowLevels() {
        assertEquals(Decision.ADAPT_AND_CONTINUE, Decision.resolve(SafetyLevel.YELLOW, List.of(SKIP_CARD, RETRY_CARD)));
        assertEquals(Decision.CONTINUE_NORMAL, Decision.resolve(SafetyLevel.GREEN, List.of(RETRY_CARD)));
    }

    @Test
    @DisplayName("choice actions parse case-insensitively; blank is rejected")
    void fromAction() {
        assertEquals(START_BREAK, Intervention.fromAction(" start_break "));
        assertThrows(IllegalArgumentException.class, () -> Intervention.fromAction(""));
        assertThrows(IllegalArgumentException.class, () -> Intervention.fromAction("DANCE"));
    }
}
