package com.piperplatform.common.intervention;

import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.Intervention;
import com.piperplatform.common.model.SafetyLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.piperplatform.common.model.Intervention.*;
import static org.junit.jupiter.api.Assertions.*;

class InterventionSelectorTest {

    private static final BehaviorState CALM = BehaviorState.initial();

    @Test
    @DisplayName("GREEN → RETRY_CARD only")
    void green() {
        assertEquals(List.of(RETRY_CARD), InterventionSelector.select(SafetyLevel.GREEN, CALM, Set.of()));
    }

    @Test
    @DisplayName("YELLOW → SKIP_CARD, RETRY_CARD")
    void yellow() {
        assertEquals(List.of(SKIP_CARD, RETRY_CARD), InterventionSelector.select(SafetyLevel.YELLOW, CALM, Set.of()));
    }

    @Test
    @DisplayName("ORANGE calm → RETRY_CARD, START_BREAK")
    void orangeBase() {
        assertEquals(List.of(RETRY_CARD, START_BREAK),
            InterventionSelector.select(SafetyLevel.ORANGE, CALM, Set.of()));
    }

    @Test
    @DisplayName("ORANGE dysregulated with error streak → breathing first, skip last")
    void orangeWithAdditions() {
        BehaviorState state = CALM.withDysregulation(4).withConsecutiveErrors(3);
        assertEquals(List.of(BUBBLE_BREATHING, RETRY_CARD, START_BREAK, SKIP_CARD),
            InterventionSelector.select(SafetyLevel.ORANGE, state, Set.of()));
    }

    @Test
    @DisplayName("RED → full menu ending with CALL_GROWNUP")
    void red() {
        List<Intervention> result = InterventionSelector.select(SafetyLevel.RED, CALM, Set.of());
        assertEquals(List.of(BUBBLE_BREATHING, SKIP_CARD, RETRY_CARD, START_BREAK, CALL_GROWNUP), result);
        assertEquals(result.size(), Set.copyOf(result).size());
    }
}
