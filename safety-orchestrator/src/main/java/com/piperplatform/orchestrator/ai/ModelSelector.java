package com.piperplatform.orchestrator.ai;

import com.piperplatform.common.model.SafetyLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Level-aware model selector.
 *
 * <ul>
 *   <li>{@code ORANGE}, {@code RED}: fast model. The child is struggling and every
 *       second of silence counts.</li>
 *   <li>{@code GREEN}, {@code YELLOW}: stronger model for richer phrasing.</li>
 * </ul>
 *
 * <p>Model names are constants, not configurable.
 */
public final class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    public static final String FAST_MODEL   = "claude-haiku-4-5-20251001";
    public static final String STRONG_MODEL = "claude-sonnet-4-6";

    private ModelSelector() {}

    public static String selectModel(SafetyLevel level) {
        String selected = isFastPath(level) ? FAST_MODEL : STRONG_MODEL;
        log.debug("AI_MODEL_SELECTED level={} model={}", level, selected);
        return selected;
    }

    static boolean isFastPath(SafetyLevel level) {
        return switch (level) {
            case ORANGE, RED   -> true;
            case GREEN, YELLOW -> false;
        };
    }
}
