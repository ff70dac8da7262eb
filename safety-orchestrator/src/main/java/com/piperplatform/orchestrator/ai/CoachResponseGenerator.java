package com.piperplatform.orchestrator.ai;

import com.piperplatform.common.model.CoachGeneration;
import com.piperplatform.common.model.ResponseContext;
import com.piperplatform.common.model.SafetyLevel;
import reactor.core.publisher.Mono;

/**
 * External Response Generator: turns a system prompt and turn context into a
 * candidate coaching line. May fail; the pipeline always has a fallback.
 */
@FunctionalInterface
public interface CoachResponseGenerator {

    /**
     * @param level used only to pick the model
     * @return the candidate, or an error signal on any failure
     */
    Mono<CoachGeneration> generate(String systemPrompt, ResponseContext context, SafetyLevel level);
}
