package com.piperplatform.orchestrator.ai;

import reactor.core.publisher.Mono;

/**
 * Semantic second opinion for answers the deterministic matcher rejected.
 * Implementations emit {@code false} instead of erroring.
 */
@FunctionalInterface
public interface AnswerSimilarityChecker {

    Mono<Boolean> isSimilar(String childSaid, String target, String category);
}
