package com.piperplatform.orchestrator.ai;

import com.piperplatform.common.model.Signal;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Derives text cues (WANTS_BREAK, WANTS_QUIT, FRUSTRATION, DISTRESS) from a child's
 * utterance. Implementations must not error: failures resolve to the keyword rules.
 */
public interface TextSignalClassifier {

    Mono<Set<Signal>> classify(String responseText);
}
