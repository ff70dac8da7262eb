package com.piperplatform.orchestrator.ai;

import com.piperplatform.common.model.Signal;
import com.piperplatform.common.signal.SignalDetector;
import reactor.core.publisher.Mono;

import java.util.Set;

/** Deterministic keyword path. */
public class KeywordTextSignalClassifier implements TextSignalClassifier {

    @Override
    public Mono<Set<Signal>> classify(String responseText) {
        return Mono.just(SignalDetector.detectTextSignals(responseText));
    }
}
