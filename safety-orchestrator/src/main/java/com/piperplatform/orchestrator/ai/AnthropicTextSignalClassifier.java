package com.piperplatform.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.piperplatform.common.exception.GenerationException;
import com.piperplatform.common.model.Signal;
import com.piperplatform.common.signal.SignalDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Claude-backed text cue classification with its own timeout.
 * Any failure falls back to the keyword rules of {@link SignalDetector}.
 */
public class AnthropicTextSignalClassifier implements TextSignalClassifier {

    private static final Logger log = LoggerFactory.getLogger(AnthropicTextSignalClassifier.class);

    static final Set<Signal> TEXT_SIGNALS =
        EnumSet.of(Signal.WANTS_BREAK, Signal.WANTS_QUIT, Signal.FRUSTRATION, Signal.DISTRESS);

    private static final String SYSTEM_PROMPT = """
        You classify what a young child said during a speech therapy game.
        Return JSON only: {"signals": [...]} using zero or more of:
        WANTS_BREAK (asks to stop, rest or says they are tired),
        WANTS_QUIT (says they are done or want no more),
        FRUSTRATION (annoyed sounds or words such as "ugh"),
        DISTRESS (screaming, crying, repeated "no", panic).
        Ordinary answers to the card, even wrong ones, have no signals.""";

    private final AnthropicMessagesClient messagesClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public AnthropicTextSignalClassifier(AnthropicMessagesClient messagesClient, ObjectMapper objectMapper,
                                         Duration timeout) {
        this.messagesClient = messagesClient;
        this.objectMapper   = objectMapper;
        this.timeout        = timeout;
    }

    @Override
    public Mono<Set<Signal>> classify(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return Mono.just(Set.of());
        }
        return messagesClient.complete(ModelSelector.FAST_MODEL, SYSTEM_PROMPT,
                                       "Child said: \"" + responseText + "\"", 60, timeout)
            .map(this::parseSignals)
            .onErrorResume(e -> {
                log.warn("[TextSignalClassifier] Classification failed, using keyword rules. reason={}",
                         e.getMessage());
                return Mono.just(SignalDetector.detectTextSignals(responseText));
            });
    }

    Set<Signal> parseSignals(String text) {
        try {
            JsonNode signals = objectMapper.readTree(AnthropicMessagesClient.stripFences(text)).path("signals");
            if (!signals.isArray()) {
                throw new GenerationException("TextSignalClassifier", "Missing signals array: " + text);
            }
            EnumSet<Signal> result = EnumSet.noneOf(Signal.class);
            for (JsonNode node : signals) {
                TEXT_SIGNALS.stream()
                    .filter(s -> s.name().equalsIgnoreCase(node.asText().trim()))
                    .findFirst()
                    .ifPresent(result::add);
            }
            return Collections.unmodifiableSet(result);
        } catch (GenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationException("TextSignalClassifier", "Unparsable classifier output: " + text, e);
        }
    }
}
