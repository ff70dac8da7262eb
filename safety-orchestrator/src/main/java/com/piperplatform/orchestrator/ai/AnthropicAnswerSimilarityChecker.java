package com.piperplatform.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.piperplatform.common.exception.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Locale;

/**
 * Claude-backed synonym check for descriptive-word cards ("freezing" for "cold").
 *
 * <p>Runs on the fast model with its own timeout, separate from the generator's.
 * Verdicts are cached per normalized (child word, target) pair; failures are not
 * cached and resolve to {@code false}, so the answer counts as a miss.
 */
@Component
public class AnthropicAnswerSimilarityChecker implements AnswerSimilarityChecker {

    private static final Logger log = LoggerFactory.getLogger(AnthropicAnswerSimilarityChecker.class);
    private static final String COMPONENT = "AnswerSimilarity";
    private static final int    MAX_TOKENS = 20;

    private static final String SYSTEM_PROMPT = """
        You judge answers in a speech therapy game for children learning describing words.
        Be lenient: accept any word that describes the SAME quality or direction as the
        expected answer, including degree variations (freezing for cold) and child-friendly
        forms (teeny tiny for small).
        Reject opposites (hot for cold), different properties (big for hot) and unrelated words.
        Respond with JSON only: {"similar": true} or {"similar": false}""";

    private final AnthropicMessagesClient  messagesClient;
    private final ObjectMapper             objectMapper;
    private final Scheduler                scheduler;
    private final Duration                 timeout;
    private final Cache<String, Boolean>   verdicts;

    public AnthropicAnswerSimilarityChecker(AnthropicMessagesClient messagesClient,
                                            ObjectMapper objectMapper,
                                            @Qualifier("safetyGateScheduler") Scheduler scheduler,
                                            @Value("${safety-gate.similarity.timeout-ms:3000}") long timeoutMs,
                                            @Value("${safety-gate.similarity.cache-size:1000}") long cacheSize) {
        this.messagesClient = messagesClient;
        this.objectMapper   = objectMapper;
        this.scheduler      = scheduler;
        this.timeout        = Duration.ofMillis(timeoutMs);
        this.verdicts       = Caffeine.newBuilder()
            .maximumSize(cacheSize)
            .expireAfterWrite(Duration.ofHours(12))
            .build();
    }

    @Override
    public Mono<Boolean> isSimilar(String childSaid, String target, String category) {
        String heard    = normalize(childSaid);
        String expected = normalize(target);
        if (heard.isEmpty() || expected.isEmpty()) {
            return Mono.just(false);
        }

        String key = heard + ":" + expected;
        Boolean cached = verdicts.getIfPresent(key);
        if (cached != null) {
            log.debug("[AnswerSimilarity] Cache hit. heard={} target={} similar={}", heard, expected, cached);
            return Mono.just(cached);
        }

        String question = "Category: " + category + "\n"
            + "Expected answer: \"" + expected + "\"\n"
            + "Child said: \"" + heard + "\"\n"
            + "Is \"" + heard + "\" describing the same quality as \"" + expected + "\"?";

        return Mono.defer(() -> messagesClient.complete(ModelSelector.FAST_MODEL, SYSTEM_PROMPT, question,
                                                        MAX_TOKENS, timeout))
            .timeout(timeout, scheduler)
            .map(this::parseVerdict)
            .doOnNext(similar -> {
                verdicts.put(key, similar);
                log.info("[AnswerSimilarity] Verdict. heard={} target={} similar={}", heard, expected, similar);
            })
            .onErrorResume(e -> {
                log.warn("[AnswerSimilarity] Check failed, treating as not similar. heard={} target={} reason={}",
                         heard, expected, e.getMessage());
                return Mono.just(false);
            });
    }

    boolean parseVerdict(String text) {
        try {
            JsonNode similar = objectMapper.readTree(AnthropicMessagesClient.stripFences(text)).path("similar");
            if (!similar.isBoolean()) {
                throw new GenerationException(COMPONENT, "Missing similar flag: " + text);
            }
            return similar.booleanValue();
        } catch (GenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationException(COMPONENT, "Unparsable similarity output: " + text, e);
        }
    }

    long cachedVerdicts() {
        verdicts.cleanUp();
        return verdicts.estimatedSize();
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
