package com.piperplatform.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.util.context.Context;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SessionTraceContextTest {

    @Test
    @DisplayName("session id and turn are visible to operators upstream of withTurn")
    void withTurn_visibleUpstream() {
        Mono<String> job = Mono.deferContextual(ctx ->
            Mono.just(SessionTraceContext.sessionId(ctx) + "#" + SessionTraceContext.turn(ctx)));

        StepVerifier.create(SessionTraceContext.withTurn(job, "s-42", 7L))
            .expectNext("s-42#7")
            .verifyComplete();
    }

    @Test
    @DisplayName("empty context reads as unknown session, no turn")
    void emptyContext_defaults() {
        assertEquals(SessionTraceContext.UNKNOWN, SessionTraceContext.sessionId(Context.empty()));
        assertEquals(SessionTraceContext.NO_TURN, SessionTraceContext.turn(Context.empty()));
    }

    @Test
    @DisplayName("log action still runs and its exception propagates")
    void withMdc_propagatesFailure() {
        AtomicBoolean ran = new AtomicBoolean();
        assertThrows(IllegalStateException.class, () -> SessionTraceContext.withMdc("s-1", () -> {
            ran.set(true);
            throw new IllegalStateException("boom");
        }));
        assertTrue(ran.get());
    }
}
