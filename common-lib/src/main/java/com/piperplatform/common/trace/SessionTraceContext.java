package com.piperplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Session and turn identity for log lines.
 *
 * <p>A turn is one job on a session's queue: a child response, an inactivity tick,
 * a resume. Both values ride in the Reactor Context of the job's {@code Mono};
 * MDC only holds them while a single log statement runs, so a thread that hops
 * between sessions never logs under the wrong child.
 *
 * <pre>
 *     return SessionTraceContext.withTurn(job, sessionId, turn);
 * </pre>
 */
public final class SessionTraceContext {

    public static final String SESSION_ID_KEY = "sessionId";
    public static final String TURN_KEY       = "turn";
    public static final String UNKNOWN        = "unknown";

    /** MDC value when a log line is not tied to a queued turn (card set, timer start). */
    public static final String NO_TURN = "-";

    private SessionTraceContext() {}

    /**
     * Tags a session job. {@code contextWrite} propagates upstream, so apply it last.
     */
    public static <T> Mono<T> withTurn(Mono<T> job, String sessionId, long turn) {
        return job.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId).put(TURN_KEY, turn));
    }

    public static String sessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, UNKNOWN);
    }

    /** Turn number as text, {@link #NO_TURN} outside a queued job. */
    public static String turn(ContextView ctx) {
        return ctx.hasKey(TURN_KEY) ? String.valueOf(ctx.<Long>get(TURN_KEY)) : NO_TURN;
    }

    /**
     * Runs {@code logAction} with both keys in MDC, taken from a signal's context.
     */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(sessionId(ctx), turn(ctx), logAction);
    }

    /** For log lines outside a reactive chain. */
    public static void withMdc(String sessionId, Runnable logAction) {
        withMdc(sessionId, NO_TURN, logAction);
    }

    private static void withMdc(String sessionId, String turn, Runnable logAction) {
        MDC.put(SESSION_ID_KEY, sessionId);
        MDC.put(TURN_KEY, turn);
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
            MDC.remove(TURN_KEY);
        }
    }
}
