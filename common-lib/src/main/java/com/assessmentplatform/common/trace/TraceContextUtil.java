package com.assessmentplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the assessment session id through reactive pipelines.
 *
 * <p>The Reactor Context is the only place the id lives while a pipeline runs. MDC is
 * written just for the duration of a log statement and cleared straight after.
 *
 * <pre>
 *     return TraceContextUtil.withSessionId(pipeline, session.id());
 * </pre>
 *
 * <p>Work that is subscribed apart from its caller (navigation that must outlive an HTTP
 * request, step-entry analyses) loses the caller's context; {@link #detached} re-attaches it.
 */
public final class TraceContextUtil {

    public static final String SESSION_ID_KEY = "sessionId";
    public static final String NO_SESSION     = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code sessionId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly; {@code contextWrite} is visible to every operator upstream.
     */
    public static <T> Mono<T> withSessionId(Mono<T> mono, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId));
    }

    /** Same as the {@code Mono} variant, for snapshot streams. */
    public static <T> Flux<T> withSessionId(Flux<T> flux, String sessionId) {
        return flux.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId));
    }

    /** @return the session id, or {@link #NO_SESSION} when none was written */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, NO_SESSION);
    }

    /**
     * Gives {@code mono} the context captured from its caller, for pipelines subscribed on
     * their own so that cancelling the caller does not cancel them.
     */
    public static <T> Mono<T> detached(Mono<T> mono, ContextView callerContext) {
        return mono.contextWrite(callerContext);
    }

    /**
     * Runs {@code logAction} with {@code sessionId} in MDC, then removes it.
     * Only for logging side-effects. A missing id leaves MDC untouched.
     */
    public static void withMdc(String sessionId, Runnable logAction) {
        if (sessionId == null || NO_SESSION.equals(sessionId)) {
            logAction.run();
            return;
        }
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
        }
    }

    /** {@link #withMdc(String, Runnable)} with the id read from a signal's context. */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(getSessionId(ctx), logAction);
    }
}
