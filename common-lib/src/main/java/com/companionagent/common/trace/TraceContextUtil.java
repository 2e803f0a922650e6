package com.companionagent.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Reactive trace propagation for one turn.
 *
 * <p>The turn id travels as {@code traceId} in the Reactor Context, next to the session id.
 * MDC is written only as a temporary bridge while a log statement runs, never as a
 * persistent ThreadLocal store.
 *
 * <pre>
 *     return TraceContextUtil.withTrace(pipeline, turnId, sessionId);
 *     ...
 *     signal -> TraceContextUtil.getTraceId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY   = "traceId";
    public static final String SESSION_ID_KEY = "sessionId";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * Stores the turn id and session id in the Reactor Context. {@code contextWrite}
     * propagates upstream during subscription, so call this last when assembling a pipeline.
     */
    public static <T> Mono<T> withTrace(Mono<T> mono, String traceId, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId)
            .put(SESSION_ID_KEY, sessionId == null ? UNKNOWN : sessionId));
    }

    public static <T> Flux<T> withTrace(Flux<T> flux, String traceId, String sessionId) {
        return flux.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId)
            .put(SESSION_ID_KEY, sessionId == null ? UNKNOWN : sessionId));
    }

    /** @return the trace id, or {@code "unknown"}; never {@code null} */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction}, then removes it.
     * Only use inside logging side-effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
