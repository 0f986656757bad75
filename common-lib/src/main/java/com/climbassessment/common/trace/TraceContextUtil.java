package com.climbassessment.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Trace-id plumbing for assessment requests.
 *
 * <p>Inside reactive pipelines the Reactor Context carries the traceId; MDC is
 * written only for the duration of a single log call via {@link #withMdc}.
 * The core engine itself is synchronous and never touches MDC directly.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY   = "traceId";
    public static final String SESSION_ID_KEY = "sessionId";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Returns {@code candidate} when present, otherwise a fresh random trace id. */
    public static String resolveTraceId(String candidate) {
        return candidate == null || candidate.isBlank() ? UUID.randomUUID().toString() : candidate;
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. Call at the
     * end of pipeline assembly; {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Reads the traceId from a Reactor {@link ContextView}; {@code "unknown"} if absent. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges traceId and sessionId into MDC while {@code logAction} runs, then
     * removes both entries. Use only around log statements.
     */
    public static void withMdc(String traceId, String sessionId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(SESSION_ID_KEY, sessionId == null ? UNKNOWN : sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
