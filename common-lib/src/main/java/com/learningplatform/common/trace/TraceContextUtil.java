package com.learningplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Trace propagation for the coordinator.
 *
 * <p>Inside reactive pipelines the Reactor Context carries the trace id. MDC is written only
 * for the duration of a single log statement via {@link #withMdc}.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 *
 * <p>Round lifecycle logging uses the round id as trace id, so every log line about a round
 * can be grepped by it.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly; {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the Reactor Context, or {@value #UNKNOWN}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction}, then removes it.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
