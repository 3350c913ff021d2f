package com.swingtrader.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the execution identifier of a workflow run through reactive pipelines.
 *
 * <p>Reactor Context holds the id inside a pipeline. MDC is written only as a temporary
 * bridge while a log statement runs, never as a persistent ThreadLocal store, because
 * units of one wave hop between {@code boundedElastic} workers.
 *
 * <pre>
 *     return TraceContextUtil.withExecutionId(pipeline, executionId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String EXECUTION_ID_KEY = "executionId";

    private TraceContextUtil() {}

    /**
     * Stores {@code executionId} in the Reactor Context. {@code contextWrite} propagates
     * upstream during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withExecutionId(Mono<T> mono, String executionId) {
        return mono.contextWrite(ctx -> ctx.put(EXECUTION_ID_KEY, executionId));
    }

    /**
     * Returns the execution id from {@code ctx}, or {@code "unknown"} if absent. Never null.
     */
    public static String getExecutionId(ContextView ctx) {
        return ctx.getOrDefault(EXECUTION_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code executionId} into MDC for the duration of {@code logAction}.
     * Only for logging side-effects.
     */
    public static void withMdc(String executionId, Runnable logAction) {
        MDC.put(EXECUTION_ID_KEY, executionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(EXECUTION_ID_KEY);
        }
    }
}
