package com.swingtrader.orchestrator.logger;

import com.swingtrader.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the lifecycle of a workflow run. Pure side-effects; never alters the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #RUN_STARTED}    run accepted, execution id assigned</li>
 *   <li>{@link #PLAN_RESOLVED}  graph resolved into waves</li>
 *   <li>{@link #WAVE_STARTED}   units of one wave dispatched</li>
 *   <li>{@link #WAVE_COMPLETED} every unit of the wave reached a terminal outcome</li>
 *   <li>{@link #RUN_COMPLETED}  result assembled</li>
 * </ol>
 *
 * <p>With {@code doOnEach}, the execution id is read from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(ExecutionFlowLogger.RUN_COMPLETED))
 * </pre>
 */
public class ExecutionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ExecutionFlowLogger.class);

    public static final String RUN_STARTED    = "RUN_STARTED";
    public static final String PLAN_RESOLVED  = "PLAN_RESOLVED";
    public static final String WAVE_STARTED   = "WAVE_STARTED";
    public static final String WAVE_COMPLETED = "WAVE_COMPLETED";
    public static final String RUN_COMPLETED  = "RUN_COMPLETED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext}.
     * Bridges Context → MDC only for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String executionId = TraceContextUtil.getExecutionId(signal.getContextView());
            TraceContextUtil.withMdc(executionId, () ->
                log.info("[ExecutionFlow] stage={} executionId={}", stageName, executionId)
            );
        };
    }

    /**
     * Logs a stage when the execution id is already at hand, with a free-form detail
     * such as {@code "wave=1 units=[technical, sentiment]"}.
     */
    public void log(String stageName, String executionId, String detail) {
        TraceContextUtil.withMdc(executionId, () ->
            log.info("[ExecutionFlow] stage={} {} executionId={}", stageName, detail, executionId)
        );
    }
}
