package com.swingtrader.orchestrator.engine;

import com.swingtrader.common.cache.CacheKeys;
import com.swingtrader.common.cache.ResultCache;
import com.swingtrader.common.trace.TraceContextUtil;
import com.swingtrader.common.unit.AgentUnit;
import com.swingtrader.common.unit.ErrorKind;
import com.swingtrader.common.unit.UnitOutcome;
import com.swingtrader.common.unit.UnitStatus;
import com.swingtrader.orchestrator.graph.ExecutionPlan;
import com.swingtrader.orchestrator.graph.GraphDefinition;
import com.swingtrader.orchestrator.graph.GraphException;
import com.swingtrader.orchestrator.graph.GraphResolver;
import com.swingtrader.orchestrator.graph.UnitNode;
import com.swingtrader.orchestrator.logger.ExecutionFlowLogger;
import com.swingtrader.orchestrator.result.ExecutionResult;
import com.swingtrader.orchestrator.result.UnitRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Runs a workflow graph wave by wave.
 *
 * <p>Waves run strictly one after another ({@code concatMap}); the units of one wave run
 * concurrently on {@code boundedElastic} ({@code flatMap}), each bounded by the unit timeout.
 * A wave completes only when every unit in it has a terminal outcome, so outputs written by
 * one wave are visible to the next.
 *
 * <p>Before executing a unit the engine looks up the result cache under the unit id and its
 * routed input. A hit is recorded as succeeded with {@code cacheHit=true}; a successful miss
 * is written back. Units that are not {@link AgentUnit#cacheable() cacheable} always execute and
 * are never stored. Cache failures are logged and treated as misses.
 *
 * <p>{@link #run} never errors: graph problems, unit failures, timeouts and routing gaps are
 * all reported through the returned {@link ExecutionResult}.
 */
public class DagExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(DagExecutionEngine.class);

    private static final String UNIT_CACHE_PREFIX = "unit:";
    private static final DateTimeFormatter ID_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final UnitRegistry unitRegistry;
    private final GraphResolver resolver;
    private final ResultCache cache;
    private final Duration unitTimeout;
    private final ExecutionFlowLogger flowLogger;
    private final Clock clock;

    // one instance per node declaration, created on first use
    private final Map<UnitNode, AgentUnit> instances = new ConcurrentHashMap<>();

    public DagExecutionEngine(UnitRegistry unitRegistry, ResultCache cache, Duration unitTimeout,
                              ExecutionFlowLogger flowLogger, Clock clock) {
        this.unitRegistry = unitRegistry;
        this.resolver     = new GraphResolver(unitRegistry::contains);
        this.cache        = cache;
        this.unitTimeout  = unitTimeout;
        this.flowLogger   = flowLogger;
        this.clock        = clock;
    }

    /** Resolves {@code graph} without running it; throws {@link GraphException} when invalid. */
    public ExecutionPlan resolve(GraphDefinition graph) {
        return resolver.resolve(graph);
    }

    public Mono<ExecutionResult> run(GraphDefinition graph, Map<String, Object> initialInput) {
        String executionId = newExecutionId();
        Mono<ExecutionResult> pipeline = Mono.defer(() -> execute(executionId, graph, initialInput))
            .doOnEach(flowLogger.stage(ExecutionFlowLogger.RUN_COMPLETED));
        return TraceContextUtil.withExecutionId(pipeline, executionId);
    }

    private Mono<ExecutionResult> execute(String executionId, GraphDefinition graph, Map<String, Object> initialInput) {
        Instant startedAt = clock.instant();
        flowLogger.log(ExecutionFlowLogger.RUN_STARTED, executionId, "graph=" + graph.name());

        ExecutionPlan plan;
        try {
            plan = resolver.resolve(graph);
        } catch (GraphException e) {
            TraceContextUtil.withMdc(executionId, () ->
                log.error("Graph rejected, nothing executed. graph={} kind={} path={} executionId={}",
                    graph.name(), e.getKind(), e.getPath(), executionId));
            return Mono.just(ExecutionResult.rejected(executionId, graph.name(), startedAt, clock.instant(),
                e.getMessage()));
        } catch (RuntimeException e) {
            TraceContextUtil.withMdc(executionId, () ->
                log.error("Graph could not be resolved. graph={} executionId={}", graph.name(), executionId, e));
            return Mono.just(ExecutionResult.rejected(executionId, graph.name(), startedAt, clock.instant(),
                "INVALID_GRAPH: " + e));
        }
        flowLogger.log(ExecutionFlowLogger.PLAN_RESOLVED, executionId, "waves=" + plan.waves());

        Map<String, UnitNode> nodes = new LinkedHashMap<>();
        graph.nodes().forEach(n -> nodes.put(n.id(), n));
        Map<String, UnitRecord> records = new ConcurrentHashMap<>();
        Map<String, Map<String, Object>> outputs = new ConcurrentHashMap<>();

        List<List<String>> waves = plan.waves();
        return Flux.range(0, waves.size())
            .concatMap(index -> runWave(executionId, index, waves.get(index), nodes, outputs, initialInput)
                .doOnNext(record -> {
                    records.put(record.unitId(), record);
                    if (record.succeeded() && record.output() != null) {
                        outputs.put(record.unitId(), record.output());
                    }
                })
                .then(Mono.fromRunnable(() -> flowLogger.log(ExecutionFlowLogger.WAVE_COMPLETED, executionId,
                    "wave=" + index))))
            .then(Mono.fromSupplier(() -> {
                List<UnitRecord> ordered = new ArrayList<>();
                plan.order().forEach(id -> ordered.add(records.get(id)));
                ExecutionResult result = ExecutionResult.of(executionId, graph.name(), startedAt, clock.instant(),
                    plan.order(), waves, ordered);
                TraceContextUtil.withMdc(executionId, () ->
                    log.info("Run finished. graph={} status={} units={} executionId={}",
                        graph.name(), result.status(), ordered.size(), executionId));
                return result;
            }));
    }

    private Flux<UnitRecord> runWave(String executionId, int index, List<String> wave, Map<String, UnitNode> nodes,
                                     Map<String, Map<String, Object>> outputs, Map<String, Object> initialInput) {
        flowLogger.log(ExecutionFlowLogger.WAVE_STARTED, executionId, "wave=" + index + " units=" + wave);
        return Flux.fromIterable(wave)
            .flatMap(id -> runUnit(executionId, nodes.get(id), outputs, initialInput));
    }

    private Mono<UnitRecord> runUnit(String executionId, UnitNode node, Map<String, Map<String, Object>> outputs,
                                     Map<String, Object> initialInput) {
        Instant startedAt = clock.instant();
        Map<String, Object> input;
        try {
            input = InputRouter.route(node, outputs, initialInput);
        } catch (RoutingException e) {
            TraceContextUtil.withMdc(executionId, () ->
                log.warn("Unit skipped. unitId={} reason={} executionId={}", node.id(), e.getMessage(), executionId));
            return Mono.just(UnitRecord.of(node, UnitOutcome.skipped(e.getMessage()), startedAt, clock.instant()));
        }

        AgentUnit unit;
        try {
            unit = instance(node);
        } catch (RuntimeException e) {
            TraceContextUtil.withMdc(executionId, () ->
                log.error("Unit could not be created. unitId={} error={} executionId={}",
                    node.id(), e.getMessage(), executionId));
            return Mono.just(UnitRecord.of(node,
                UnitOutcome.failed(ErrorKind.UNIT_EXECUTION, "[" + node.id() + "] " + e.getMessage()),
                startedAt, clock.instant()));
        }

        boolean cacheable = unit.cacheable();
        String key = cacheable ? CacheKeys.generateKey(UNIT_CACHE_PREFIX + node.id(), input) : null;
        Map<String, Object> cached = cacheable ? cachedOutput(key) : null;
        if (cached != null) {
            TraceContextUtil.withMdc(executionId, () ->
                log.info("Unit served from cache. unitId={} executionId={}", node.id(), executionId));
            return Mono.just(UnitRecord.of(node, UnitOutcome.fromCache(cached), startedAt, clock.instant()));
        }

        return Mono.fromCallable(() -> unit.execute(input))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(unitTimeout)
            .onErrorResume(TimeoutException.class, e -> Mono.just(
                UnitOutcome.failed(ErrorKind.TIMEOUT, "[" + node.id() + "] timed out after " + unitTimeout)))
            .onErrorResume(e -> Mono.just(
                UnitOutcome.failed(ErrorKind.UNIT_EXECUTION, "[" + node.id() + "] " + e.getMessage())))
            .defaultIfEmpty(UnitOutcome.failed(ErrorKind.UNIT_EXECUTION, "[" + node.id() + "] returned no outcome"))
            .map(outcome -> {
                if (cacheable && outcome.status() == UnitStatus.SUCCEEDED) {
                    storeOutput(key, outcome.output());
                }
                UnitRecord record = UnitRecord.of(node, outcome, startedAt, clock.instant());
                TraceContextUtil.withMdc(executionId, () ->
                    log.info("Unit completed. unitId={} status={} durationMs={} error={} executionId={}",
                        node.id(), record.status(), record.durationMs(), record.error(), executionId));
                return record;
            });
    }

    private AgentUnit instance(UnitNode node) {
        return instances.computeIfAbsent(node, unitRegistry::create);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> cachedOutput(String key) {
        try {
            Object hit = cache.get(key);
            return hit instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
        } catch (RuntimeException e) {
            log.warn("Cache read failed, treating as miss. key={} error={}", key, e.getMessage());
            return null;
        }
    }

    private void storeOutput(String key, Map<String, Object> output) {
        if (output == null) return;
        try {
            cache.set(key, output);
        } catch (RuntimeException e) {
            log.warn("Cache write failed, continuing. key={} error={}", key, e.getMessage());
        }
    }

    private String newExecutionId() {
        return "exec_" + ID_TIMESTAMP.format(clock.instant()) + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
