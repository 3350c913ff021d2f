package com.swingtrader.orchestrator.service;

import com.swingtrader.orchestrator.config.SwingTraderProperties;
import com.swingtrader.orchestrator.engine.DagExecutionEngine;
import com.swingtrader.orchestrator.engine.UnitRegistry;
import com.swingtrader.orchestrator.graph.ExecutionPlan;
import com.swingtrader.orchestrator.graph.GraphDefinition;
import com.swingtrader.orchestrator.history.ExecutionHistory;
import com.swingtrader.orchestrator.result.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the configured graph and keeps the bounded execution history.
 *
 * <p>The plan is resolved once at construction, so a cyclic or dangling graph fails the
 * application context instead of the first request.
 */
@Service
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    private final DagExecutionEngine engine;
    private final GraphDefinition graph;
    private final ExecutionHistory history;
    private final UnitRegistry unitRegistry;
    private final SwingTraderProperties properties;
    private final ExecutionPlan plan;

    public OrchestratorService(DagExecutionEngine engine, GraphDefinition graph, ExecutionHistory history,
                               UnitRegistry unitRegistry, SwingTraderProperties properties) {
        this.engine       = engine;
        this.graph        = graph;
        this.history      = history;
        this.unitRegistry = unitRegistry;
        this.properties   = properties;
        this.plan         = engine.resolve(graph);
        log.info("Graph loaded. name={} units={} waves={}", graph.name(), graph.nodes().size(), plan.waves());
    }

    public Mono<ExecutionResult> execute(Map<String, Object> initialInput) {
        Map<String, Object> input = initialInput == null ? Map.of() : initialInput;
        log.info("Execution requested. graph={} input={}", graph.name(), input);
        return engine.run(graph, input)
            .doOnNext(result -> {
                history.add(result);
                log.info("Execution recorded. executionId={} status={} historySize={}",
                    result.executionId(), result.status(), history.size());
            });
    }

    public List<ExecutionResult> recent(int limit) {
        return history.list(limit);
    }

    public Optional<ExecutionResult> find(String executionId) {
        return history.get(executionId);
    }

    /** Graph layout and registered unit types for the info endpoint. */
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", graph.name());
        info.put("description", graph.description());
        info.put("nodes", graph.nodes());
        info.put("execution_order", plan.order());
        info.put("waves", plan.waves());
        info.put("unit_types", unitRegistry.types());
        info.put("history_size", history.size());
        info.put("history_capacity", history.capacity());
        return info;
    }

    public List<String> unitTypes() {
        return unitRegistry.types();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void runOnStartup() {
        if (!properties.isRunOnStartup()) {
            return;
        }
        log.info("Startup run triggered. graph={}", graph.name());
        execute(properties.getStartupInput()).subscribe(
            result -> log.info("Startup run finished. executionId={} status={}", result.executionId(), result.status()),
            error -> log.error("Startup run failed. graph={} error={}", graph.name(), error.getMessage(), error)
        );
    }
}
