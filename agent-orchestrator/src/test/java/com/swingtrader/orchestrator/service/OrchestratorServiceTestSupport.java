package com.swingtrader.orchestrator.service;

import com.swingtrader.common.cache.InMemoryResultCache;
import com.swingtrader.common.unit.AgentUnit;
import com.swingtrader.common.unit.UnitOutcome;
import com.swingtrader.orchestrator.config.SwingTraderProperties;
import com.swingtrader.orchestrator.engine.DagExecutionEngine;
import com.swingtrader.orchestrator.engine.UnitRegistry;
import com.swingtrader.orchestrator.graph.GraphDefinition;
import com.swingtrader.orchestrator.history.ExecutionHistory;
import com.swingtrader.orchestrator.logger.ExecutionFlowLogger;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/** Builds a service over an {@code echo} unit type that returns its input under {@code echo}. */
public final class OrchestratorServiceTestSupport {

    private OrchestratorServiceTestSupport() {}

    public static OrchestratorService service(GraphDefinition graph, ExecutionHistory history) {
        UnitRegistry registry = new UnitRegistry().register("echo", (id, config) -> new AgentUnit() {
            @Override
            public String unitName() {
                return id;
            }

            @Override
            public UnitOutcome execute(Map<String, Object> input) {
                return UnitOutcome.succeeded(Map.of("echo", input));
            }
        });
        DagExecutionEngine engine = new DagExecutionEngine(registry, new InMemoryResultCache(Duration.ofHours(1)),
            Duration.ofSeconds(5), new ExecutionFlowLogger(), Clock.systemUTC());
        return new OrchestratorService(engine, graph, history, registry, new SwingTraderProperties());
    }
}
