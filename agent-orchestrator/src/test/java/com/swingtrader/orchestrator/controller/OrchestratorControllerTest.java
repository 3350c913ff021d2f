package com.swingtrader.orchestrator.controller;

import com.swingtrader.orchestrator.graph.GraphDefinition;
import com.swingtrader.orchestrator.graph.UnitNode;
import com.swingtrader.orchestrator.history.ExecutionHistory;
import com.swingtrader.orchestrator.service.OrchestratorService;
import com.swingtrader.orchestrator.service.OrchestratorServiceTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

class OrchestratorControllerTest {

    private OrchestratorService service;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        GraphDefinition graph = new GraphDefinition("single", "", List.of(new UnitNode("only", "echo", null, null)));
        service = OrchestratorServiceTestSupport.service(graph, new ExecutionHistory(10));
        client = WebTestClient
            .bindToController(new OrchestratorController(service), new ExecutionController(service))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("POST /dag/execute runs the graph and the run is retrievable by id")
    void executeThenFetch() {
        client.post().uri("/api/v1/dag/execute")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("initialInput", Map.of("top_n", 3)))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("success")
            .jsonPath("$.units.only.output.echo.top_n").isEqualTo(3);

        String executionId = service.recent(1).get(0).executionId();

        client.get().uri("/api/v1/executions/{id}", executionId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.execution_id").isEqualTo(executionId);

        client.get().uri("/api/v1/executions?limit=5")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1);
    }

    @Test
    @DisplayName("non-positive limit is a bad request")
    void badLimit() {
        client.get().uri("/api/v1/executions?limit=0")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("unknown execution id is 404")
    void notFound() {
        client.get().uri("/api/v1/executions/{id}", "exec_missing")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.status").isEqualTo(404);
    }

    @Test
    @DisplayName("execute without a body runs with empty input")
    void executeWithoutBody() {
        client.post().uri("/api/v1/dag/execute")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.execution_order[0]").isEqualTo("only");
    }

    @Test
    @DisplayName("info, agents and health endpoints")
    void metadata() {
        client.get().uri("/api/v1/dag/info").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.name").isEqualTo("single");
        client.get().uri("/api/v1/agents").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$[0]").isEqualTo("echo");
        client.get().uri("/api/v1/dag/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
