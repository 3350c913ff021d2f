package com.swingtrader.orchestrator.controller;

import com.swingtrader.orchestrator.result.ExecutionResult;
import com.swingtrader.orchestrator.service.OrchestratorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class OrchestratorController {

    private final OrchestratorService orchestratorService;

    public OrchestratorController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/dag/execute")
    public Mono<ResponseEntity<ExecutionResult>> execute(@RequestBody(required = false) ExecuteRequest request) {
        Map<String, Object> initialInput = request == null ? null : request.initialInput();
        return orchestratorService.execute(initialInput).map(ResponseEntity::ok);
    }

    @GetMapping("/dag/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(orchestratorService.info());
    }

    @GetMapping("/agents")
    public ResponseEntity<List<String>> agents() {
        return ResponseEntity.ok(orchestratorService.unitTypes());
    }

    @GetMapping("/dag/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
