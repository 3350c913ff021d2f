package com.swingtrader.orchestrator.controller;

import com.swingtrader.orchestrator.result.ExecutionResult;
import com.swingtrader.orchestrator.service.OrchestratorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private final OrchestratorService orchestratorService;

    public ExecutionController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @GetMapping
    public ResponseEntity<List<ExecutionResult>> recent(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        return ResponseEntity.ok(orchestratorService.recent(limit));
    }

    @GetMapping("/{executionId}")
    public ResponseEntity<ExecutionResult> get(@PathVariable String executionId) {
        return orchestratorService.find(executionId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }
}
