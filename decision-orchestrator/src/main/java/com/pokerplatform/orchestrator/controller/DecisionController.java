package com.pokerplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pokerplatform.common.budget.BudgetComponent;
import com.pokerplatform.common.budget.BudgetMetrics;
import com.pokerplatform.common.model.GameState;
import com.pokerplatform.orchestrator.service.DecisionCycleOutcome;
import com.pokerplatform.orchestrator.service.DecisionCycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/sessions/{sessionId}")
public class DecisionController {

    private final DecisionCycleService decisionCycleService;

    public DecisionController(DecisionCycleService decisionCycleService) {
        this.decisionCycleService = decisionCycleService;
    }

    @PostMapping("/decisions")
    public Mono<ResponseEntity<DecisionCycleOutcome>> decide(@PathVariable String sessionId,
                                                             @RequestBody GameState state) {
        return decisionCycleService.runCycle(state, sessionId).map(ResponseEntity::ok);
    }

    @PostMapping("/executions")
    public ResponseEntity<Void> execution(@PathVariable String sessionId, @RequestBody ExecutionReport report) {
        decisionCycleService.recordExecution(report.success());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/budget")
    public ResponseEntity<Map<BudgetComponent, BudgetMetrics>> budget(@PathVariable String sessionId) {
        return ResponseEntity.ok(decisionCycleService.budgetMetrics(sessionId));
    }

    @DeleteMapping
    public ResponseEntity<Void> end(@PathVariable String sessionId) {
        decisionCycleService.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    public record ExecutionReport(@JsonProperty("success") boolean success) {}
}
