package com.pokerplatform.orchestrator.controller;

import com.pokerplatform.common.budget.BudgetAllocation;
import com.pokerplatform.common.health.HealthState;
import com.pokerplatform.common.model.Action;
import com.pokerplatform.common.model.ActionSolutionEntry;
import com.pokerplatform.common.model.ActionType;
import com.pokerplatform.common.model.GtoSolution;
import com.pokerplatform.common.model.Position;
import com.pokerplatform.common.model.SolutionSource;
import com.pokerplatform.common.model.Street;
import com.pokerplatform.orchestrator.config.BudgetSettings;
import com.pokerplatform.orchestrator.config.ConsistencySettings;
import com.pokerplatform.orchestrator.config.HealthMonitoringSettings;
import com.pokerplatform.orchestrator.health.HealthMetricsStore;
import com.pokerplatform.orchestrator.health.PanicStopController;
import com.pokerplatform.orchestrator.health.SafeModeController;
import com.pokerplatform.orchestrator.logger.DecisionFlowLogger;
import com.pokerplatform.orchestrator.pipeline.DecisionPipelineEngine;
import com.pokerplatform.orchestrator.service.DecisionCycleService;
import com.pokerplatform.orchestrator.strategy.GtoWeightedStrategyBlender;
import com.pokerplatform.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionControllerTest {

    private static final String FRAME = """
        {
          "handId": "h42",
          "positions": {"hero": "BTN", "button": "BTN", "smallBlind": "SB", "bigBlind": "BB"},
          "stacks": {"BTN": 100.0, "SB": 99.5, "BB": 99.0},
          "pot": 1.5,
          "street": "preflop",
          "legalActions": [
            {"type": "fold", "position": "BTN", "street": "preflop"},
            {"type": "call", "position": "BTN", "street": "preflop", "amount": 1.0}
          ],
          "confidence": 1.0,
          "parseErrors": []
        }
        """;

    private HealthMetricsStore metrics;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atEpoch();
        SafeModeController safeMode = new SafeModeController(clock);
        PanicStopController panicStop = new PanicStopController(safeMode, clock);
        metrics = new HealthMetricsStore(HealthMonitoringSettings.defaults(), panicStop, clock);
        BudgetSettings budget = new BudgetSettings(2000, BudgetAllocation.DEFAULTS, 1, 100, 50, 20);
        DecisionFlowLogger flowLogger = new DecisionFlowLogger();

        Action call = new Action(ActionType.CALL, Position.BTN, Street.PREFLOP, 1.0);
        DecisionPipelineEngine pipeline = new DecisionPipelineEngine(
            (state, budgetMs) -> Mono.just(GtoSolution.of(
                List.of(new ActionSolutionEntry(call, 1.0, 0.1)), 0.0, 3, SolutionSource.CACHE)),
            null, new GtoWeightedStrategyBlender(), budget, flowLogger, clock);
        DecisionCycleService service = new DecisionCycleService(pipeline, metrics, panicStop, safeMode, budget,
            ConsistencySettings.defaults(), flowLogger, clock);
        client = WebTestClient.bindToController(new DecisionController(service)).build();
    }

    @Test
    @DisplayName("POST decisions → actionable outcome with the solver's call")
    void decide() {
        client.post().uri("/api/v1/sessions/table-9/decisions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(FRAME)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.actionable").isEqualTo(true)
            .jsonPath("$.result.decision.action.type").isEqualTo("call")
            .jsonPath("$.result.solverTimedOut").isEqualTo(false);
    }

    @Test
    @DisplayName("POST executions feeds executor health")
    void execution() {
        client.post().uri("/api/v1/sessions/table-9/executions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("success", true))
            .exchange()
            .expectStatus().isAccepted();
        assertEquals(HealthState.HEALTHY, metrics.buildExecutorStatus(0.05).state());
    }

    @Test
    @DisplayName("DELETE ends the session")
    void endSession() {
        client.delete().uri("/api/v1/sessions/table-9")
            .exchange()
            .expectStatus().isNoContent();
    }
}
