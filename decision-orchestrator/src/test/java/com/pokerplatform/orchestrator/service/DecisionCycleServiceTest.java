package com.pokerplatform.orchestrator.service;

import com.pokerplatform.common.budget.BudgetAllocation;
import com.pokerplatform.common.budget.BudgetComponent;
import com.pokerplatform.common.health.HealthState;
import com.pokerplatform.common.health.PanicStopReason;
import com.pokerplatform.common.health.PanicStopType;
import com.pokerplatform.common.model.Action;
import com.pokerplatform.common.model.ActionSolutionEntry;
import com.pokerplatform.common.model.ActionType;
import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.model.GtoSolution;
import com.pokerplatform.common.model.Position;
import com.pokerplatform.common.model.SolutionSource;
import com.pokerplatform.common.model.Street;
import com.pokerplatform.common.model.TablePositions;
import com.pokerplatform.orchestrator.adapter.GtoSolver;
import com.pokerplatform.orchestrator.config.BudgetSettings;
import com.pokerplatform.orchestrator.config.ConsistencySettings;
import com.pokerplatform.orchestrator.config.HealthMonitoringSettings;
import com.pokerplatform.orchestrator.health.HealthMetricsStore;
import com.pokerplatform.orchestrator.health.PanicStopController;
import com.pokerplatform.orchestrator.health.SafeModeController;
import com.pokerplatform.orchestrator.logger.DecisionFlowLogger;
import com.pokerplatform.orchestrator.pipeline.DecisionPipelineEngine;
import com.pokerplatform.orchestrator.strategy.GtoWeightedStrategyBlender;
import com.pokerplatform.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionCycleServiceTest {

    private static final BudgetSettings BUDGET = new BudgetSettings(2000, BudgetAllocation.DEFAULTS, 1, 100, 50, 20);

    private static final Action CHECK = Action.of(ActionType.CHECK, Position.BTN, Street.FLOP);
    private static final Action BET   = new Action(ActionType.RAISE, Position.BTN, Street.FLOP, 4.0);

    private MutableClock clock;
    private SafeModeController safeMode;
    private PanicStopController panicStop;
    private HealthMetricsStore metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        safeMode = new SafeModeController(clock);
        panicStop = new PanicStopController(safeMode, clock);
        metrics = new HealthMetricsStore(HealthMonitoringSettings.defaults(), panicStop, clock);
    }

    private DecisionCycleService service(GtoSolver solver, boolean panicOnViolation) {
        DecisionFlowLogger flowLogger = new DecisionFlowLogger();
        DecisionPipelineEngine pipeline = new DecisionPipelineEngine(solver, null, new GtoWeightedStrategyBlender(),
            BUDGET, flowLogger, clock);
        ConsistencySettings consistency = new ConsistencySettings(0.01, panicOnViolation, 0.3, 5);
        return new DecisionCycleService(pipeline, metrics, panicStop, safeMode, BUDGET, consistency,
            flowLogger, clock);
    }

    private DecisionCycleService service() {
        return service((s, b) -> Mono.just(GtoSolution.of(List.of(
            new ActionSolutionEntry(CHECK, 0.6, 0.0),
            new ActionSolutionEntry(BET, 0.4, 0.2)), 0.01, 5, SolutionSource.CACHE)), true);
    }

    private static GameState frame(String handId, double btnStack, double pot, double confidence) {
        return new GameState(handId, new TablePositions(Position.BTN, Position.BTN, Position.SB, Position.BB),
            Map.of(Position.BTN, btnStack, Position.BB, 96.0), pot, Street.FLOP, List.of(CHECK, BET),
            confidence, List.of());
    }

    // ── gating ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("runCycle() — gating")
    class GatingTests {

        @Test
        @DisplayName("healthy frame → actionable decision")
        void actionable() {
            StepVerifier.create(service().runCycle(frame("h1", 100, 8, 1.0), "table-1"))
                .assertNext(outcome -> {
                    assertTrue(outcome.actionable());
                    assertNull(outcome.blockedReason());
                    assertTrue(outcome.violations().isEmpty());
                    assertEquals(ActionType.CHECK, outcome.result().decision().action().type());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("pot shrinking inside a hand → panic stop, not actionable")
        void inconsistencyPanics() {
            DecisionCycleService service = service();
            service.runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));

            DecisionCycleOutcome outcome =
                service.runCycle(frame("h1", 100, 5, 1.0), "table-1").block(Duration.ofSeconds(2));

            assertNotNull(outcome);
            assertFalse(outcome.violations().isEmpty());
            assertFalse(outcome.actionable());
            assertEquals("panic stop: vision_confidence", outcome.blockedReason());
            assertNotNull(outcome.result().decision());

            PanicStopReason reason = panicStop.getReason().orElseThrow();
            assertEquals(PanicStopType.VISION_CONFIDENCE, reason.type());
            assertTrue(reason.detail().startsWith("State inconsistency: Pot decreased"), reason.detail());
            assertTrue(safeMode.isActive());
        }

        @Test
        @DisplayName("violations are reported without panic when routing is off")
        void inconsistencyReportedOnly() {
            DecisionCycleService service = service((s, b) -> Mono.just(GtoSolution.of(
                List.of(new ActionSolutionEntry(CHECK, 1.0, 0.0)), 0, 1, SolutionSource.CACHE)), false);
            service.runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));
            DecisionCycleOutcome outcome =
                service.runCycle(frame("h1", 100, 5, 1.0), "table-1").block(Duration.ofSeconds(2));

            assertNotNull(outcome);
            assertFalse(outcome.violations().isEmpty());
            assertTrue(outcome.actionable());
            assertFalse(panicStop.isActive());
        }

        @Test
        @DisplayName("operator safe mode blocks execution but still decides")
        void safeModeBlocks() {
            safeMode.enter("operator:maintenance", true);
            DecisionCycleOutcome outcome =
                service().runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));
            assertNotNull(outcome);
            assertFalse(outcome.actionable());
            assertEquals("safe mode: operator:maintenance", outcome.blockedReason());
            assertNotNull(outcome.result().decision().action());
        }

        @Test
        @DisplayName("three low-confidence frames → panic stop from vision telemetry")
        void lowConfidencePanics() {
            DecisionCycleService service = service();
            service.runCycle(frame("h1", 100, 8, 0.5), "table-1").block(Duration.ofSeconds(2));
            service.runCycle(frame("h2", 100, 8, 0.5), "table-1").block(Duration.ofSeconds(2));
            DecisionCycleOutcome outcome =
                service.runCycle(frame("h3", 100, 8, 0.5), "table-1").block(Duration.ofSeconds(2));

            assertNotNull(outcome);
            assertFalse(outcome.actionable());
            assertTrue(panicStop.isActive());
        }
    }

    // ── telemetry and sessions ────────────────────────────────────────────

    @Nested
    @DisplayName("telemetry and sessions")
    class TelemetryTests {

        @Test
        @DisplayName("solver failure is visible to solver health")
        void solverTimeoutRecorded() {
            DecisionCycleService service = service((s, b) -> Mono.error(new IllegalStateException("down")), true);
            service.runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));

            assertEquals("recent solver timeout", metrics.buildSolverStatus(500).details());
        }

        @Test
        @DisplayName("healthy cycle leaves solver and strategy healthy")
        void healthyTelemetry() {
            service().runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));
            assertEquals(HealthState.HEALTHY, metrics.buildSolverStatus(500).state());
            assertEquals(HealthState.HEALTHY, metrics.buildStrategyStatus(30).state());
            assertEquals(HealthState.HEALTHY, metrics.buildVisionStatus(0.995).state());
        }

        @Test
        @DisplayName("recordExecution feeds executor health")
        void executionRecorded() {
            DecisionCycleService service = service();
            service.recordExecution(true);
            assertEquals(HealthState.HEALTHY, metrics.buildExecutorStatus(0.05).state());
        }

        @Test
        @DisplayName("sessions keep separate baselines and endSession drops one")
        void sessionsIsolated() {
            DecisionCycleService service = service();
            service.runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));
            service.runCycle(frame("h1", 100, 2, 1.0), "table-2").block(Duration.ofSeconds(2));
            assertEquals(2, service.activeSessions());
            assertFalse(panicStop.isActive());

            service.endSession("table-1");
            assertEquals(1, service.activeSessions());
            DecisionCycleOutcome outcome =
                service.runCycle(frame("h1", 100, 5, 1.0), "table-1").block(Duration.ofSeconds(2));
            assertNotNull(outcome);
            assertTrue(outcome.violations().isEmpty());
        }

        @Test
        @DisplayName("sessions idle past the TTL are evicted when another session cycles")
        void idleSessionsEvicted() {
            DecisionCycleService service = service();
            service.runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));
            service.runCycle(frame("h1", 100, 8, 1.0), "table-2").block(Duration.ofSeconds(2));
            assertEquals(2, service.activeSessions());

            clock.advance(DecisionCycleService.DEFAULT_IDLE_TTL.plusSeconds(1));
            service.runCycle(frame("h2", 100, 8, 1.0), "table-2").block(Duration.ofSeconds(2));

            assertEquals(1, service.activeSessions());
            assertTrue(service.budgetMetrics("table-1").isEmpty());
            assertFalse(service.budgetMetrics("table-2").isEmpty());
        }

        @Test
        @DisplayName("a session that keeps cycling is never evicted")
        void activeSessionKept() {
            DecisionCycleService service = service();
            for (int i = 0; i < 3; i++) {
                service.runCycle(frame("h" + i, 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));
                clock.advance(DecisionCycleService.DEFAULT_IDLE_TTL.minusMinutes(1));
            }
            service.runCycle(frame("h9", 100, 8, 1.0), "table-2").block(Duration.ofSeconds(2));
            assertEquals(2, service.activeSessions());
        }

        @Test
        @DisplayName("solver health sees the solver's own latency")
        void solverLatencyRecorded() {
            DecisionCycleService service = service((s, b) -> {
                clock.advanceMillis(650);
                return Mono.just(GtoSolution.of(List.of(new ActionSolutionEntry(CHECK, 1.0, 0.0)), 0, 650,
                    SolutionSource.SUBGAME));
            }, true);
            service.runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));

            assertEquals(650.0, metrics.buildSolverStatus(500).metrics().get("latencyMs"), 1e-9);
        }

        @Test
        @DisplayName("budget metrics collect a perception sample per cycle")
        void budgetMetrics() {
            DecisionCycleService service = service();
            service.runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));
            service.runCycle(frame("h1", 100, 8, 1.0), "table-1").block(Duration.ofSeconds(2));

            assertEquals(2, service.budgetMetrics("table-1").get(BudgetComponent.PERCEPTION).samples());
            assertTrue(service.budgetMetrics("unknown").isEmpty());
        }

        @Test
        @DisplayName("null state fails the cycle")
        void nullState() {
            StepVerifier.create(service().runCycle(null, "table-1"))
                .expectError()
                .verify();
        }
    }
}
