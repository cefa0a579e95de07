package com.pokerplatform.orchestrator.health;

import com.pokerplatform.common.health.HealthState;
import com.pokerplatform.common.health.HealthStatus;
import com.pokerplatform.common.health.PanicStopType;
import com.pokerplatform.common.health.SafeModeState;
import com.pokerplatform.common.model.StrategyDecision;
import com.pokerplatform.common.model.StrategyReasoning;
import com.pokerplatform.common.model.StrategyTiming;
import com.pokerplatform.orchestrator.config.HealthMonitoringSettings;
import com.pokerplatform.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthMetricsStoreTest {

    private MutableClock clock;
    private SafeModeController safeMode;
    private PanicStopController panicStop;
    private HealthMetricsStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        safeMode = new SafeModeController(clock);
        panicStop = new PanicStopController(safeMode, clock);
        store = new HealthMetricsStore(HealthMonitoringSettings.defaults(), panicStop, clock);
    }

    private static StrategyDecision decision(double divergencePp, String fallbackReason) {
        StrategyReasoning reasoning = new StrategyReasoning(Map.of(), Map.of(), Map.of(), 0.6, divergencePp,
            true, fallbackReason);
        return new StrategyDecision(null, reasoning, new StrategyTiming(0, 0, 0, 0), false, false);
    }

    // ── vision ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("vision")
    class VisionTests {

        @Test
        @DisplayName("confidences [0.5, 0.4, 0.3] → panic vision_confidence and safe mode")
        void lowConfidenceStreakPanics() {
            store.recordVisionSample(0.5, clock.instant());
            store.recordVisionSample(0.4, clock.instant());
            assertFalse(panicStop.isActive());

            store.recordVisionSample(0.3, clock.instant());

            assertTrue(panicStop.isActive());
            assertEquals(PanicStopType.VISION_CONFIDENCE, panicStop.getReason().orElseThrow().type());
            SafeModeState.Active active = assertInstanceOf(SafeModeState.Active.class, safeMode.getState());
            assertEquals("panic:vision_confidence", active.reason());
        }

        @Test
        @DisplayName("a good frame breaks the streak")
        void goodFrameResetsStreak() {
            store.recordVisionSample(0.5, clock.instant());
            store.recordVisionSample(0.4, clock.instant());
            store.recordVisionSample(0.999, clock.instant());
            store.recordVisionSample(0.3, clock.instant());
            store.recordVisionSample(0.3, clock.instant());
            assertFalse(panicStop.isActive());
        }

        @Test
        @DisplayName("a long low streak triggers once; a new streak after recovery triggers again")
        void streakTriggersOnce() {
            List<String> fired = new ArrayList<>();
            HealthMetricsStore counting = new HealthMetricsStore(HealthMonitoringSettings.defaults(),
                (type, detail) -> fired.add(detail), clock);

            for (int i = 0; i < 6; i++) {
                counting.recordVisionSample(0.5, clock.instant());
            }
            assertEquals(1, fired.size());
            assertTrue(fired.get(0).startsWith("Vision confidence"), fired.get(0));

            counting.recordVisionSample(0.999, clock.instant());
            for (int i = 0; i < 3; i++) {
                counting.recordVisionSample(0.4, clock.instant());
            }
            assertEquals(2, fired.size());
        }

        @Test
        @DisplayName("never sampled → FAILED stale vision feed")
        void neverSampled() {
            HealthStatus status = store.buildVisionStatus(0.995);
            assertEquals(HealthState.FAILED, status.state());
            assertEquals("stale vision feed", status.details());
        }

        @Test
        @DisplayName("sample older than the staleness window → FAILED")
        void staleSample() {
            store.recordVisionSample(1.0, clock.instant());
            clock.advanceMillis(15_001);
            assertEquals(HealthState.FAILED, store.buildVisionStatus(0.995).state());
        }

        @Test
        @DisplayName("confidence below threshold → DEGRADED, failures count up, healthy resets them")
        void degradedCountsFailures() {
            store.recordVisionSample(0.993, clock.instant());
            assertEquals(1, store.buildVisionStatus(0.995).consecutiveFailures());
            HealthStatus second = store.buildVisionStatus(0.995);
            assertEquals(HealthState.DEGRADED, second.state());
            assertEquals(2, second.consecutiveFailures());

            store.recordVisionSample(0.999, clock.instant());
            HealthStatus healthy = store.buildVisionStatus(0.995);
            assertEquals(HealthState.HEALTHY, healthy.state());
            assertEquals(0, healthy.consecutiveFailures());
            assertEquals(0.999, healthy.metrics().get("confidence"), 1e-9);
        }
    }

    // ── solver ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("solver")
    class SolverTests {

        @Test
        @DisplayName("fast sample → HEALTHY")
        void healthy() {
            store.recordSolverSample(120, false, clock.instant());
            assertEquals(HealthState.HEALTHY, store.buildSolverStatus(500).state());
        }

        @Test
        @DisplayName("latency above threshold → DEGRADED")
        void slow() {
            store.recordSolverSample(650, false, clock.instant());
            assertEquals(HealthState.DEGRADED, store.buildSolverStatus(500).state());
        }

        @Test
        @DisplayName("timeout is reported once, then the counter resets")
        void timeoutSinceLastCheck() {
            store.recordSolverSample(0, true, clock.instant());
            HealthStatus first = store.buildSolverStatus(500);
            assertEquals(HealthState.DEGRADED, first.state());
            assertEquals("recent solver timeout", first.details());

            assertEquals(HealthState.HEALTHY, store.buildSolverStatus(500).state());
        }

        @Test
        @DisplayName("no samples → DEGRADED stale")
        void stale() {
            assertEquals(HealthState.DEGRADED, store.buildSolverStatus(500).state());
        }
    }

    // ── executor ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("executor")
    class ExecutorTests {

        @Test
        @DisplayName("failure rate above threshold → DEGRADED")
        void failureRate() {
            for (int i = 0; i < 9; i++) {
                store.recordExecutorSample(true, clock.instant());
            }
            store.recordExecutorSample(false, clock.instant());
            HealthStatus status = store.buildExecutorStatus(0.05);
            assertEquals(HealthState.DEGRADED, status.state());
            assertEquals(0.1, status.metrics().get("failureRate"), 1e-9);
        }

        @Test
        @DisplayName("idle executor → DEGRADED executor idle")
        void idle() {
            store.recordExecutorSample(true, clock.instant());
            clock.advanceMillis(30_001);
            assertEquals("executor idle", store.buildExecutorStatus(0.05).details());
        }

        @Test
        @DisplayName("sample total is capped after each read")
        void totalCapped() {
            for (int i = 0; i < 150; i++) {
                store.recordExecutorSample(true, clock.instant());
            }
            assertEquals(150.0, store.buildExecutorStatus(0.05).metrics().get("samples"), 1e-9);
            HealthStatus capped = store.buildExecutorStatus(0.05);
            assertEquals(100.0, capped.metrics().get("samples"), 1e-9);
            assertEquals(HealthState.HEALTHY, capped.state());
        }
    }

    // ── strategy ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("strategy")
    class StrategyTests {

        @Test
        @DisplayName("divergence above threshold → DEGRADED")
        void divergence() {
            store.recordStrategySample(decision(42.0, null), clock.instant());
            assertEquals(HealthState.DEGRADED, store.buildStrategyStatus(30.0).state());
        }

        @Test
        @DisplayName("fallback is reported once, then the counter resets")
        void fallbackSinceLastCheck() {
            store.recordStrategySample(decision(5.0, "empty solution"), clock.instant());
            HealthStatus first = store.buildStrategyStatus(30.0);
            assertEquals("recent strategy fallback", first.details());
            assertEquals(HealthState.HEALTHY, store.buildStrategyStatus(30.0).state());
        }

        @Test
        @DisplayName("null decision is ignored")
        void nullDecision() {
            store.recordStrategySample(null, clock.instant());
            assertEquals(HealthState.DEGRADED, store.buildStrategyStatus(30.0).state());
        }
    }
}
