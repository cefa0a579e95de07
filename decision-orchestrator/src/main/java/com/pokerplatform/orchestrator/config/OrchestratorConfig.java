package com.pokerplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pokerplatform.common.budget.BudgetAllocation;
import com.pokerplatform.orchestrator.adapter.AdvisorEnsemble;
import com.pokerplatform.orchestrator.adapter.GtoSolver;
import com.pokerplatform.orchestrator.adapter.StrategyBlender;
import com.pokerplatform.orchestrator.adapter.UnavailableGtoSolver;
import com.pokerplatform.orchestrator.health.HealthMetricsStore;
import com.pokerplatform.orchestrator.health.HealthMonitor;
import com.pokerplatform.orchestrator.health.PanicStopController;
import com.pokerplatform.orchestrator.health.SafeModeController;
import com.pokerplatform.orchestrator.logger.DecisionFlowLogger;
import com.pokerplatform.orchestrator.pipeline.DecisionPipelineEngine;
import com.pokerplatform.orchestrator.service.DecisionCycleService;
import com.pokerplatform.orchestrator.strategy.GtoWeightedStrategyBlender;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    // ── budget ────────────────────────────────────────────────────────────────

    @Value("${budget.total-ms:2000}")
    private long totalMs;

    @Value("${budget.allocation.perception:70}")
    private long perceptionMs;

    @Value("${budget.allocation.gto:400}")
    private long gtoMs;

    @Value("${budget.allocation.agents:1200}")
    private long agentsMs;

    @Value("${budget.allocation.synthesis:100}")
    private long synthesisMs;

    @Value("${budget.allocation.execution:30}")
    private long executionMs;

    @Value("${budget.allocation.buffer:200}")
    private long bufferMs;

    @Value("${budget.preempt-epsilon-ms:1}")
    private long preemptEpsilonMs;

    @Value("${budget.gto-default-ms:400}")
    private long gtoDefaultMs;

    @Value("${budget.agents-hard-cap-ms:200}")
    private long agentsHardCapMs;

    @Value("${budget.zero-budget-grace-ms:50}")
    private long zeroBudgetGraceMs;

    // ── health ────────────────────────────────────────────────────────────────

    @Value("${health.interval-ms:2000}")
    private long healthIntervalMs;

    @Value("${health.degraded-thresholds.vision-confidence-min:0.995}")
    private double visionConfidenceMin;

    @Value("${health.degraded-thresholds.solver-latency-ms:500}")
    private long solverLatencyMs;

    @Value("${health.degraded-thresholds.executor-failure-rate:0.05}")
    private double executorFailureRate;

    @Value("${health.degraded-thresholds.strategy-divergence-pp:30}")
    private double strategyDivergencePp;

    @Value("${health.staleness.vision-failed-ms:15000}")
    private long visionStaleMs;

    @Value("${health.staleness.solver-ms:30000}")
    private long solverStaleMs;

    @Value("${health.staleness.executor-ms:30000}")
    private long executorStaleMs;

    @Value("${health.staleness.strategy-ms:60000}")
    private long strategyStaleMs;

    @Value("${health.safe-mode.enabled:true}")
    private boolean safeModeEnabled;

    @Value("${health.safe-mode.auto-exit:true}")
    private boolean safeModeAutoExit;

    @Value("${health.safe-mode.auto-exit-healthy-streak:2}")
    private int autoExitHealthyStreak;

    @Value("${health.panic-stop.vision-confidence-frames:3}")
    private int visionConfidenceFrames;

    @Value("${health.panic-stop.min-confidence:0.99}")
    private double panicMinConfidence;

    // ── consistency / strategy ────────────────────────────────────────────────

    @Value("${safety.consistency.epsilon:0.01}")
    private double consistencyEpsilon;

    @Value("${safety.consistency.panic-on-violation:true}")
    private boolean panicOnViolation;

    @Value("${safety.consistency.confidence-drop-max:0.3}")
    private double confidenceDropMax;

    @Value("${safety.consistency.parse-error-frames:5}")
    private int parseErrorFrames;

    @Value("${strategy.alpha:0.6}")
    private double strategyAlpha;

    @Value("${session.idle-ttl-ms:1800000}")
    private long sessionIdleTtlMs;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BudgetSettings budgetSettings() {
        BudgetAllocation allocation = new BudgetAllocation(
            perceptionMs, gtoMs, agentsMs, synthesisMs, executionMs, bufferMs);
        return new BudgetSettings(totalMs, allocation, preemptEpsilonMs, gtoDefaultMs,
            agentsHardCapMs, zeroBudgetGraceMs);
    }

    @Bean
    public HealthMonitoringSettings healthMonitoringSettings() {
        return new HealthMonitoringSettings(
            healthIntervalMs,
            new HealthMonitoringSettings.DegradedThresholds(
                visionConfidenceMin, solverLatencyMs, executorFailureRate, strategyDivergencePp),
            new HealthMonitoringSettings.Staleness(
                visionStaleMs, solverStaleMs, executorStaleMs, strategyStaleMs),
            new HealthMonitoringSettings.SafeMode(safeModeEnabled, safeModeAutoExit, autoExitHealthyStreak),
            new HealthMonitoringSettings.PanicStop(visionConfidenceFrames, panicMinConfidence));
    }

    @Bean
    public ConsistencySettings consistencySettings() {
        return new ConsistencySettings(consistencyEpsilon, panicOnViolation, confidenceDropMax, parseErrorFrames);
    }

    // ── safety ────────────────────────────────────────────────────────────────

    @Bean
    public SafeModeController safeModeController(Clock clock) {
        return new SafeModeController(clock);
    }

    @Bean
    public PanicStopController panicStopController(SafeModeController safeModeController, Clock clock) {
        return new PanicStopController(safeModeController, clock);
    }

    @Bean
    public HealthMetricsStore healthMetricsStore(HealthMonitoringSettings settings,
                                                 PanicStopController panicStopController, Clock clock) {
        return new HealthMetricsStore(settings, panicStopController, clock);
    }

    @Bean
    public HealthMonitor healthMonitor(HealthMonitoringSettings settings, SafeModeController safeModeController,
                                       PanicStopController panicStopController, Clock clock) {
        return new HealthMonitor(settings, safeModeController, panicStopController, clock);
    }

    // ── decision pipeline ─────────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public GtoSolver gtoSolver() {
        return new UnavailableGtoSolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public StrategyBlender strategyBlender() {
        return new GtoWeightedStrategyBlender(strategyAlpha);
    }

    @Bean
    public DecisionPipelineEngine decisionPipelineEngine(GtoSolver gtoSolver,
                                                         ObjectProvider<AdvisorEnsemble> advisorEnsemble,
                                                         StrategyBlender strategyBlender,
                                                         BudgetSettings budgetSettings,
                                                         DecisionFlowLogger decisionFlowLogger,
                                                         Clock clock) {
        return new DecisionPipelineEngine(gtoSolver, advisorEnsemble.getIfAvailable(), strategyBlender,
            budgetSettings, decisionFlowLogger, clock);
    }

    @Bean
    public DecisionCycleService decisionCycleService(DecisionPipelineEngine decisionPipelineEngine,
                                                     HealthMetricsStore healthMetricsStore,
                                                     PanicStopController panicStopController,
                                                     SafeModeController safeModeController,
                                                     BudgetSettings budgetSettings,
                                                     ConsistencySettings consistencySettings,
                                                     DecisionFlowLogger decisionFlowLogger,
                                                     Clock clock) {
        return new DecisionCycleService(decisionPipelineEngine, healthMetricsStore, panicStopController,
            safeModeController, budgetSettings, consistencySettings, decisionFlowLogger, clock,
            Duration.ofMillis(sessionIdleTtlMs));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
