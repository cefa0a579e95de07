package com.pokerplatform.orchestrator.pipeline;

import com.pokerplatform.common.budget.BudgetComponent;
import com.pokerplatform.common.budget.TimeBudgetTracker;
import com.pokerplatform.common.exception.DecisionPipelineException;
import com.pokerplatform.common.model.Action;
import com.pokerplatform.common.model.ActionSolutionEntry;
import com.pokerplatform.common.model.ActionType;
import com.pokerplatform.common.model.AggregatedAdvisorOutput;
import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.model.GtoSolution;
import com.pokerplatform.common.model.SolutionSource;
import com.pokerplatform.common.model.StrategyDecision;
import com.pokerplatform.orchestrator.adapter.AdvisorEnsemble;
import com.pokerplatform.orchestrator.adapter.AdvisorQueryOptions;
import com.pokerplatform.orchestrator.adapter.GtoSolver;
import com.pokerplatform.orchestrator.adapter.PromptContext;
import com.pokerplatform.orchestrator.adapter.StrategyBlender;
import com.pokerplatform.orchestrator.config.BudgetSettings;
import com.pokerplatform.orchestrator.logger.DecisionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces exactly one {@link StrategyDecision} per cycle, whatever state the solver and
 * advisors are in.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li><b>GTO</b>: if the tracker says to preempt, or the solver budget cannot be reserved,
 *       the solver is asked for its zero-budget answer. Otherwise the call is bracketed on
 *       {@code GTO}, abandoned at its deadline, and unused time is released.</li>
 *   <li>Solver error, timeout or empty solution: {@link #safeFallbackSolution}.</li>
 *   <li><b>AGENTS</b>: the ensemble, when present, gets
 *       {@code min(agentsHardCapMs, remaining(AGENTS))}. Error, timeout or no budget:
 *       a "stubbed" no-signal output.</li>
 *   <li><b>SYNTHESIS</b>: the blender's decision is returned as is.</li>
 * </ol>
 *
 * <p>Subsystem failures never fail the returned {@link Mono}. Only a missing collaborator
 * or a throwing blender surfaces as {@link DecisionPipelineException}.
 */
public class DecisionPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipelineEngine.class);

    private static final String COMPONENT = "DecisionPipeline";
    private static final List<ActionType> SAFE_PREFERENCE = List.of(ActionType.CHECK, ActionType.CALL);

    private final GtoSolver solver;
    private final AdvisorEnsemble advisors;
    private final StrategyBlender blender;
    private final BudgetSettings settings;
    private final DecisionFlowLogger flowLogger;
    private final Clock clock;

    /**
     * @param advisors may be {@code null}; every cycle then blends against a stub
     */
    public DecisionPipelineEngine(GtoSolver solver, AdvisorEnsemble advisors, StrategyBlender blender,
                                  BudgetSettings settings, DecisionFlowLogger flowLogger, Clock clock) {
        if (solver == null) {
            throw new DecisionPipelineException(COMPONENT, "a GTO solver is required");
        }
        if (blender == null) {
            throw new DecisionPipelineException(COMPONENT, "a strategy blender is required");
        }
        this.solver     = solver;
        this.advisors   = advisors;
        this.blender    = blender;
        this.settings   = settings != null ? settings : BudgetSettings.defaults();
        this.flowLogger = flowLogger != null ? flowLogger : new DecisionFlowLogger();
        this.clock      = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Runs one decision against {@code tracker}, which the caller has already started.
     * A {@code null} tracker gets a fresh default one started on the spot.
     */
    public Mono<DecisionPipelineResult> makeDecision(GameState state, String sessionId, TimeBudgetTracker tracker) {
        if (state == null) {
            return Mono.error(new DecisionPipelineException(COMPONENT, "game state is required"));
        }
        TimeBudgetTracker budget = tracker;
        if (budget == null) {
            log.debug("[DecisionPipeline] no tracker supplied, starting a default one. handId={}", state.handId());
            budget = settings.newTracker();
            budget.start();
        }
        TimeBudgetTracker cycle = budget;

        AtomicLong solverStarted = new AtomicLong();
        return Mono.defer(() -> {
                solverStarted.set(clock.millis());
                return resolveSolution(state, cycle);
            })
            .doOnEach(flowLogger.stage(DecisionFlowLogger.GTO_RESOLVED))
            .flatMap(gto -> {
                long solverLatencyMs = Math.max(0, clock.millis() - solverStarted.get());
                return resolveAdvice(state, sessionId, cycle)
                    .doOnEach(flowLogger.stage(DecisionFlowLogger.ADVISORS_RESOLVED))
                    .map(advice -> new DecisionPipelineResult(
                        blend(state, sessionId, cycle, gto.solution(), advice),
                        gto.solution(), advice, gto.timedOut(), solverLatencyMs));
            })
            .doOnEach(flowLogger.stage(DecisionFlowLogger.DECISION_BLENDED));
    }

    // ── GTO ───────────────────────────────────────────────────────────────────

    private Mono<SolverOutcome> resolveSolution(GameState state, TimeBudgetTracker tracker) {
        if (tracker.shouldPreempt(BudgetComponent.GTO)) {
            log.debug("[DecisionPipeline] GTO preempted, zero-budget solve. handId={} elapsedMs={}",
                state.handId(), tracker.elapsed());
            return zeroBudgetSolve(state);
        }
        long requested = Math.min(settings.gtoDefaultMs(), tracker.remaining(BudgetComponent.GTO));
        if (requested <= 0 || !tracker.reserve(BudgetComponent.GTO, requested)) {
            log.debug("[DecisionPipeline] GTO budget unavailable, zero-budget solve. handId={} requestedMs={}",
                state.handId(), requested);
            return zeroBudgetSolve(state);
        }

        AtomicBoolean closed = new AtomicBoolean(false);
        return Mono.defer(() -> {
                tracker.startComponent(BudgetComponent.GTO);
                return solver.solve(state, requested);
            })
            .timeout(Duration.ofMillis(requested))
            .doOnSuccess(solution -> closeGto(tracker, requested, closed))
            .doOnError(err -> closeGto(tracker, requested, closed))
            .map(solution -> accept(state, solution, false))
            .switchIfEmpty(Mono.fromSupplier(() -> fallback(state, "solver returned no solution")))
            .onErrorResume(err -> Mono.just(fallback(state, describe(err))));
    }

    private Mono<SolverOutcome> zeroBudgetSolve(GameState state) {
        return Mono.defer(() -> solver.solve(state, 0))
            .timeout(Duration.ofMillis(Math.max(1, settings.zeroBudgetGraceMs())))
            .map(solution -> accept(state, solution, true))
            .switchIfEmpty(Mono.fromSupplier(() -> fallback(state, "solver returned no solution")))
            .onErrorResume(err -> Mono.just(fallback(state, describe(err))));
    }

    private void closeGto(TimeBudgetTracker tracker, long requested, AtomicBoolean closed) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        long actual = tracker.endComponent(BudgetComponent.GTO);
        if (requested > actual) {
            tracker.release(BudgetComponent.GTO, requested - actual);
        }
    }

    private SolverOutcome accept(GameState state, GtoSolution solution, boolean timedOut) {
        if (solution == null || solution.isEmpty()) {
            return fallback(state, "empty solution");
        }
        return new SolverOutcome(solution, timedOut);
    }

    private SolverOutcome fallback(GameState state, String reason) {
        GtoSolution safe = safeFallbackSolution(state);
        log.warn("[DecisionPipeline] GTO solver failed, using safe fallback. component=gto-solver handId={} "
                 + "reason={} action={}", state.handId(), reason, safe.actions().keySet());
        return new SolverOutcome(safe, true);
    }

    /**
     * Least committal legal action for the hero: check, else call, else fold. Legal actions
     * listed for other seats are ignored. Played at full frequency with zero expected value.
     */
    public static GtoSolution safeFallbackSolution(GameState state) {
        Action choice = null;
        for (ActionType preferred : SAFE_PREFERENCE) {
            for (Action legal : state.legalActions()) {
                if (legal != null && legal.type() == preferred && legal.position() == state.hero()) {
                    choice = legal;
                    break;
                }
            }
            if (choice != null) {
                break;
            }
        }
        if (choice == null) {
            choice = Action.of(ActionType.FOLD, state.hero(), state.street());
        }
        return GtoSolution.of(List.of(new ActionSolutionEntry(choice, 1.0, 0.0)), 0.0, 0L, SolutionSource.FALLBACK);
    }

    // ── AGENTS ────────────────────────────────────────────────────────────────

    private Mono<AggregatedAdvisorOutput> resolveAdvice(GameState state, String sessionId,
                                                        TimeBudgetTracker tracker) {
        if (advisors == null) {
            return Mono.just(stub("no advisor ensemble configured"));
        }
        long budgetMs = Math.min(settings.agentsHardCapMs(), tracker.remaining(BudgetComponent.AGENTS));
        if (budgetMs <= 0) {
            log.debug("[DecisionPipeline] advisor budget exhausted. handId={}", state.handId());
            return Mono.just(stub("advisor budget exhausted"));
        }
        PromptContext context = new PromptContext(UUID.randomUUID().toString(), budgetMs,
            handMetadata(state, sessionId));

        AtomicBoolean closed = new AtomicBoolean(false);
        return Mono.defer(() -> {
                tracker.startComponent(BudgetComponent.AGENTS);
                return advisors.query(state, context, AdvisorQueryOptions.withBudget(budgetMs));
            })
            .timeout(Duration.ofMillis(budgetMs))
            .doOnSuccess(advice -> closeAgents(tracker, closed))
            .doOnError(err -> closeAgents(tracker, closed))
            .switchIfEmpty(Mono.fromSupplier(() -> stub("advisor returned no output")))
            .onErrorResume(err -> {
                log.warn("[DecisionPipeline] advisor ensemble failed, using stub. component=advisor-ensemble "
                         + "handId={} sessionId={} reason={}", state.handId(), sessionId, describe(err));
                return Mono.just(stub(describe(err)));
            });
    }

    private static void closeAgents(TimeBudgetTracker tracker, AtomicBoolean closed) {
        if (closed.compareAndSet(false, true)) {
            tracker.endComponent(BudgetComponent.AGENTS);
        }
    }

    private AggregatedAdvisorOutput stub(String reason) {
        return AggregatedAdvisorOutput.stub("stubbed advisor output (" + reason + ")", clock.instant());
    }

    private static Map<String, Object> handMetadata(GameState state, String sessionId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (state.handId() != null) metadata.put("handId", state.handId());
        if (state.street() != null) metadata.put("street", state.street().wireName());
        if (state.hero() != null) metadata.put("hero", state.hero().name());
        if (sessionId != null) metadata.put("sessionId", sessionId);
        metadata.put("pot", state.pot());
        return metadata;
    }

    // ── SYNTHESIS ─────────────────────────────────────────────────────────────

    private StrategyDecision blend(GameState state, String sessionId, TimeBudgetTracker tracker,
                                   GtoSolution solution, AggregatedAdvisorOutput advice) {
        tracker.startComponent(BudgetComponent.SYNTHESIS);
        StrategyDecision decision;
        try {
            decision = blender.decide(state, solution, advice, sessionId);
        } catch (RuntimeException e) {
            log.error("[DecisionPipeline] strategy blender threw. component=strategy-blender handId={} reason={}",
                state.handId(), e.getMessage(), e);
            throw new DecisionPipelineException("StrategyBlender", "blender failed: " + describe(e), e);
        } finally {
            tracker.endComponent(BudgetComponent.SYNTHESIS);
        }
        if (decision == null) {
            throw new DecisionPipelineException("StrategyBlender", "blender returned no decision");
        }
        return decision;
    }

    private static String describe(Throwable err) {
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }

    private record SolverOutcome(GtoSolution solution, boolean timedOut) {}
}
