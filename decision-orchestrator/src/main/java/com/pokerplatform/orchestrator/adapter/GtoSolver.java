package com.pokerplatform.orchestrator.adapter;

import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.model.GtoSolution;
import reactor.core.publisher.Mono;

/**
 * Game-theory solver collaborator.
 *
 * <p>{@code budgetMs == 0} asks for the fastest available answer (cache or coarse
 * abstraction). Implementations may signal an error or return a solution with no
 * actions; the decision pipeline recovers from both. The pipeline stops waiting once
 * the budget elapses, so implementations should honour cancellation.
 */
@FunctionalInterface
public interface GtoSolver {

    Mono<GtoSolution> solve(GameState state, long budgetMs);
}
