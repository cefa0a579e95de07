package com.pokerplatform.orchestrator.adapter;

import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.model.GtoSolution;
import reactor.core.publisher.Mono;

/**
 * Registered when no solver bean is provided. Every solve errors, so every cycle takes
 * the pipeline's safe fallback and solver health reports the timeouts.
 */
public class UnavailableGtoSolver implements GtoSolver {

    @Override
    public Mono<GtoSolution> solve(GameState state, long budgetMs) {
        return Mono.error(new IllegalStateException("no GTO solver connected"));
    }
}
