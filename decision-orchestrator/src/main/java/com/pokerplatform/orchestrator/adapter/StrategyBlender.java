package com.pokerplatform.orchestrator.adapter;

import com.pokerplatform.common.model.AggregatedAdvisorOutput;
import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.model.GtoSolution;
import com.pokerplatform.common.model.StrategyDecision;

/**
 * Turns solver and advisor input into the final decision.
 *
 * <p>Must not throw: internal risk or blending failures resolve to a decision. A throw
 * is treated as a contract violation and fails the cycle.
 */
@FunctionalInterface
public interface StrategyBlender {

    StrategyDecision decide(GameState state, GtoSolution solution, AggregatedAdvisorOutput advice, String sessionId);
}
