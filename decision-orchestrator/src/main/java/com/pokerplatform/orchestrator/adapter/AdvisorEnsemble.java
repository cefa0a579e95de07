package com.pokerplatform.orchestrator.adapter;

import com.pokerplatform.common.model.AggregatedAdvisorOutput;
import com.pokerplatform.common.model.GameState;
import reactor.core.publisher.Mono;

/**
 * Ensemble of LLM-backed advisors. Optional: when no bean is present the pipeline hands
 * strategy blending a "no signal" output.
 */
@FunctionalInterface
public interface AdvisorEnsemble {

    Mono<AggregatedAdvisorOutput> query(GameState state, PromptContext context, AdvisorQueryOptions options);
}
