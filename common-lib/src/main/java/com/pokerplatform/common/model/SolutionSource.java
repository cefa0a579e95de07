package com.pokerplatform.common.model;

/**
 * Where a {@link GtoSolution} came from. {@link #FALLBACK} marks a solution the pipeline
 * substituted after the solver failed.
 */
public enum SolutionSource {
    CACHE,
    SUBGAME,
    FALLBACK
}
