package com.pokerplatform.orchestrator.adapter;

import java.util.Map;

/**
 * Per-query context for the advisor ensemble. {@code timeBudgetMs} is the deadline the
 * ensemble must answer within.
 */
public record PromptContext(
    String requestId,
    long timeBudgetMs,
    Map<String, Object> handMetadata
) {
    public PromptContext {
        handMetadata = handMetadata == null ? Map.of() : Map.copyOf(handMetadata);
    }
}
