package com.pokerplatform.orchestrator.strategy;

import com.pokerplatform.common.model.Action;
import com.pokerplatform.common.model.ActionSolutionEntry;
import com.pokerplatform.common.model.ActionType;
import com.pokerplatform.common.model.AggregatedAdvisorOutput;
import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.model.GtoSolution;
import com.pokerplatform.common.model.StrategyDecision;
import com.pokerplatform.common.model.StrategyReasoning;
import com.pokerplatform.common.model.StrategyTiming;
import com.pokerplatform.orchestrator.adapter.StrategyBlender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default blender: {@code alpha · GTO + (1 − alpha) · advisors}, then the most likely action.
 *
 * <p>Advisor weights arrive per action class and are spread evenly over the solver
 * entries of that class. With no advisor signal the blend is pure GTO and the decision is
 * flagged {@code usedGtoOnlyFallback}; {@code fallbackReason} is reserved for an empty
 * solution. Divergence is the total-variation distance between
 * the two distributions in percentage points.
 *
 * <p>Never throws; an empty solution resolves to the hero's fold.
 */
public class GtoWeightedStrategyBlender implements StrategyBlender {

    private static final Logger log = LoggerFactory.getLogger(GtoWeightedStrategyBlender.class);

    public static final double MIN_ALPHA = 0.3;
    public static final double MAX_ALPHA = 0.9;
    public static final double DEFAULT_ALPHA = 0.6;

    private final double alpha;

    public GtoWeightedStrategyBlender() {
        this(DEFAULT_ALPHA);
    }

    public GtoWeightedStrategyBlender(double alpha) {
        this.alpha = Double.isFinite(alpha) ? Math.max(MIN_ALPHA, Math.min(MAX_ALPHA, alpha)) : DEFAULT_ALPHA;
    }

    @Override
    public StrategyDecision decide(GameState state, GtoSolution solution, AggregatedAdvisorOutput advice,
                                   String sessionId) {
        long started = System.nanoTime();
        Map<String, Double> gto = gtoDistribution(solution);
        Map<String, Action> actionsByKey = new LinkedHashMap<>();
        if (solution != null) {
            solution.actions().forEach((key, entry) -> actionsByKey.put(key, entry.action()));
        }

        if (gto.isEmpty()) {
            Action fold = Action.of(ActionType.FOLD, state.hero(), state.street());
            log.warn("[StrategyBlender] empty solution, folding. handId={} sessionId={}", state.handId(), sessionId);
            return new StrategyDecision(fold,
                new StrategyReasoning(Map.of(), Map.of(), Map.of(), 1.0, 0.0, true, "empty solution"),
                timing(solution, advice, started), true, false);
        }

        Map<String, Double> agent = advisorDistribution(advice, actionsByKey);
        boolean gtoOnly = agent.isEmpty();
        double effectiveAlpha = gtoOnly ? 1.0 : alpha;

        Map<String, Double> blended = new LinkedHashMap<>();
        for (String key : gto.keySet()) {
            double value = effectiveAlpha * gto.get(key) + (1 - effectiveAlpha) * agent.getOrDefault(key, 0.0);
            blended.put(key, value);
        }
        blended = normalize(blended);

        String bestKey = null;
        double best = -1.0;
        for (Map.Entry<String, Double> entry : blended.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                bestKey = entry.getKey();
            }
        }

        double divergence = gtoOnly ? 0.0 : divergencePp(gto, agent);
        StrategyReasoning reasoning = new StrategyReasoning(gto, agent, blended, effectiveAlpha, divergence,
            true, null);
        log.debug("[StrategyBlender] decided. handId={} action={} alpha={} divergencePp={}",
            state.handId(), bestKey, effectiveAlpha, String.format("%.1f", divergence));
        return new StrategyDecision(actionsByKey.get(bestKey), reasoning, timing(solution, advice, started),
            gtoOnly, false);
    }

    public double alpha() {
        return alpha;
    }

    private static Map<String, Double> gtoDistribution(GtoSolution solution) {
        Map<String, Double> dist = new LinkedHashMap<>();
        if (solution == null) {
            return dist;
        }
        for (Map.Entry<String, ActionSolutionEntry> entry : solution.actions().entrySet()) {
            double p = entry.getValue().frequency();
            if (p > 0 && Double.isFinite(p)) {
                dist.put(entry.getKey(), p);
            }
        }
        return normalize(dist);
    }

    private static Map<String, Double> advisorDistribution(AggregatedAdvisorOutput advice,
                                                           Map<String, Action> actionsByKey) {
        Map<String, Double> dist = new LinkedHashMap<>();
        if (advice == null || advice.normalizedActions().isEmpty()) {
            return dist;
        }
        Map<ActionType, List<String>> keysByType = new EnumMap<>(ActionType.class);
        actionsByKey.forEach((key, action) ->
            keysByType.computeIfAbsent(action.type(), t -> new ArrayList<>()).add(key));

        for (Map.Entry<ActionType, Double> weight : advice.normalizedActions().entrySet()) {
            List<String> keys = keysByType.get(weight.getKey());
            if (keys == null || weight.getValue() <= 0) {
                continue;
            }
            double share = weight.getValue() / keys.size();
            for (String key : keys) {
                dist.merge(key, share, Double::sum);
            }
        }
        return normalize(dist);
    }

    private static double divergencePp(Map<String, Double> gto, Map<String, Double> agent) {
        double sum = 0.0;
        for (String key : gto.keySet()) {
            sum += Math.abs(gto.get(key) - agent.getOrDefault(key, 0.0));
        }
        for (Map.Entry<String, Double> entry : agent.entrySet()) {
            if (!gto.containsKey(entry.getKey())) {
                sum += entry.getValue();
            }
        }
        return 50.0 * sum;
    }

    private static Map<String, Double> normalize(Map<String, Double> dist) {
        double total = dist.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> out = new LinkedHashMap<>();
        if (total <= 0 || !Double.isFinite(total)) {
            return out;
        }
        dist.forEach((key, value) -> out.put(key, value / total));
        return out;
    }

    private static StrategyTiming timing(GtoSolution solution, AggregatedAdvisorOutput advice, long startedNanos) {
        long gtoMs = solution != null ? solution.computeTimeMs() : 0;
        long agentMs = advice != null ? advice.budgetUsedMs() : 0;
        long synthesisMs = (System.nanoTime() - startedNanos) / 1_000_000L;
        return new StrategyTiming(gtoMs, agentMs, synthesisMs, gtoMs + agentMs + synthesisMs);
    }
}
