package com.learningplatform.common.selection;

import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.LearningStrategy;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stateless calculator that decides which registered agents join a learning round.
 *
 * <p><b>Eligibility</b>:
 * <pre>
 *   role ∈ {PARTICIPANT, VALIDATOR}  AND  privacyBudget &gt; 0.1  AND  trustScore &gt; 0.5
 * </pre>
 *
 * <p><b>Composite score</b> (per eligible agent):
 * <pre>
 *   score = trust × 0.3
 *         + capacity × 0.3
 *         + (1 − byzantineScore) × 0.2
 *         + 1 / (1 + latencyMs) × 0.1
 *         + mean(performanceHistory, default 0.5) × 0.1
 * </pre>
 *
 * <p><b>Selection</b>: ranked by score descending, ties by agent id ascending, then the
 * first {@code min(strategy.maxParticipants(), eligible)} are taken.
 */
public final class AgentSelectionScorer {

    static final double MIN_PRIVACY_BUDGET = 0.1;
    static final double MIN_TRUST          = 0.5;

    static final double TRUST_COEFF       = 0.3;
    static final double CAPACITY_COEFF    = 0.3;
    static final double BYZANTINE_COEFF   = 0.2;
    static final double LATENCY_COEFF     = 0.1;
    static final double PERFORMANCE_COEFF = 0.1;
    static final double DEFAULT_PERFORMANCE = 0.5;

    private AgentSelectionScorer() {}

    public static boolean isEligible(Agent agent) {
        return agent.role().isRoundEligible()
            && agent.privacyBudget() > MIN_PRIVACY_BUDGET
            && agent.trustScore() > MIN_TRUST;
    }

    public static double score(Agent agent) {
        return agent.trustScore() * TRUST_COEFF
             + agent.computationalCapacity() * CAPACITY_COEFF
             + (1.0 - agent.byzantineScore()) * BYZANTINE_COEFF
             + (1.0 / (1.0 + agent.networkLatencyMs())) * LATENCY_COEFF
             + agent.averagePerformance(DEFAULT_PERFORMANCE) * PERFORMANCE_COEFF;
    }

    /**
     * Scores every eligible agent.
     *
     * @return agentId → composite score, in ranking order
     */
    public static Map<String, Double> rank(Collection<Agent> agents) {
        return agents.stream()
            .filter(AgentSelectionScorer::isEligible)
            .map(a -> Map.entry(a.agentId(), score(a)))
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                                      (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * Selects the participants of a round.
     *
     * @return ranked agent ids, possibly fewer than the strategy cap; the caller
     *         enforces the minimum round size
     */
    public static List<String> select(Collection<Agent> agents, LearningStrategy strategy) {
        return rank(agents).keySet().stream()
            .limit(strategy.maxParticipants())
            .collect(Collectors.toList());
    }
}
