package com.learningplatform.coordinator.service;

import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AggregationResult;
import com.learningplatform.common.model.CoordinatorMetrics;
import com.learningplatform.coordinator.config.CoordinatorSettings;
import com.learningplatform.coordinator.store.CoordinatorStore;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Derives {@link CoordinatorMetrics} from the store on every call.
 *
 * <pre>
 *   successRate              = consensus aggregations / max(completed, 1)
 *   privacyBudgetUtilization = (agents × total − Σ remaining) / (agents × total)
 *   networkHealth            = avgTrust × (1 − min(byzantineDetected / max(agents, 1), 0.5))
 * </pre>
 */
@Service
public class CoordinatorMetricsService {

    static final double MAX_BYZANTINE_PENALTY = 0.5;

    private final CoordinatorStore store;
    private final CoordinatorSettings settings;

    public CoordinatorMetricsService(CoordinatorStore store, CoordinatorSettings settings) {
        this.store    = store;
        this.settings = settings;
    }

    public CoordinatorMetrics snapshot() {
        List<Agent> agents = store.agents();
        List<AggregationResult> aggregations = store.aggregations();

        int completed  = aggregations.size();
        int successful = (int) aggregations.stream().filter(AggregationResult::consensusAchieved).count();
        long byzantine = aggregations.stream().mapToLong(a -> a.byzantineAgentsDetected().size()).sum();
        int active     = (int) store.rounds().stream().filter(r -> !r.currentPhase().isTerminal()).count();

        double avgTrust = agents.stream().mapToDouble(Agent::trustScore).average().orElse(0.0);

        return new CoordinatorMetrics(
            settings.coordinatorId(),
            agents.size(),
            active,
            completed,
            successful,
            (double) successful / Math.max(completed, 1),
            byzantine,
            store.totalUpdates(),
            avgTrust,
            privacyUtilization(agents),
            networkHealth(agents, avgTrust, byzantine));
    }

    private double privacyUtilization(List<Agent> agents) {
        double capacity = agents.size() * settings.privacyBudgetTotal();
        if (capacity <= 0.0) {
            return 0.0;
        }
        double remaining = agents.stream().mapToDouble(Agent::privacyBudget).sum();
        return (capacity - remaining) / capacity;
    }

    private static double networkHealth(List<Agent> agents, double avgTrust, long byzantineDetected) {
        if (agents.isEmpty()) {
            return 0.0;
        }
        double ratio = (double) byzantineDetected / agents.size();
        return avgTrust * (1.0 - Math.min(ratio, MAX_BYZANTINE_PENALTY));
    }
}
