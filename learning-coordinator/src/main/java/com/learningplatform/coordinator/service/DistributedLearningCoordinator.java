package com.learningplatform.coordinator.service;

import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AgentRole;
import com.learningplatform.common.model.AggregationResult;
import com.learningplatform.common.model.ByzantineDetectionResult;
import com.learningplatform.common.model.CoordinatorMetrics;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.LearningStrategy;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.ModelWeights;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single entry point for collaborators of the coordinator. Every call is synchronous;
 * failures surface as {@link com.learningplatform.common.exception.CoordinatorException}
 * subclasses except registration, which answers {@code false}.
 */
@Service
public class DistributedLearningCoordinator {

    private final AgentRegistryService registry;
    private final RoundManagerService rounds;
    private final UpdateIngestionService ingestion;
    private final AggregationService aggregation;
    private final CoordinatorMetricsService metrics;

    public DistributedLearningCoordinator(AgentRegistryService registry,
                                          RoundManagerService rounds,
                                          UpdateIngestionService ingestion,
                                          AggregationService aggregation,
                                          CoordinatorMetricsService metrics) {
        this.registry    = registry;
        this.rounds      = rounds;
        this.ingestion   = ingestion;
        this.aggregation = aggregation;
        this.metrics     = metrics;
    }

    public boolean registerAgent(String agentId, AgentRole role, List<String> networks,
                                 double computationalCapacity, List<String> specialization) {
        return registry.register(agentId, role, networks, computationalCapacity, specialization);
    }

    public LearningRound createLearningRound(String modelId, LearningStrategy strategy, double targetAccuracy,
                                             int maxIterations, double privacyEpsilon) {
        return rounds.createRound(modelId, strategy, targetAccuracy, maxIterations, privacyEpsilon);
    }

    public ModelUpdate submitModelUpdate(String agentId, String roundId, ModelWeights weights,
                                         double validationScore) {
        return ingestion.submit(agentId, roundId, weights, validationScore);
    }

    public AggregationResult aggregateModelUpdates(String roundId) {
        return aggregation.aggregate(roundId);
    }

    public CoordinatorMetrics getCoordinatorMetrics() {
        return metrics.snapshot();
    }

    public Agent getAgent(String agentId) {
        return registry.getAgent(agentId);
    }

    public LearningRound getRound(String roundId) {
        return rounds.getRound(roundId);
    }

    public AggregationResult getAggregationResult(String roundId) {
        return aggregation.getAggregationResult(roundId);
    }

    public List<ByzantineDetectionResult> getDetections(String roundId) {
        return aggregation.getDetections(roundId);
    }
}
