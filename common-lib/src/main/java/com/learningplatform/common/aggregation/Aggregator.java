package com.learningplatform.common.aggregation;

import com.learningplatform.common.exception.InsufficientParticipantsException;
import com.learningplatform.common.exception.InvalidArgumentException;
import com.learningplatform.common.model.LearningStrategy;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.ModelWeights;

import java.util.List;

/**
 * Combines the updates that survived detection under the round's strategy and
 * scores the result.
 *
 * <p>Refuses to run with fewer than {@value #MIN_VALID_UPDATES} updates.
 */
public class Aggregator {

    public static final int MIN_VALID_UPDATES = 2;
    public static final double DEFAULT_CONSENSUS_THRESHOLD = 0.67;

    private final AggregationStrategies strategies;
    private final double consensusThreshold;

    public Aggregator(AggregationStrategies strategies, double consensusThreshold) {
        this.strategies = strategies;
        this.consensusThreshold = consensusThreshold;
    }

    public AggregationOutcome aggregate(List<ModelUpdate> validUpdates, LearningStrategy strategy) {
        if (validUpdates.size() < MIN_VALID_UPDATES) {
            throw new InsufficientParticipantsException(
                "Too few valid updates to aggregate", validUpdates.size(), MIN_VALID_UPDATES);
        }
        var weights = aggregateWeights(validUpdates, strategy);
        double quality = AggregationQualityScorer.quality(validUpdates);
        double privacyLoss = validUpdates.stream().mapToDouble(ModelUpdate::differentialNoise).sum();
        double epsilon = validUpdates.stream().mapToDouble(ModelUpdate::epsilonSpent).sum();
        return new AggregationOutcome(weights, quality, quality >= consensusThreshold, privacyLoss, epsilon);
    }

    public double consensusThreshold() {
        return consensusThreshold;
    }

    private ModelWeights aggregateWeights(List<ModelUpdate> updates, LearningStrategy strategy) {
        try {
            return strategies.forStrategy(strategy).aggregate(updates);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Updates cannot be aggregated: " + e.getMessage(), e);
        }
    }
}
