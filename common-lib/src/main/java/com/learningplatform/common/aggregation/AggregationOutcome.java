package com.learningplatform.common.aggregation;

import com.learningplatform.common.tensor.ModelWeights;

/**
 * Numeric output of {@link Aggregator}; the coordinator adds identifiers and timing.
 *
 * @param privacyLoss   Σ Gaussian sigma applied at ingestion to the contributing updates
 * @param epsilonSpent  Σ epsilon charged to the contributing agents
 */
public record AggregationOutcome(
    ModelWeights weights,
    double qualityScore,
    boolean consensusAchieved,
    double privacyLoss,
    double epsilonSpent
) {}
