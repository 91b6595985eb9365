package com.learningplatform.common.aggregation;

import com.learningplatform.common.model.LearningStrategy;
import com.learningplatform.common.privacy.NoiseSource;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves the {@link AggregationStrategy} for a round's {@link LearningStrategy}.
 *
 * <pre>
 *   BYZANTINE_ROBUST    → {@link MedianAggregationStrategy}
 *   SECURE_AGGREGATION  → {@link SecureAggregationStrategy}
 *   everything else     → {@link FederatedAveragingStrategy}
 * </pre>
 */
public final class AggregationStrategies {

    private final Map<LearningStrategy, AggregationStrategy> byStrategy;
    private final AggregationStrategy fallback;

    public AggregationStrategies(NoiseSource noise) {
        this.fallback = new FederatedAveragingStrategy();
        this.byStrategy = new EnumMap<>(LearningStrategy.class);
        byStrategy.put(LearningStrategy.FEDERATED_AVERAGING, fallback);
        byStrategy.put(LearningStrategy.BYZANTINE_ROBUST, new MedianAggregationStrategy());
        byStrategy.put(LearningStrategy.SECURE_AGGREGATION, new SecureAggregationStrategy(noise));
    }

    public AggregationStrategy forStrategy(LearningStrategy strategy) {
        return byStrategy.getOrDefault(strategy, fallback);
    }
}
