package com.learningplatform.common.aggregation;

import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.privacy.NoiseSource;
import com.learningplatform.common.tensor.ModelWeights;

import java.util.List;

/**
 * Federated average masked with independent Gaussian noise of fixed scale
 * {@value #MASK_SCALE} on every element.
 *
 * <p>A stand-in for secure multiparty aggregation, not an implementation of one.
 */
public class SecureAggregationStrategy implements AggregationStrategy {

    public static final double MASK_SCALE = 0.01;

    private final FederatedAveragingStrategy averaging = new FederatedAveragingStrategy();
    private final NoiseSource noise;

    public SecureAggregationStrategy(NoiseSource noise) {
        this.noise = noise;
    }

    @Override
    public ModelWeights aggregate(List<ModelUpdate> updates) {
        return averaging.aggregate(updates).map(w -> w + noise.gaussian(MASK_SCALE));
    }
}
