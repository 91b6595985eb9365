package com.learningplatform.common.aggregation;

import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.ModelWeights;
import com.learningplatform.common.tensor.WeightMath;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Byzantine-robust aggregation: the element-wise median of all updates.
 * An even count takes the mean of the two middle values.
 *
 * <p>Stateless and thread-safe.
 */
public class MedianAggregationStrategy implements AggregationStrategy {

    @Override
    public ModelWeights aggregate(List<ModelUpdate> updates) {
        List<ModelWeights> inputs = updates.stream().map(ModelUpdate::weights).collect(Collectors.toList());
        return ModelWeights.combine(inputs, WeightMath::median);
    }
}
