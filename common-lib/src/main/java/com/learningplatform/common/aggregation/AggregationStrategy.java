package com.learningplatform.common.aggregation;

import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.ModelWeights;

import java.util.List;

/**
 * Strategy contract for combining the surviving updates of a round into one
 * weight set.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Shape-preserving</b>: the result has the shape of the inputs</li>
 *   <li><b>Side-effect free</b>: inputs are never modified</li>
 *   <li><b>Non-null</b>        : always return a weight set for a non-empty, same-shaped input</li>
 * </ul>
 *
 * <p>The minimum-update rule is enforced by {@link Aggregator}, not by strategies.
 */
public interface AggregationStrategy {

    /**
     * @param updates non-empty list of same-shaped updates
     * @return the combined weights
     */
    ModelWeights aggregate(List<ModelUpdate> updates);
}
