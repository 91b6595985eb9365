package com.learningplatform.common.aggregation;

import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.ModelWeights;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Federated averaging with validation scores as contribution weights.
 *
 * <pre>
 *   w = Σ (score_i / Σ score) × w_i          element-wise
 * </pre>
 *
 * <p>When every score is 0 the updates are averaged with equal weight. A position
 * where all inputs agree keeps that value bit for bit.
 *
 * <p>Stateless and thread-safe.
 */
public class FederatedAveragingStrategy implements AggregationStrategy {

    @Override
    public ModelWeights aggregate(List<ModelUpdate> updates) {
        double[] shares = shares(updates);
        List<ModelWeights> inputs = updates.stream().map(ModelUpdate::weights).collect(Collectors.toList());
        return ModelWeights.combine(inputs, values -> {
            if (allEqual(values)) {
                return values[0];
            }
            double sum = 0.0;
            for (int i = 0; i < values.length; i++) {
                sum += values[i] * shares[i];
            }
            return sum;
        });
    }

    private static boolean allEqual(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], values[0]) != 0) {
                return false;
            }
        }
        return true;
    }

    static double[] shares(List<ModelUpdate> updates) {
        double total = updates.stream().mapToDouble(ModelUpdate::validationScore).sum();
        double[] shares = new double[updates.size()];
        for (int i = 0; i < shares.length; i++) {
            shares[i] = total > 0.0
                ? updates.get(i).validationScore() / total
                : 1.0 / updates.size();
        }
        return shares;
    }
}
