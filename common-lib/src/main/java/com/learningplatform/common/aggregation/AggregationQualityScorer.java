package com.learningplatform.common.aggregation;

import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.WeightMath;

import java.util.List;

/**
 * Quality of an aggregation, from the contributing updates only.
 *
 * <pre>
 *   quality = clamp(0.6 × mean(validationScore) + 0.4 × mean(pairwise cosine), 0, 1)
 * </pre>
 *
 * <p>With fewer than two updates the consistency term defaults to 0.5.
 */
public final class AggregationQualityScorer {

    static final double SCORE_WEIGHT        = 0.6;
    static final double CONSISTENCY_WEIGHT  = 0.4;
    static final double DEFAULT_CONSISTENCY = 0.5;

    private AggregationQualityScorer() {}

    public static double quality(List<ModelUpdate> updates) {
        if (updates.isEmpty()) {
            return 0.0;
        }
        double avgScore = updates.stream().mapToDouble(ModelUpdate::validationScore).average().orElse(0.0);
        return WeightMath.clampUnit(SCORE_WEIGHT * avgScore + CONSISTENCY_WEIGHT * consistency(updates));
    }

    static double consistency(List<ModelUpdate> updates) {
        if (updates.size() < 2) {
            return DEFAULT_CONSISTENCY;
        }
        double[][] flats = new double[updates.size()][];
        for (int i = 0; i < flats.length; i++) {
            flats[i] = updates.get(i).weights().flatten();
        }
        double sum = 0.0;
        int pairs = 0;
        for (int i = 0; i < flats.length; i++) {
            for (int j = i + 1; j < flats.length; j++) {
                sum += WeightMath.cosineSimilarity(flats[i], flats[j]);
                pairs++;
            }
        }
        return sum / pairs;
    }
}
