package com.learningplatform.common.detection;

import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.LearningStrategy;
import com.learningplatform.common.tensor.WeightMath;

import java.util.Collection;

/**
 * Suspicion threshold derived from the round's own score distribution.
 *
 * <pre>
 *   raw       = mean(scores) + k × std(scores)
 *   threshold = min(raw, 1 − round.toleranceFraction())
 *
 *   strategy               k
 *   BYZANTINE_ROBUST       0.5     (more sensitive)
 *   DIFFERENTIAL_PRIVATE   1.5     (tolerates injected noise)
 *   other                  1.0
 * </pre>
 *
 * <p>No lower bound, so the threshold follows the round's scores down. Agents
 * scoring 0 are never flagged (see {@link ByzantineDetector}).
 */
public final class AdaptiveThreshold {

    static final double EMPTY_THRESHOLD = 0.7;

    private AdaptiveThreshold() {}

    public static double compute(Collection<Double> scores, LearningRound round) {
        double cap = cap(round);
        if (scores.isEmpty()) {
            return Math.min(EMPTY_THRESHOLD, cap);
        }
        double[] values = scores.stream().mapToDouble(Double::doubleValue).toArray();
        double raw = WeightMath.mean(values) + sensitivity(round.strategy()) * WeightMath.stdDev(values);
        return Math.min(raw, cap);
    }

    public static double cap(LearningRound round) {
        return 1.0 - round.toleranceFraction();
    }

    static double sensitivity(LearningStrategy strategy) {
        return switch (strategy) {
            case BYZANTINE_ROBUST     -> 0.5;
            case DIFFERENTIAL_PRIVATE -> 1.5;
            default                   -> 1.0;
        };
    }
}
