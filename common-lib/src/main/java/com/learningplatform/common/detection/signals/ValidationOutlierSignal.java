package com.learningplatform.common.detection.signals;

import com.learningplatform.common.detection.DetectionContext;
import com.learningplatform.common.detection.SignalHit;
import com.learningplatform.common.detection.SuspicionSignal;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.WeightMath;

import java.util.ArrayList;
import java.util.List;

/**
 * Reported validation score more than 2 standard deviations from the round mean.
 */
public class ValidationOutlierSignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.3;
    static final double STD_MULTIPLIER = 2.0;

    @Override
    public String name() {
        return "validation_outlier";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<ModelUpdate> updates = context.updates();
        double[] scores = updates.stream().mapToDouble(ModelUpdate::validationScore).toArray();
        double mean = WeightMath.mean(scores);
        double std  = WeightMath.stdDev(scores);

        List<SignalHit> hits = new ArrayList<>();
        for (ModelUpdate u : updates) {
            if (Math.abs(u.validationScore() - mean) > STD_MULTIPLIER * std) {
                hits.add(new SignalHit(u.agentId(), CONTRIBUTION, "validation_score_outlier"));
            }
        }
        return hits;
    }
}
