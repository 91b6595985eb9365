package com.learningplatform.common.detection.signals;

import com.learningplatform.common.detection.DetectionContext;
import com.learningplatform.common.detection.SignalHit;
import com.learningplatform.common.detection.SuspicionSignal;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.WeightMath;

import java.util.ArrayList;
import java.util.List;

/**
 * Mean cosine similarity to every other update below 0.5.
 * Needs at least one peer; a lone update is never flagged.
 */
public class WeightSimilaritySignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.4;
    static final double MIN_SIMILARITY = 0.5;

    @Override
    public String name() {
        return "weight_similarity";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<ModelUpdate> updates = context.updates();
        List<SignalHit> hits = new ArrayList<>();
        if (updates.size() < 2) {
            return hits;
        }
        for (ModelUpdate u : updates) {
            double sum = 0.0;
            for (ModelUpdate other : updates) {
                if (other != u) {
                    sum += WeightMath.cosineSimilarity(context.flat(u), context.flat(other));
                }
            }
            double similarity = sum / (updates.size() - 1);
            if (similarity < MIN_SIMILARITY) {
                hits.add(new SignalHit(u.agentId(), CONTRIBUTION, "low_weight_similarity"));
            }
        }
        return hits;
    }
}
