package com.learningplatform.common.detection.signals;

import com.learningplatform.common.detection.DetectionContext;
import com.learningplatform.common.detection.SignalHit;
import com.learningplatform.common.detection.SuspicionSignal;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.WeightMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Distance from the ensemble mean weight vector, normalized by dimension, above 0.5.
 *
 * <pre>
 *   divergence = ‖w − mean(w_all)‖₂ / dim
 * </pre>
 *
 * Skipped entirely when fewer than 2 updates exist or dimensions disagree.
 */
public class ModelDivergenceSignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.3;
    static final double MAX_DIVERGENCE = 0.5;

    @Override
    public String name() {
        return "model_divergence";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<ModelUpdate> updates = context.updates();
        List<SignalHit> hits = new ArrayList<>();
        if (updates.size() < 2 || !context.uniformDimensions()) {
            return hits;
        }
        int dim = context.flat(updates.get(0)).length;
        if (dim == 0) {
            return hits;
        }

        double[] ensemble = new double[dim];
        for (ModelUpdate u : updates) {
            double[] w = context.flat(u);
            for (int i = 0; i < dim; i++) {
                ensemble[i] += w[i] / updates.size();
            }
        }

        for (ModelUpdate u : updates) {
            double divergence = WeightMath.euclidean(context.flat(u), ensemble) / dim;
            if (divergence > MAX_DIVERGENCE) {
                hits.add(new SignalHit(u.agentId(), CONTRIBUTION,
                    String.format(Locale.ROOT, "model_divergence_%.3f", divergence)));
            }
        }
        return hits;
    }
}
