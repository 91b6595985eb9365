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
 * L2 norm of the flattened weights with |z-score| above 2.5.
 * Requires at least 2 updates; a zero spread yields z = 0.
 */
public class GradientNormSignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.25;
    static final double Z_THRESHOLD = 2.5;

    @Override
    public String name() {
        return "gradient_norm";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<ModelUpdate> updates = context.updates();
        List<SignalHit> hits = new ArrayList<>();
        if (updates.size() < 2) {
            return hits;
        }
        double[] norms = updates.stream().mapToDouble(u -> WeightMath.l2Norm(context.flat(u))).toArray();
        double mean = WeightMath.mean(norms);
        double std  = WeightMath.stdDev(norms);
        for (int i = 0; i < norms.length; i++) {
            double z = std > 0 ? (norms[i] - mean) / std : 0.0;
            if (Math.abs(z) > Z_THRESHOLD) {
                hits.add(new SignalHit(updates.get(i).agentId(), CONTRIBUTION,
                    String.format(Locale.ROOT, "anomalous_gradient_norm_%.2f", z)));
            }
        }
        return hits;
    }
}
