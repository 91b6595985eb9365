package com.learningplatform.common.detection.signals;

import com.learningplatform.common.detection.DetectionContext;
import com.learningplatform.common.detection.SignalHit;
import com.learningplatform.common.detection.SuspicionSignal;
import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.WeightMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Erratic validation history: consistency {@code 1 − std/mean} over the last 5
 * scores below 0.4.
 *
 * <p>Fewer than 2 scores → consistency 0.8; a non-positive mean → 0.5.
 */
public class TemporalConsistencySignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.2;
    static final double MIN_CONSISTENCY = 0.4;
    static final int WINDOW = 5;
    static final double NEW_AGENT_CONSISTENCY = 0.8;
    static final double ZERO_MEAN_CONSISTENCY = 0.5;

    @Override
    public String name() {
        return "temporal_consistency";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<SignalHit> hits = new ArrayList<>();
        for (ModelUpdate u : context.updates()) {
            double consistency = consistency(context.agent(u.agentId()));
            if (consistency < MIN_CONSISTENCY) {
                hits.add(new SignalHit(u.agentId(), CONTRIBUTION,
                    String.format(Locale.ROOT, "temporal_inconsistency_%.2f", consistency)));
            }
        }
        return hits;
    }

    static double consistency(Agent agent) {
        if (agent == null || agent.performanceHistory().size() < 2) {
            return NEW_AGENT_CONSISTENCY;
        }
        List<Double> history = agent.performanceHistory();
        double[] window = history.subList(Math.max(0, history.size() - WINDOW), history.size())
            .stream().mapToDouble(Double::doubleValue).toArray();
        double mean = WeightMath.mean(window);
        if (mean <= 0) {
            return ZERO_MEAN_CONSISTENCY;
        }
        return Math.max(0.0, 1.0 - WeightMath.stdDev(window) / mean);
    }
}
