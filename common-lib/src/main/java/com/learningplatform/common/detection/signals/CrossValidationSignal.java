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
 * Blend of the reported score and the agent's historical mean below 0.6.
 *
 * <pre>
 *   cv = 0.7 × validationScore + 0.3 × mean(history)     (history non-empty)
 *   cv = validationScore                                  (history empty)
 *   cv = 0.5                                              (agent unknown, never flagged)
 * </pre>
 */
public class CrossValidationSignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.35;
    static final double MIN_SCORE = 0.6;
    static final double CURRENT_WEIGHT = 0.7;
    static final double HISTORY_WEIGHT = 0.3;
    static final double NEUTRAL_SCORE = 0.5;

    @Override
    public String name() {
        return "cross_validation";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<SignalHit> hits = new ArrayList<>();
        for (ModelUpdate u : context.updates()) {
            Agent agent = context.agent(u.agentId());
            if (agent == null) {
                continue;
            }
            double cv = score(u.validationScore(), agent);
            if (cv < MIN_SCORE) {
                hits.add(new SignalHit(u.agentId(), CONTRIBUTION,
                    String.format(Locale.ROOT, "poor_cv_performance_%.2f", cv)));
            }
        }
        return hits;
    }

    static double score(double validationScore, Agent agent) {
        if (agent == null) {
            return NEUTRAL_SCORE;
        }
        double cv = agent.performanceHistory().isEmpty()
            ? validationScore
            : CURRENT_WEIGHT * validationScore + HISTORY_WEIGHT * agent.averagePerformance(validationScore);
        return WeightMath.clampUnit(cv);
    }
}
