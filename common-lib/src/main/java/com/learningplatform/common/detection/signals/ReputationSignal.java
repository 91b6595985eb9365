package com.learningplatform.common.detection.signals;

import com.learningplatform.common.detection.DetectionContext;
import com.learningplatform.common.detection.SignalHit;
import com.learningplatform.common.detection.SuspicionSignal;
import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.ModelUpdate;

import java.util.ArrayList;
import java.util.List;

/** Stored Byzantine score above 0.5. */
public class ReputationSignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.2;
    static final double MAX_BYZANTINE_SCORE = 0.5;

    @Override
    public String name() {
        return "reputation";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<SignalHit> hits = new ArrayList<>();
        for (ModelUpdate u : context.updates()) {
            Agent agent = context.agent(u.agentId());
            if (agent != null && agent.byzantineScore() > MAX_BYZANTINE_SCORE) {
                hits.add(new SignalHit(u.agentId(), CONTRIBUTION, "poor_historical_reputation"));
            }
        }
        return hits;
    }
}
