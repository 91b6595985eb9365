package com.learningplatform.common.detection;

import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.ModelUpdate;

import java.time.Instant;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a {@link SuspicionSignal} may read: the round's updates, the
 * submitting agents' current state, the round and the evaluation instant.
 *
 * <p>Flattened weight vectors are computed once and shared by all signals.
 */
public final class DetectionContext {

    private final List<ModelUpdate> updates;
    private final Map<String, Agent> agents;
    private final LearningRound round;
    private final Instant now;
    private final Map<ModelUpdate, double[]> flattened = new IdentityHashMap<>();

    public DetectionContext(List<ModelUpdate> updates, Map<String, Agent> agents,
                            LearningRound round, Instant now) {
        this.updates = List.copyOf(updates);
        this.agents  = Map.copyOf(agents);
        this.round   = round;
        this.now     = now;
        for (ModelUpdate u : this.updates) {
            flattened.put(u, u.weights().flatten());
        }
    }

    public List<ModelUpdate> updates() {
        return updates;
    }

    /** Agent state, or {@code null} when the agent is unknown to the registry. */
    public Agent agent(String agentId) {
        return agents.get(agentId);
    }

    public LearningRound round() {
        return round;
    }

    public Instant now() {
        return now;
    }

    public double[] flat(ModelUpdate update) {
        return flattened.get(update);
    }

    /** {@code true} when every update flattens to the same number of elements. */
    public boolean uniformDimensions() {
        if (updates.isEmpty()) {
            return true;
        }
        int n = flat(updates.get(0)).length;
        return updates.stream().allMatch(u -> flat(u).length == n);
    }
}
