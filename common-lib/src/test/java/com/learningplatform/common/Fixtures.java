package com.learningplatform.common;

import com.learningplatform.common.integrity.ComputationProof;
import com.learningplatform.common.integrity.WeightHasher;
import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AgentRole;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.LearningStrategy;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.model.RoundPhase;
import com.learningplatform.common.tensor.ModelWeights;
import com.learningplatform.common.tensor.VectorTensor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Shared builders for pure-logic tests. */
public final class Fixtures {

    public static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    public static final Instant NOW   = START.plus(Duration.ofMinutes(10));

    private Fixtures() {}

    public static Agent agent(String id) {
        return agent(id, 0.8, 0.0, List.of());
    }

    public static Agent agent(String id, double trust, double byzantine, List<Double> history) {
        return new Agent(id, AgentRole.PARTICIPANT, List.of("ethereum"), 0.8, trust, byzantine,
                         10.0, List.of("general"), null, history.size(), history, 50.0, 100.0, List.of());
    }

    public static LearningRound round(LearningStrategy strategy, List<String> agentIds, int tolerance) {
        return new LearningRound("round_test", strategy, agentIds, "coordinator_test", "model_test",
                                 0.9, 10, 1.0, tolerance, START, START.plus(Duration.ofHours(1)),
                                 RoundPhase.TRAINING, Map.of());
    }

    public static ModelWeights vector(double... values) {
        return new ModelWeights(Map.of("layer", VectorTensor.of(values)));
    }

    public static ModelUpdate update(String agentId, ModelWeights weights, double score) {
        return update(agentId, weights, score, NOW);
    }

    public static ModelUpdate update(String agentId, ModelWeights weights, double score, Instant at) {
        String hash = WeightHasher.hash(weights);
        return new ModelUpdate("update_" + agentId, agentId, "round_test", weights, hash, 0.0, 0.0,
                               score, ComputationProof.issue(agentId, hash, score, at), at,
                               "sig_test", WeightHasher.sizeKb(weights));
    }
}
