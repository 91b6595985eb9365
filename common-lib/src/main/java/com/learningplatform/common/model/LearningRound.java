package com.learningplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A learning round. Immutable; a phase change produces a new instance via
 * {@link #withPhase(RoundPhase)}.
 *
 * <p>{@code byzantineTolerance} is an agent count:
 * {@code min(floor(N * ratio), floor(N / 3))} for N participants.
 */
public record LearningRound(
    @JsonProperty("roundId")              String   roundId,
    @JsonProperty("strategy")             LearningStrategy strategy,
    @JsonProperty("participatingAgents")  List<String> participatingAgents,
    @JsonProperty("coordinatorId")        String   coordinatorId,
    @JsonProperty("modelId")              String   modelId,
    @JsonProperty("targetAccuracy")       double   targetAccuracy,
    @JsonProperty("maxIterations")        int      maxIterations,
    @JsonProperty("privacyEpsilon")       double   privacyEpsilon,
    @JsonProperty("byzantineTolerance")   int      byzantineTolerance,
    @JsonProperty("startTime")            Instant  startTime,
    @JsonProperty("deadline")             Instant  deadline,
    @JsonProperty("currentPhase")         RoundPhase currentPhase,
    @JsonProperty("metadata")             Map<String, Object> metadata
) {
    public LearningRound {
        participatingAgents = List.copyOf(participatingAgents);
        metadata            = Map.copyOf(metadata);
    }

    public LearningRound withPhase(RoundPhase phase) {
        return new LearningRound(roundId, strategy, participatingAgents, coordinatorId, modelId,
                                 targetAccuracy, maxIterations, privacyEpsilon, byzantineTolerance,
                                 startTime, deadline, phase, metadata);
    }

    /** Tolerance as a fraction of the participant count, 0.0 for an empty round. */
    @JsonIgnore
    public double toleranceFraction() {
        return participatingAgents.isEmpty()
            ? 0.0
            : (double) byzantineTolerance / participatingAgents.size();
    }

    public boolean isParticipant(String agentId) {
        return participatingAgents.contains(agentId);
    }

    public boolean isPastDeadline(Instant now) {
        return now.isAfter(deadline);
    }
}
