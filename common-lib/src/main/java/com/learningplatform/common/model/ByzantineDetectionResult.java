package com.learningplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Verdict of the detection ensemble for one round.
 *
 * <ul>
 *   <li>{@code suspectedAgents}     – agents to exclude, highest suspicion first; never more
 *       than the round's tolerance.</li>
 *   <li>{@code detectionConfidence} – the maximum per-agent suspicion score (0.0 when no updates).</li>
 *   <li>{@code suspicionScores}     – every scored agent's summed contributions.</li>
 *   <li>{@code evidence}            – tags of the signals that fired, per agent.</li>
 *   <li>{@code flaggedCount}        – agents at or above {@code threshold} before truncation.</li>
 * </ul>
 */
public record ByzantineDetectionResult(
    @JsonProperty("detectionId")         String  detectionId,
    @JsonProperty("roundId")             String  roundId,
    @JsonProperty("suspectedAgents")     List<String> suspectedAgents,
    @JsonProperty("detectionConfidence") double  detectionConfidence,
    @JsonProperty("detectionMethod")     String  detectionMethod,
    @JsonProperty("threshold")           double  threshold,
    @JsonProperty("flaggedCount")        int     flaggedCount,
    @JsonProperty("suspicionScores")     Map<String, Double> suspicionScores,
    @JsonProperty("evidence")            Map<String, List<String>> evidence,
    @JsonProperty("recommendedAction")   RecommendedAction recommendedAction,
    @JsonProperty("timestamp")           Instant timestamp
) {
    public enum RecommendedAction {
        PROCEED,
        EXCLUDE_FROM_AGGREGATION
    }

    public boolean isSuspected(String agentId) {
        return suspectedAgents.contains(agentId);
    }
}
