package com.learningplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.learningplatform.common.tensor.ModelWeights;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful round aggregation.
 *
 * <ul>
 *   <li>{@code qualityScore}      – 0.6 × mean validation score + 0.4 × mean pairwise cosine.</li>
 *   <li>{@code consensusAchieved} – {@code qualityScore ≥ consensus threshold}.</li>
 *   <li>{@code privacyLoss}       – sum of the noise sigma recorded at ingestion for the contributing updates; their epsilon total is in {@code metadata.epsilonSpent}.</li>
 *   <li>{@code computationTime}   – time spent in detection and aggregation.</li>
 * </ul>
 */
public record AggregationResult(
    @JsonProperty("aggregationId")          String   aggregationId,
    @JsonProperty("roundId")                String   roundId,
    @JsonProperty("aggregatedWeights")      ModelWeights aggregatedWeights,
    @JsonProperty("participatingUpdates")   List<String> participatingUpdates,
    @JsonProperty("byzantineAgentsDetected") List<String> byzantineAgentsDetected,
    @JsonProperty("aggregationStrategy")    LearningStrategy aggregationStrategy,
    @JsonProperty("qualityScore")           double   qualityScore,
    @JsonProperty("privacyLoss")            double   privacyLoss,
    @JsonProperty("computationTime")        Duration computationTime,
    @JsonProperty("consensusAchieved")      boolean  consensusAchieved,
    @JsonProperty("metadata")               Map<String, Object> metadata
) {}
