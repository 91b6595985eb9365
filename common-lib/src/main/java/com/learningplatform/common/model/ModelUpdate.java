package com.learningplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.learningplatform.common.integrity.ComputationProof;
import com.learningplatform.common.tensor.ModelWeights;

import java.time.Instant;

/**
 * One agent's contribution to one round. Immutable once accepted.
 *
 * <ul>
 *   <li>{@code weights}           – stored after any differential-privacy noise.</li>
 *   <li>{@code weightHash}        – SHA-256 of the canonical JSON of {@code weights}.</li>
 *   <li>{@code differentialNoise} – Gaussian sigma applied per element, 0.0 if none.</li>
 *   <li>{@code epsilonSpent}      – privacy loss charged to the agent, 0.0 if none.</li>
 * </ul>
 */
public record ModelUpdate(
    @JsonProperty("updateId")          String  updateId,
    @JsonProperty("agentId")           String  agentId,
    @JsonProperty("roundId")           String  roundId,
    @JsonProperty("weights")           ModelWeights weights,
    @JsonProperty("weightHash")        String  weightHash,
    @JsonProperty("differentialNoise") double  differentialNoise,
    @JsonProperty("epsilonSpent")      double  epsilonSpent,
    @JsonProperty("validationScore")   double  validationScore,
    @JsonProperty("computationProof")  ComputationProof computationProof,
    @JsonProperty("timestamp")         Instant timestamp,
    @JsonProperty("signature")         String  signature,
    @JsonProperty("bandwidthUsedKb")   double  bandwidthUsedKb
) {}
