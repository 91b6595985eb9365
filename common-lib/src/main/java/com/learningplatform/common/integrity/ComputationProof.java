package com.learningplatform.common.integrity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Integrity artifact binding an agent, the hash of the weights it submitted, its
 * reported validation score and the submission time. {@code signature} is the
 * SHA-256 of those four fields (see {@link #signatureOf}).
 *
 * <p>This is a tamper-evidence check, not a cryptographic commitment scheme.
 */
public record ComputationProof(
    @JsonProperty("agentId")         String  agentId,
    @JsonProperty("weightsHash")     String  weightsHash,
    @JsonProperty("validationScore") double  validationScore,
    @JsonProperty("timestamp")       Instant timestamp,
    @JsonProperty("signature")       String  signature
) {
    public static ComputationProof issue(String agentId, String weightsHash,
                                         double validationScore, Instant timestamp) {
        return new ComputationProof(agentId, weightsHash, validationScore, timestamp,
                                    signatureOf(agentId, weightsHash, validationScore, timestamp));
    }

    static String signatureOf(String agentId, String weightsHash,
                              double validationScore, Instant timestamp) {
        String payload = agentId + "|" + weightsHash + "|"
                       + Double.toString(validationScore) + "|" + timestamp.toEpochMilli();
        return "proof_" + WeightHasher.sha256Hex(payload);
    }
}
