package com.learningplatform.common.model;

/**
 * Aggregation strategy chosen for a learning round.
 *
 * <p>Each strategy declares the maximum number of agents selected into a round
 * ({@link #maxParticipants()}) and whether updates submitted to the round receive
 * differential-privacy noise at ingestion ({@link #injectsPrivacyNoise()}).
 *
 * <pre>
 *   FEDERATED_AVERAGING   → 10 agents, score-weighted mean
 *   SECURE_AGGREGATION    →  8 agents, score-weighted mean + masking noise
 *   BYZANTINE_ROBUST      → 15 agents, element-wise median
 *   DIFFERENTIAL_PRIVATE  → 12 agents, Gaussian noise at ingestion, score-weighted mean
 *   CONTINUAL_LEARNING    → 10 agents, score-weighted mean
 *   PERSONALIZED_FL       → 10 agents, score-weighted mean
 * </pre>
 */
public enum LearningStrategy {
    FEDERATED_AVERAGING(10),
    SECURE_AGGREGATION(8),
    BYZANTINE_ROBUST(15),
    DIFFERENTIAL_PRIVATE(12),
    CONTINUAL_LEARNING(10),
    PERSONALIZED_FL(10);

    private final int maxParticipants;

    LearningStrategy(int maxParticipants) {
        this.maxParticipants = maxParticipants;
    }

    public int maxParticipants() {
        return maxParticipants;
    }

    public boolean injectsPrivacyNoise() {
        return this == DIFFERENTIAL_PRIVATE;
    }
}
