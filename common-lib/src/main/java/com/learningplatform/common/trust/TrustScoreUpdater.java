package com.learningplatform.common.trust;

import com.learningplatform.common.tensor.WeightMath;

/**
 * Reputation adjustment after an aggregation.
 *
 * <h3>Survivor</h3>
 * <p>An agent whose update was aggregated gains {@value #REWARD_FACTOR} × its validation score
 * in trust. Its Byzantine score is unchanged.
 *
 * <h3>Suspect</h3>
 * <p>An agent excluded by detection loses {@value #PENALTY_FACTOR} × detection confidence in
 * trust and gains {@value #BYZANTINE_INCREMENT} in Byzantine score.
 *
 * <p>Every result is clamped to [0.0, 1.0]. Stateless, pure, and thread-safe; callers apply
 * the result under the agent's lock.
 */
public final class TrustScoreUpdater {

    public static final double REWARD_FACTOR       = 0.05;
    public static final double PENALTY_FACTOR      = 0.20;
    public static final double BYZANTINE_INCREMENT = 0.10;

    private TrustScoreUpdater() {}

    public static Reputation rewardSurvivor(Reputation current, double validationScore) {
        return new Reputation(
            WeightMath.clampUnit(current.trustScore() + REWARD_FACTOR * validationScore),
            current.byzantineScore());
    }

    public static Reputation penalizeSuspect(Reputation current, double detectionConfidence) {
        return new Reputation(
            WeightMath.clampUnit(current.trustScore() - PENALTY_FACTOR * detectionConfidence),
            WeightMath.clampUnit(current.byzantineScore() + BYZANTINE_INCREMENT));
    }

    /** Trust and Byzantine score of one agent. */
    public record Reputation(double trustScore, double byzantineScore) {}
}
