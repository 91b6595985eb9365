package com.learningplatform.coordinator.config;

import java.time.Duration;

/**
 * Coordinator-wide tunables, bound from {@code coordinator.*} in {@code application.yml}.
 *
 * @param privacyBudgetTotal      epsilon issued to every agent at registration
 * @param byzantineToleranceRatio fraction of a round that may be excluded, further bounded by N/3
 * @param maxConcurrentRounds     rounds that may be active (non-terminal) at once
 * @param roundDuration           deadline offset from round start
 */
public record CoordinatorSettings(
    String   coordinatorId,
    double   privacyBudgetTotal,
    double   consensusThreshold,
    double   byzantineToleranceRatio,
    int      maxConcurrentRounds,
    Duration roundDuration
) {}
