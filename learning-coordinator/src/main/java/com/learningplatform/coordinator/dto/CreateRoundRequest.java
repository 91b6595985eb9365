package com.learningplatform.coordinator.dto;

import com.learningplatform.common.model.LearningStrategy;

/** Body of {@code POST /api/v1/coordinator/rounds}. */
public record CreateRoundRequest(
    String           modelId,
    LearningStrategy strategy,
    double           targetAccuracy,
    int              maxIterations,
    double           privacyEpsilon
) {}
