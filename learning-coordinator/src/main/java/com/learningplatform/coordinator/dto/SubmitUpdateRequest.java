package com.learningplatform.coordinator.dto;

import com.learningplatform.common.tensor.ModelWeights;

/**
 * Body of {@code POST /api/v1/coordinator/rounds/{roundId}/updates}.
 *
 * @param weights layer name → number | number[] | number[][]
 */
public record SubmitUpdateRequest(
    String       agentId,
    ModelWeights weights,
    double       validationScore
) {}
