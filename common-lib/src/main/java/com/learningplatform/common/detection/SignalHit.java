package com.learningplatform.common.detection;

/**
 * A suspicion contribution for one agent from one signal.
 *
 * @param evidence tag recorded in the detection result, e.g. {@code low_weight_similarity}
 */
public record SignalHit(String agentId, double contribution, String evidence) {}
