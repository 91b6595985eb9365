package com.learningplatform.coordinator.network;

/** Supplies the link characteristics recorded for an agent at registration. */
public interface NetworkProfiler {

    NetworkProfile profile(String agentId);

    record NetworkProfile(double latencyMs, double bandwidthMbps) {}
}
