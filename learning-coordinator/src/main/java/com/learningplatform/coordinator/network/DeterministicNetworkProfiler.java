package com.learningplatform.coordinator.network;

import com.learningplatform.common.integrity.WeightHasher;

/**
 * Stable pseudo-profile derived from the SHA-256 of the agent id.
 *
 * <pre>
 *   latency   ∈ [10, 100)  ms
 *   bandwidth ∈ [10, 1000) MB/s
 * </pre>
 *
 * The same id always yields the same profile, so selection scores are reproducible.
 */
public class DeterministicNetworkProfiler implements NetworkProfiler {

    static final double MIN_LATENCY_MS   = 10.0;
    static final double MAX_LATENCY_MS   = 100.0;
    static final double MIN_BANDWIDTH    = 10.0;
    static final double MAX_BANDWIDTH    = 1000.0;

    @Override
    public NetworkProfile profile(String agentId) {
        String digest = WeightHasher.sha256Hex(agentId);
        double latency   = MIN_LATENCY_MS + fraction(digest, 0) * (MAX_LATENCY_MS - MIN_LATENCY_MS);
        double bandwidth = MIN_BANDWIDTH + fraction(digest, 8) * (MAX_BANDWIDTH - MIN_BANDWIDTH);
        return new NetworkProfile(latency, bandwidth);
    }

    /** Eight hex digits at {@code offset} mapped to [0, 1). */
    private static double fraction(String hex, int offset) {
        long bits = Long.parseLong(hex.substring(offset, offset + 8), 16);
        return bits / (double) (1L << 32);
    }
}
