package com.learningplatform.coordinator.network;

import com.learningplatform.coordinator.network.NetworkProfiler.NetworkProfile;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeterministicNetworkProfilerTest {

    private final DeterministicNetworkProfiler profiler = new DeterministicNetworkProfiler();

    @ParameterizedTest
    @ValueSource(strings = {"agent_0", "agent_1", "validator-eu", "", "a very long agent identifier"})
    void profileWithinBounds(String agentId) {
        NetworkProfile p = profiler.profile(agentId);
        assertTrue(p.latencyMs() >= 10.0 && p.latencyMs() < 100.0, "latency " + p.latencyMs());
        assertTrue(p.bandwidthMbps() >= 10.0 && p.bandwidthMbps() < 1000.0, "bandwidth " + p.bandwidthMbps());
    }

    @Test
    void sameIdSameProfile() {
        assertEquals(profiler.profile("agent_7"), new DeterministicNetworkProfiler().profile("agent_7"));
        assertNotEquals(profiler.profile("agent_7"), profiler.profile("agent_8"));
    }
}
