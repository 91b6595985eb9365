package com.learningplatform.coordinator.service;

import com.learningplatform.common.exception.NotFoundException;
import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AgentRole;
import com.learningplatform.coordinator.config.CoordinatorSettings;
import com.learningplatform.coordinator.network.NetworkProfiler;
import com.learningplatform.coordinator.store.AgentEntity;
import com.learningplatform.coordinator.store.CoordinatorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Agent registration and lookup. Registration never throws: invalid input or a
 * duplicate id is logged and reported as {@code false}.
 */
@Service
public class AgentRegistryService {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistryService.class);

    static final double INITIAL_TRUST = 0.8;
    static final List<String> DEFAULT_SPECIALIZATION = List.of("general");

    private final CoordinatorStore store;
    private final NetworkProfiler networkProfiler;
    private final CoordinatorSettings settings;

    public AgentRegistryService(CoordinatorStore store, NetworkProfiler networkProfiler,
                                CoordinatorSettings settings) {
        this.store           = store;
        this.networkProfiler = networkProfiler;
        this.settings        = settings;
    }

    public boolean register(String agentId, AgentRole role, List<String> networks,
                            double computationalCapacity, List<String> specialization) {
        if (agentId == null || agentId.isBlank() || role == null) {
            log.warn("Agent registration rejected: missing id or role. agentId={} role={}", agentId, role);
            return false;
        }
        if (networks == null || networks.isEmpty()) {
            log.warn("Agent registration rejected: no networks. agentId={}", agentId);
            return false;
        }
        if (!(computationalCapacity >= 0.0 && computationalCapacity <= 1.0)) {
            log.warn("Agent registration rejected: capacity out of range. agentId={} capacity={}",
                     agentId, computationalCapacity);
            return false;
        }

        NetworkProfiler.NetworkProfile profile = networkProfiler.profile(agentId);
        AgentEntity entity = new AgentEntity();
        entity.setAgentId(agentId);
        entity.setRole(role);
        entity.setNetworks(new ArrayList<>(networks));
        entity.setComputationalCapacity(computationalCapacity);
        entity.setTrustScore(INITIAL_TRUST);
        entity.setByzantineScore(0.0);
        entity.setPrivacyBudget(settings.privacyBudgetTotal());
        entity.setSpecialization(new ArrayList<>(
            specialization == null || specialization.isEmpty() ? DEFAULT_SPECIALIZATION : specialization));
        entity.setNetworkLatencyMs(profile.latencyMs());
        entity.setBandwidthMbps(profile.bandwidthMbps());

        if (!store.addAgent(entity)) {
            log.warn("Agent registration rejected: duplicate id. agentId={}", agentId);
            return false;
        }
        log.info("Agent registered. agentId={} role={} networks={} capacity={} latencyMs={}",
                 agentId, role, networks, computationalCapacity, String.format("%.1f", profile.latencyMs()));
        return true;
    }

    public Agent getAgent(String agentId) {
        return store.findAgent(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
    }

    public List<Agent> agents() {
        return store.agents();
    }
}
