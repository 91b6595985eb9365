package com.learningplatform.coordinator.store;

import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AgentRole;
import com.learningplatform.common.model.PrivacyLedgerEntry;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable registry row for one agent. Only touched while holding the agent's lock
 * (see {@link CoordinatorStore#withAgentLock}); callers outside the store only ever
 * see {@link Agent} snapshots.
 *
 * privacyLedger: one entry per differential-privacy spend, oldest first
 */
@Data
@NoArgsConstructor
public class AgentEntity {

    private String agentId;

    private AgentRole role;

    private List<String> networks = new ArrayList<>();

    private double computationalCapacity;

    private double trustScore;

    private double byzantineScore;

    private double privacyBudget;

    private List<String> specialization = new ArrayList<>();

    private Instant lastContribution;

    private int totalContributions;

    private List<Double> performanceHistory = new ArrayList<>();

    private double networkLatencyMs;

    private double bandwidthMbps;

    private List<PrivacyLedgerEntry> privacyLedger = new ArrayList<>();

    public Agent toSnapshot() {
        return new Agent(agentId, role, networks, computationalCapacity, trustScore, byzantineScore,
                         privacyBudget, specialization, lastContribution, totalContributions,
                         performanceHistory, networkLatencyMs, bandwidthMbps, privacyLedger);
    }
}
