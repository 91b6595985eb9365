package com.learningplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a registered agent and its reputation state.
 *
 * <ul>
 *   <li>{@code trustScore}     – [0.0, 1.0], starts at 0.8, higher is better.</li>
 *   <li>{@code byzantineScore} – [0.0, 1.0], starts at 0.0, lower is better.</li>
 *   <li>{@code privacyBudget}  – remaining epsilon; starts at the coordinator-wide total.</li>
 *   <li>{@code performanceHistory} – validation scores of past submissions, oldest first.</li>
 *   <li>{@code lastContribution}   – {@code null} until the first accepted update.</li>
 * </ul>
 */
public record Agent(
    @JsonProperty("agentId")               String   agentId,
    @JsonProperty("role")                  AgentRole role,
    @JsonProperty("networks")              List<String> networks,
    @JsonProperty("computationalCapacity") double   computationalCapacity,
    @JsonProperty("trustScore")            double   trustScore,
    @JsonProperty("byzantineScore")        double   byzantineScore,
    @JsonProperty("privacyBudget")         double   privacyBudget,
    @JsonProperty("specialization")        List<String> specialization,
    @JsonProperty("lastContribution")      Instant  lastContribution,
    @JsonProperty("totalContributions")    int      totalContributions,
    @JsonProperty("performanceHistory")    List<Double> performanceHistory,
    @JsonProperty("networkLatencyMs")      double   networkLatencyMs,
    @JsonProperty("bandwidthMbps")         double   bandwidthMbps,
    @JsonProperty("privacyLedger")         List<PrivacyLedgerEntry> privacyLedger
) {
    public Agent {
        networks           = List.copyOf(networks);
        specialization     = List.copyOf(specialization);
        performanceHistory = List.copyOf(performanceHistory);
        privacyLedger      = List.copyOf(privacyLedger);
    }

    /** Mean of the performance history, or {@code fallback} when it is empty. */
    public double averagePerformance(double fallback) {
        return performanceHistory.isEmpty()
            ? fallback
            : performanceHistory.stream().mapToDouble(Double::doubleValue).average().orElse(fallback);
    }
}
