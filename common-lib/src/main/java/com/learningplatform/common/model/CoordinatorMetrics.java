package com.learningplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time coordinator health figures.
 *
 * <ul>
 *   <li>{@code successRate}              – successful aggregations / completed rounds (0 when none).</li>
 *   <li>{@code privacyBudgetUtilization} – spent epsilon / total epsilon issued to all agents.</li>
 *   <li>{@code networkHealth}            – averageTrust × (1 − min(byzantineDetected / agents, 0.5)).</li>
 * </ul>
 */
public record CoordinatorMetrics(
    @JsonProperty("coordinatorId")            String coordinatorId,
    @JsonProperty("registeredAgents")         int    registeredAgents,
    @JsonProperty("activeLearningRounds")     int    activeLearningRounds,
    @JsonProperty("completedRounds")          int    completedRounds,
    @JsonProperty("successfulAggregations")   int    successfulAggregations,
    @JsonProperty("successRate")              double successRate,
    @JsonProperty("byzantineDetectedCount")   long   byzantineDetectedCount,
    @JsonProperty("totalModelUpdates")        int    totalModelUpdates,
    @JsonProperty("averageTrust")             double averageTrust,
    @JsonProperty("privacyBudgetUtilization") double privacyBudgetUtilization,
    @JsonProperty("networkHealth")            double networkHealth
) {}
