package com.learningplatform.coordinator.dto;

import com.learningplatform.common.model.AgentRole;

import java.util.List;

/**
 * Body of {@code POST /api/v1/coordinator/agents}.
 *
 * @param specialization optional; defaults to {@code ["general"]}
 */
public record RegisterAgentRequest(
    String       agentId,
    AgentRole    role,
    List<String> networks,
    double       computationalCapacity,
    List<String> specialization
) {}
