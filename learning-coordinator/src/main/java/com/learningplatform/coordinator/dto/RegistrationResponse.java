package com.learningplatform.coordinator.dto;

public record RegistrationResponse(String agentId, boolean registered) {}
