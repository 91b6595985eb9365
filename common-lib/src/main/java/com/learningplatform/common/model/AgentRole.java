package com.learningplatform.common.model;

/**
 * Role an agent plays in the learning network. Only {@link #PARTICIPANT} and
 * {@link #VALIDATOR} agents are eligible for round selection.
 */
public enum AgentRole {
    COORDINATOR,
    PARTICIPANT,
    VALIDATOR,
    AGGREGATOR,
    OBSERVER;

    public boolean isRoundEligible() {
        return this == PARTICIPANT || this == VALIDATOR;
    }
}
