package com.learningplatform.coordinator.store;

import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AggregationResult;
import com.learningplatform.common.model.ByzantineDetectionResult;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.model.RoundPhase;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Coordinator state: agents, rounds, per-round updates, detections and aggregations.
 *
 * <p>Concurrency contract:
 * <ul>
 *   <li>Agent mutation happens only inside {@link #withAgentLock}, one agent at a time.</li>
 *   <li>Update admission and phase transitions for a round are serialized per round.</li>
 *   <li>Lock order is agent → round; nothing takes an agent lock while holding a round lock.</li>
 * </ul>
 */
public interface CoordinatorStore {

    /** @return {@code false} when the id is already registered */
    boolean addAgent(AgentEntity agent);

    Optional<Agent> findAgent(String agentId);

    List<Agent> agents();

    /**
     * Runs {@code action} with exclusive access to the agent's mutable row.
     *
     * @throws com.learningplatform.common.exception.NotFoundException for an unknown agent
     */
    <T> T withAgentLock(String agentId, Function<AgentEntity, T> action);

    /**
     * Stores a new round unless {@code maxActive} non-terminal rounds already exist.
     *
     * @return {@code false} when the limit was reached
     */
    boolean addRound(LearningRound round, int maxActive);

    Optional<LearningRound> findRound(String roundId);

    List<LearningRound> rounds();

    /**
     * Atomically moves a round to {@code next}.
     *
     * @throws com.learningplatform.common.exception.NotFoundException        unknown round
     * @throws com.learningplatform.common.exception.InvalidArgumentException transition not allowed
     */
    LearningRound transition(String roundId, RoundPhase next);

    /**
     * Appends an update to its round when the round accepts updates, the agent has not
     * submitted yet and the layer shapes match the round's earlier updates. The first
     * accepted update moves the round from INITIALIZATION to TRAINING.
     */
    UpdateAdmission admitUpdate(ModelUpdate update);

    /** Updates of a round in submission order. */
    List<ModelUpdate> updates(String roundId);

    int totalUpdates();

    void addDetection(ByzantineDetectionResult detection);

    List<ByzantineDetectionResult> detections(String roundId);

    void addAggregation(AggregationResult result);

    Optional<AggregationResult> findAggregation(String roundId);

    List<AggregationResult> aggregations();
}
