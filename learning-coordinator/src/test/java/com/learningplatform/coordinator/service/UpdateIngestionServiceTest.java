package com.learningplatform.coordinator.service;

import com.learningplatform.common.exception.InvalidArgumentException;
import com.learningplatform.common.exception.NotFoundException;
import com.learningplatform.common.integrity.ProofVerifier;
import com.learningplatform.common.integrity.WeightHasher;
import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AgentRole;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.LearningStrategy;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.model.PrivacyLedgerEntry;
import com.learningplatform.common.model.RoundPhase;
import com.learningplatform.common.tensor.ModelWeights;
import com.learningplatform.common.tensor.VectorTensor;
import com.learningplatform.coordinator.CoordinatorHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.learningplatform.coordinator.CoordinatorHarness.weights;
import static org.junit.jupiter.api.Assertions.*;

class UpdateIngestionServiceTest {

    private final CoordinatorHarness harness = new CoordinatorHarness();
    private final DistributedLearningCoordinator coordinator = harness.coordinator;

    @BeforeEach
    void agents() {
        harness.registerParticipants(5);
    }

    @Nested
    @DisplayName("plain rounds")
    class PlainRounds {

        private LearningRound round;

        @BeforeEach
        void round() {
            round = coordinator.createLearningRound("m", LearningStrategy.FEDERATED_AVERAGING, 0.9, 10, 1.0);
        }

        @Test
        @DisplayName("accepted update is hashed, proven and booked on the agent")
        void accepted() {
            ModelUpdate update = coordinator.submitModelUpdate("agent_0", round.roundId(), weights(0.5, 0.4), 0.9);

            assertEquals(WeightHasher.hash(update.weights()), update.weightHash());
            assertEquals(weights(0.5, 0.4), update.weights());
            assertEquals(0.0, update.differentialNoise());
            assertTrue(update.signature().matches("sig_[0-9a-f]{32}"));
            assertTrue(new ProofVerifier().verify(update, CoordinatorHarness.START).valid());

            Agent agent = coordinator.getAgent("agent_0");
            assertEquals(1, agent.totalContributions());
            assertEquals(List.of(0.9), agent.performanceHistory());
            assertEquals(CoordinatorHarness.START, agent.lastContribution());
            assertEquals(10.0, agent.privacyBudget());
            assertEquals(RoundPhase.TRAINING, coordinator.getRound(round.roundId()).currentPhase());
        }

        @Test
        @DisplayName("second update from the same agent is rejected without side effects")
        void duplicateRejected() {
            coordinator.submitModelUpdate("agent_0", round.roundId(), weights(0.5, 0.4), 0.9);

            assertThrows(InvalidArgumentException.class,
                () -> coordinator.submitModelUpdate("agent_0", round.roundId(), weights(0.6, 0.4), 0.8));

            Agent agent = coordinator.getAgent("agent_0");
            assertEquals(1, agent.totalContributions());
            assertEquals(List.of(0.9), agent.performanceHistory());
            assertEquals(1, coordinator.getCoordinatorMetrics().totalModelUpdates());
        }

        @Test
        @DisplayName("unknown round or agent → NotFoundException")
        void notFound() {
            assertThrows(NotFoundException.class,
                () -> coordinator.submitModelUpdate("agent_0", "round_missing", weights(1, 2), 0.9));
            assertThrows(NotFoundException.class,
                () -> coordinator.submitModelUpdate("ghost", round.roundId(), weights(1, 2), 0.9));
        }

        @Test
        @DisplayName("registered agent outside the round → InvalidArgumentException")
        void notParticipant() {
            coordinator.registerAgent("watcher", AgentRole.OBSERVER, List.of("ethereum"), 1.0, List.of());
            assertThrows(InvalidArgumentException.class,
                () -> coordinator.submitModelUpdate("watcher", round.roundId(), weights(1, 2), 0.9));
        }

        @Test
        @DisplayName("score outside [0,1], non-finite weights and foreign shapes are rejected")
        void invalidContent() {
            assertThrows(InvalidArgumentException.class,
                () -> coordinator.submitModelUpdate("agent_0", round.roundId(), weights(1, 2), 1.2));
            assertThrows(InvalidArgumentException.class,
                () -> coordinator.submitModelUpdate("agent_0", round.roundId(), weights(1, Double.NaN), 0.9));

            coordinator.submitModelUpdate("agent_0", round.roundId(), weights(1, 2), 0.9);
            assertThrows(InvalidArgumentException.class,
                () -> coordinator.submitModelUpdate("agent_1", round.roundId(), weights(1, 2, 3), 0.9));
            ModelWeights renamed = new ModelWeights(Map.of("other", VectorTensor.of(1, 2)));
            assertThrows(InvalidArgumentException.class,
                () -> coordinator.submitModelUpdate("agent_2", round.roundId(), renamed, 0.9));
        }

        @Test
        @DisplayName("submissions after the deadline are refused")
        void pastDeadline() {
            harness.clock.advance(Duration.ofHours(2));
            assertThrows(InvalidArgumentException.class,
                () -> coordinator.submitModelUpdate("agent_0", round.roundId(), weights(1, 2), 0.9));
        }
    }

    @Nested
    @DisplayName("differential-private rounds")
    class PrivateRounds {

        @Test
        @DisplayName("noise sigma = 1/epsilon, epsilon charged to the ledger, hash covers noisy weights")
        void chargesLedger() {
            LearningRound round = coordinator.createLearningRound("m", LearningStrategy.DIFFERENTIAL_PRIVATE, 0.9, 10, 2.0);

            ModelUpdate update = coordinator.submitModelUpdate("agent_0", round.roundId(), weights(0.5, 0.4), 0.9);

            assertEquals(0.5, update.differentialNoise(), 1e-12);
            assertEquals(2.0, update.epsilonSpent(), 1e-12);
            assertNotEquals(weights(0.5, 0.4), update.weights());
            assertEquals(WeightHasher.hash(update.weights()), update.weightHash());

            Agent agent = coordinator.getAgent("agent_0");
            assertEquals(8.0, agent.privacyBudget(), 1e-12);
            assertEquals(1, agent.privacyLedger().size());
            PrivacyLedgerEntry entry = agent.privacyLedger().get(0);
            assertEquals(round.roundId(), entry.roundId());
            assertEquals("gaussian", entry.mechanism());
            assertEquals(2.0, entry.epsilon(), 1e-12);
            assertEquals(0.5, entry.noiseScale(), 1e-12);

            assertEquals(2.0 / 50.0, coordinator.getCoordinatorMetrics().privacyBudgetUtilization(), 1e-12);
        }

        @Test
        @DisplayName("insufficient budget rejects the update and spends nothing")
        void budgetExhausted() {
            LearningRound first  = coordinator.createLearningRound("m", LearningStrategy.DIFFERENTIAL_PRIVATE, 0.9, 10, 6.0);
            LearningRound second = coordinator.createLearningRound("m", LearningStrategy.DIFFERENTIAL_PRIVATE, 0.9, 10, 6.0);
            coordinator.submitModelUpdate("agent_0", first.roundId(), weights(0.5, 0.4), 0.9);

            assertThrows(InvalidArgumentException.class,
                () -> coordinator.submitModelUpdate("agent_0", second.roundId(), weights(0.5, 0.4), 0.9));

            Agent agent = coordinator.getAgent("agent_0");
            assertEquals(4.0, agent.privacyBudget(), 1e-12);
            assertEquals(1, agent.privacyLedger().size());
            assertEquals(1, agent.totalContributions());
            assertEquals(RoundPhase.INITIALIZATION, coordinator.getRound(second.roundId()).currentPhase());
        }
    }
}
