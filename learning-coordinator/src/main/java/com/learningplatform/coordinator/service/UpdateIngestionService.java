package com.learningplatform.coordinator.service;

import com.learningplatform.common.exception.InvalidArgumentException;
import com.learningplatform.common.exception.NotFoundException;
import com.learningplatform.common.integrity.ComputationProof;
import com.learningplatform.common.integrity.WeightHasher;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.model.PrivacyLedgerEntry;
import com.learningplatform.common.privacy.GaussianMechanism;
import com.learningplatform.common.tensor.ModelWeights;
import com.learningplatform.coordinator.logger.LearningFlowLogger;
import com.learningplatform.coordinator.store.AgentEntity;
import com.learningplatform.coordinator.store.CoordinatorStore;
import com.learningplatform.coordinator.store.UpdateAdmission;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Accepts model updates from round participants.
 *
 * <p>Everything after the static checks runs under the submitting agent's lock: the
 * privacy-budget check, noise injection, admission into the round and the agent's
 * bookkeeping. A rejected admission leaves the agent untouched.
 *
 * <p>Differential-privacy rounds charge the round's epsilon to the agent's ledger per
 * submission (sequential composition) and perturb every element with sigma = 1 / epsilon.
 * The hash and proof cover the stored, post-noise weights.
 */
@Service
public class UpdateIngestionService {

    private final CoordinatorStore store;
    private final GaussianMechanism mechanism;
    private final LearningFlowLogger flowLogger;
    private final Clock clock;

    public UpdateIngestionService(CoordinatorStore store, GaussianMechanism mechanism,
                                  LearningFlowLogger flowLogger, Clock clock) {
        this.store      = store;
        this.mechanism  = mechanism;
        this.flowLogger = flowLogger;
        this.clock      = clock;
    }

    public ModelUpdate submit(String agentId, String roundId, ModelWeights weights, double validationScore) {
        LearningRound round = store.findRound(roundId).orElseThrow(() -> NotFoundException.round(roundId));
        if (store.findAgent(agentId).isEmpty()) {
            throw NotFoundException.agent(agentId);
        }
        if (!round.isParticipant(agentId)) {
            throw new InvalidArgumentException("Agent " + agentId + " is not a participant of round " + roundId);
        }
        if (!(validationScore >= 0.0 && validationScore <= 1.0)) {
            throw new InvalidArgumentException("validationScore must be in [0, 1], got " + validationScore);
        }
        if (weights == null || weights.size() == 0) {
            throw new InvalidArgumentException("weights must contain at least one element");
        }
        if (!weights.allFinite()) {
            throw new InvalidArgumentException("weights must be finite");
        }
        Instant now = clock.instant();
        if (!round.currentPhase().acceptsUpdates() || round.isPastDeadline(now)) {
            throw new InvalidArgumentException("Round " + roundId + " is closed for updates (phase="
                + round.currentPhase() + ", deadline=" + round.deadline() + ")");
        }

        ModelUpdate accepted = store.withAgentLock(agentId, agent -> admit(agent, round, weights, validationScore, now));
        flowLogger.updateAccepted(accepted);
        return accepted;
    }

    private ModelUpdate admit(AgentEntity agent, LearningRound round, ModelWeights weights,
                              double validationScore, Instant now) {
        ModelWeights stored = weights;
        double sigma = 0.0;
        double epsilon = 0.0;
        if (round.strategy().injectsPrivacyNoise()) {
            epsilon = round.privacyEpsilon();
            if (agent.getPrivacyBudget() < epsilon) {
                throw new InvalidArgumentException(String.format(
                    "Agent %s has privacy budget %.4f, round %s requires %.4f",
                    agent.getAgentId(), agent.getPrivacyBudget(), round.roundId(), epsilon));
            }
            GaussianMechanism.Perturbation perturbation = mechanism.perturb(weights, epsilon);
            stored = perturbation.weights();
            sigma = perturbation.noiseScale();
        }

        String hash = WeightHasher.hash(stored);
        ModelUpdate update = new ModelUpdate(
            "update_" + UUID.randomUUID(),
            agent.getAgentId(),
            round.roundId(),
            stored,
            hash,
            sigma,
            epsilon,
            validationScore,
            ComputationProof.issue(agent.getAgentId(), hash, validationScore, now),
            now,
            "sig_" + UUID.randomUUID().toString().replace("-", ""),
            WeightHasher.sizeKb(stored));

        UpdateAdmission admission = store.admitUpdate(update);
        switch (admission) {
            case DUPLICATE -> throw new InvalidArgumentException(
                "Agent " + agent.getAgentId() + " already submitted an update to round " + round.roundId());
            case SHAPE_MISMATCH -> throw new InvalidArgumentException(
                "Weights do not match the layer shapes of round " + round.roundId());
            case ROUND_CLOSED -> throw new InvalidArgumentException(
                "Round " + round.roundId() + " is closed for updates");
            case ACCEPTED -> { }
        }

        agent.setLastContribution(now);
        agent.setTotalContributions(agent.getTotalContributions() + 1);
        agent.getPerformanceHistory().add(validationScore);
        if (epsilon > 0.0) {
            agent.setPrivacyBudget(agent.getPrivacyBudget() - epsilon);
            agent.getPrivacyLedger().add(
                new PrivacyLedgerEntry(round.roundId(), GaussianMechanism.NAME, epsilon, sigma, now));
        }
        return update;
    }
}
