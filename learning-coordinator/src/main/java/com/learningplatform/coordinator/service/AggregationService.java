package com.learningplatform.coordinator.service;

import com.learningplatform.common.aggregation.AggregationOutcome;
import com.learningplatform.common.aggregation.Aggregator;
import com.learningplatform.common.detection.ByzantineDetector;
import com.learningplatform.common.detection.DetectionContext;
import com.learningplatform.common.exception.CoordinatorException;
import com.learningplatform.common.exception.InsufficientParticipantsException;
import com.learningplatform.common.exception.InvalidArgumentException;
import com.learningplatform.common.exception.NotFoundException;
import com.learningplatform.common.exception.TooManyFaultyAgentsException;
import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AggregationResult;
import com.learningplatform.common.model.ByzantineDetectionResult;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.model.RoundPhase;
import com.learningplatform.common.trust.TrustScoreUpdater;
import com.learningplatform.common.trust.TrustScoreUpdater.Reputation;
import com.learningplatform.coordinator.logger.LearningFlowLogger;
import com.learningplatform.coordinator.store.CoordinatorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Closes a round: detection, exclusion, aggregation, trust adjustment and the phase
 * transitions around them.
 *
 * <h3>Preconditions (checked in order)</h3>
 * <ol>
 *   <li>Round in INITIALIZATION or TRAINING, else {@link InvalidArgumentException}.</li>
 *   <li>At least {@value #MIN_SUBMITTED_UPDATES} submitted updates. Before the deadline the
 *       round stays open; after it the round rolls back.</li>
 *   <li>Suspects within tolerance, else rollback and {@link TooManyFaultyAgentsException}.</li>
 *   <li>At least {@value Aggregator#MIN_VALID_UPDATES} survivors, else rollback.</li>
 * </ol>
 *
 * <p>The move to AGGREGATION is atomic, so a round is aggregated at most once. Any failure
 * after that move rolls the round back.
 */
@Service
public class AggregationService {

    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);

    public static final int MIN_SUBMITTED_UPDATES = 3;

    private final CoordinatorStore store;
    private final ByzantineDetector detector;
    private final Aggregator aggregator;
    private final LearningFlowLogger flowLogger;
    private final Clock clock;

    public AggregationService(CoordinatorStore store, ByzantineDetector detector, Aggregator aggregator,
                              LearningFlowLogger flowLogger, Clock clock) {
        this.store      = store;
        this.detector   = detector;
        this.aggregator = aggregator;
        this.flowLogger = flowLogger;
        this.clock      = clock;
    }

    public AggregationResult aggregate(String roundId) {
        LearningRound round = store.findRound(roundId).orElseThrow(() -> NotFoundException.round(roundId));
        if (!round.currentPhase().acceptsUpdates()) {
            throw new InvalidArgumentException(
                "Round " + roundId + " cannot be aggregated in phase " + round.currentPhase());
        }

        Instant started = clock.instant();
        List<ModelUpdate> updates = store.updates(roundId);
        if (updates.size() < MIN_SUBMITTED_UPDATES) {
            InsufficientParticipantsException failure = new InsufficientParticipantsException(
                "Too few updates submitted to round " + roundId, updates.size(), MIN_SUBMITTED_UPDATES);
            if (round.isPastDeadline(started)) {
                rollback(roundId, failure.getCode().name());
            }
            throw failure;
        }

        // Claims the round; a concurrent second caller fails here.
        round = store.transition(roundId, RoundPhase.AGGREGATION);
        try {
            return runAggregation(round, store.updates(roundId), started);
        } catch (CoordinatorException e) {
            rollback(roundId, e.getCode().name());
            throw e;
        } catch (RuntimeException e) {
            log.error("Aggregation failed unexpectedly. roundId={}", roundId, e);
            rollback(roundId, e.getClass().getSimpleName());
            throw e;
        }
    }

    public AggregationResult getAggregationResult(String roundId) {
        store.findRound(roundId).orElseThrow(() -> NotFoundException.round(roundId));
        return store.findAggregation(roundId).orElseThrow(() ->
            new NotFoundException("Round " + roundId + " has no aggregation result"));
    }

    public List<ByzantineDetectionResult> getDetections(String roundId) {
        store.findRound(roundId).orElseThrow(() -> NotFoundException.round(roundId));
        return store.detections(roundId);
    }

    private AggregationResult runAggregation(LearningRound round, List<ModelUpdate> updates, Instant started) {
        Map<String, Agent> agents = new HashMap<>();
        for (ModelUpdate u : updates) {
            store.findAgent(u.agentId()).ifPresent(a -> agents.put(a.agentId(), a));
        }
        ByzantineDetectionResult detection = detector.detect(new DetectionContext(updates, agents, round, started));
        store.addDetection(detection);
        flowLogger.detectionCompleted(detection);

        if (detection.suspectedAgents().size() > round.byzantineTolerance()) {
            throw new TooManyFaultyAgentsException(
                round.roundId(), detection.suspectedAgents().size(), round.byzantineTolerance());
        }

        List<ModelUpdate> valid = updates.stream()
            .filter(u -> !detection.isSuspected(u.agentId()))
            .collect(Collectors.toList());
        AggregationOutcome outcome = aggregator.aggregate(valid, round.strategy());

        adjustTrust(valid, detection);

        store.transition(round.roundId(), RoundPhase.VALIDATION);
        store.transition(round.roundId(), RoundPhase.COMPLETION);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("detectionId", detection.detectionId());
        metadata.put("totalUpdatesReceived", updates.size());
        metadata.put("validUpdatesUsed", valid.size());
        metadata.put("byzantineAgentsFiltered", detection.suspectedAgents().size());
        metadata.put("detectionThreshold", detection.threshold());
        metadata.put("epsilonSpent", outcome.epsilonSpent());
        metadata.put("consensusThreshold", aggregator.consensusThreshold());

        AggregationResult result = new AggregationResult(
            "aggregation_" + UUID.randomUUID(),
            round.roundId(),
            outcome.weights(),
            valid.stream().map(ModelUpdate::updateId).collect(Collectors.toList()),
            detection.suspectedAgents(),
            round.strategy(),
            outcome.qualityScore(),
            outcome.privacyLoss(),
            Duration.between(started, clock.instant()),
            outcome.consensusAchieved(),
            metadata);
        store.addAggregation(result);
        flowLogger.aggregationCompleted(result);
        return result;
    }

    private void adjustTrust(List<ModelUpdate> survivors, ByzantineDetectionResult detection) {
        for (ModelUpdate u : survivors) {
            store.withAgentLock(u.agentId(), agent -> {
                Reputation next = TrustScoreUpdater.rewardSurvivor(
                    new Reputation(agent.getTrustScore(), agent.getByzantineScore()), u.validationScore());
                agent.setTrustScore(next.trustScore());
                return next;
            });
        }
        for (String suspect : detection.suspectedAgents()) {
            Reputation after = store.withAgentLock(suspect, agent -> {
                Reputation next = TrustScoreUpdater.penalizeSuspect(
                    new Reputation(agent.getTrustScore(), agent.getByzantineScore()),
                    detection.detectionConfidence());
                agent.setTrustScore(next.trustScore());
                agent.setByzantineScore(next.byzantineScore());
                return next;
            });
            log.info("Suspect penalized. roundId={} agentId={} trust={} byzantineScore={}",
                     detection.roundId(), suspect, String.format("%.3f", after.trustScore()),
                     String.format("%.3f", after.byzantineScore()));
        }
    }

    private void rollback(String roundId, String reason) {
        try {
            store.transition(roundId, RoundPhase.ROLLBACK);
            flowLogger.roundRolledBack(roundId, reason);
        } catch (InvalidArgumentException e) {
            log.warn("Rollback skipped. roundId={} reason={}", roundId, e.getMessage());
        }
    }
}
