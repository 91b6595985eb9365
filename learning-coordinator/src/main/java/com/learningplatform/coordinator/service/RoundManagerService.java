package com.learningplatform.coordinator.service;

import com.learningplatform.common.exception.InsufficientParticipantsException;
import com.learningplatform.common.exception.InvalidArgumentException;
import com.learningplatform.common.exception.NotFoundException;
import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.LearningStrategy;
import com.learningplatform.common.model.RoundPhase;
import com.learningplatform.common.selection.AgentSelectionScorer;
import com.learningplatform.common.selection.ByzantineTolerance;
import com.learningplatform.coordinator.config.CoordinatorSettings;
import com.learningplatform.coordinator.logger.LearningFlowLogger;
import com.learningplatform.coordinator.store.CoordinatorStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates learning rounds: validates parameters, selects participants, derives the
 * Byzantine tolerance and sets the deadline.
 */
@Service
public class RoundManagerService {

    public static final int MIN_PARTICIPANTS = 3;

    private final CoordinatorStore store;
    private final CoordinatorSettings settings;
    private final LearningFlowLogger flowLogger;
    private final Clock clock;

    public RoundManagerService(CoordinatorStore store, CoordinatorSettings settings,
                               LearningFlowLogger flowLogger, Clock clock) {
        this.store      = store;
        this.settings   = settings;
        this.flowLogger = flowLogger;
        this.clock      = clock;
    }

    public LearningRound createRound(String modelId, LearningStrategy strategy, double targetAccuracy,
                                     int maxIterations, double privacyEpsilon) {
        if (modelId == null || modelId.isBlank()) {
            throw new InvalidArgumentException("modelId is required");
        }
        if (strategy == null) {
            throw new InvalidArgumentException("strategy is required");
        }
        if (!(privacyEpsilon > 0.0) || Double.isInfinite(privacyEpsilon)) {
            throw new InvalidArgumentException("privacyEpsilon must be positive, got " + privacyEpsilon);
        }
        if (!(targetAccuracy >= 0.0 && targetAccuracy <= 1.0)) {
            throw new InvalidArgumentException("targetAccuracy must be in [0, 1], got " + targetAccuracy);
        }
        if (maxIterations < 1) {
            throw new InvalidArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }

        List<Agent> candidates = store.agents();
        List<String> selected = AgentSelectionScorer.select(candidates, strategy);
        if (selected.size() < MIN_PARTICIPANTS) {
            throw new InsufficientParticipantsException(
                "Not enough eligible agents for a learning round", selected.size(), MIN_PARTICIPANTS);
        }

        int tolerance = ByzantineTolerance.count(selected.size(), settings.byzantineToleranceRatio());
        Instant start = clock.instant();
        String roundId = "round_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        LearningRound round = new LearningRound(
            roundId, strategy, selected, settings.coordinatorId(), modelId,
            targetAccuracy, maxIterations, privacyEpsilon, tolerance,
            start, start.plus(settings.roundDuration()), RoundPhase.INITIALIZATION,
            Map.of(
                "selectedAgents", selected.size(),
                "byzantineTolerance", tolerance,
                "privacyBudgetAllocated", privacyEpsilon,
                "eligibleAgents", AgentSelectionScorer.rank(candidates).size()
            ));

        if (!store.addRound(round, settings.maxConcurrentRounds())) {
            throw new InvalidArgumentException(
                "Maximum of " + settings.maxConcurrentRounds() + " concurrent learning rounds reached");
        }
        flowLogger.roundCreated(round);
        return round;
    }

    public LearningRound getRound(String roundId) {
        return store.findRound(roundId).orElseThrow(() -> NotFoundException.round(roundId));
    }

    public List<LearningRound> rounds() {
        return store.rounds();
    }
}
