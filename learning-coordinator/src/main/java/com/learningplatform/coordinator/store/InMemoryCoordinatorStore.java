package com.learningplatform.coordinator.store;

import com.learningplatform.common.exception.InvalidArgumentException;
import com.learningplatform.common.exception.NotFoundException;
import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AggregationResult;
import com.learningplatform.common.model.ByzantineDetectionResult;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.model.RoundPhase;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-local {@link CoordinatorStore}. Nothing survives a restart.
 *
 * <p>Agents are striped by one {@link ReentrantLock} per agent id; rounds by one lock per
 * round id guarding both the phase and the round's update map.
 */
public class InMemoryCoordinatorStore implements CoordinatorStore {

    private final ConcurrentHashMap<String, AgentEntity> agents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> agentLocks = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, LearningRound> rounds = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> roundLocks = new ConcurrentHashMap<>();
    private final ReentrantLock roundCreationLock = new ReentrantLock();

    /** roundId → agentId → update, insertion ordered under the round lock. */
    private final ConcurrentHashMap<String, Map<String, ModelUpdate>> updates = new ConcurrentHashMap<>();
    private final AtomicInteger updateCount = new AtomicInteger();

    private final ConcurrentHashMap<String, List<ByzantineDetectionResult>> detections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AggregationResult> aggregations = new ConcurrentHashMap<>();

    // ── agents ────────────────────────────────────────────────────────────

    @Override
    public boolean addAgent(AgentEntity agent) {
        agentLocks.putIfAbsent(agent.getAgentId(), new ReentrantLock());
        return agents.putIfAbsent(agent.getAgentId(), agent) == null;
    }

    @Override
    public Optional<Agent> findAgent(String agentId) {
        if (!agents.containsKey(agentId)) {
            return Optional.empty();
        }
        return Optional.of(withAgentLock(agentId, AgentEntity::toSnapshot));
    }

    @Override
    public List<Agent> agents() {
        return agents.keySet().stream()
            .sorted()
            .map(id -> withAgentLock(id, AgentEntity::toSnapshot))
            .collect(Collectors.toList());
    }

    @Override
    public <T> T withAgentLock(String agentId, Function<AgentEntity, T> action) {
        AgentEntity entity = agents.get(agentId);
        ReentrantLock lock = agentLocks.get(agentId);
        if (entity == null || lock == null) {
            throw NotFoundException.agent(agentId);
        }
        lock.lock();
        try {
            return action.apply(entity);
        } finally {
            lock.unlock();
        }
    }

    // ── rounds ────────────────────────────────────────────────────────────

    @Override
    public boolean addRound(LearningRound round, int maxActive) {
        roundCreationLock.lock();
        try {
            long active = rounds.values().stream().filter(r -> !r.currentPhase().isTerminal()).count();
            if (active >= maxActive) {
                return false;
            }
            roundLocks.put(round.roundId(), new ReentrantLock());
            updates.put(round.roundId(), new LinkedHashMap<>());
            rounds.put(round.roundId(), round);
            return true;
        } finally {
            roundCreationLock.unlock();
        }
    }

    @Override
    public Optional<LearningRound> findRound(String roundId) {
        return Optional.ofNullable(rounds.get(roundId));
    }

    @Override
    public List<LearningRound> rounds() {
        return rounds.values().stream()
            .sorted(Comparator.comparing(LearningRound::startTime).thenComparing(LearningRound::roundId))
            .collect(Collectors.toList());
    }

    @Override
    public LearningRound transition(String roundId, RoundPhase next) {
        return withRoundLock(roundId, () -> {
            LearningRound current = rounds.get(roundId);
            if (!current.currentPhase().canTransitionTo(next)) {
                throw new InvalidArgumentException(
                    "Round " + roundId + " cannot move from " + current.currentPhase() + " to " + next);
            }
            LearningRound moved = current.withPhase(next);
            rounds.put(roundId, moved);
            return moved;
        });
    }

    // ── updates ───────────────────────────────────────────────────────────

    @Override
    public UpdateAdmission admitUpdate(ModelUpdate update) {
        String roundId = update.roundId();
        return withRoundLock(roundId, () -> {
            LearningRound round = rounds.get(roundId);
            if (!round.currentPhase().acceptsUpdates()) {
                return UpdateAdmission.ROUND_CLOSED;
            }
            Map<String, ModelUpdate> roundUpdates = updates.get(roundId);
            if (roundUpdates.containsKey(update.agentId())) {
                return UpdateAdmission.DUPLICATE;
            }
            Optional<ModelUpdate> first = roundUpdates.values().stream().findFirst();
            if (first.isPresent() && !first.get().weights().sameShape(update.weights())) {
                return UpdateAdmission.SHAPE_MISMATCH;
            }
            roundUpdates.put(update.agentId(), update);
            updateCount.incrementAndGet();
            if (round.currentPhase() == RoundPhase.INITIALIZATION) {
                rounds.put(roundId, round.withPhase(RoundPhase.TRAINING));
            }
            return UpdateAdmission.ACCEPTED;
        });
    }

    @Override
    public List<ModelUpdate> updates(String roundId) {
        return withRoundLock(roundId, () -> new ArrayList<>(updates.get(roundId).values()));
    }

    @Override
    public int totalUpdates() {
        return updateCount.get();
    }

    // ── detections and aggregations ───────────────────────────────────────

    @Override
    public void addDetection(ByzantineDetectionResult detection) {
        detections.computeIfAbsent(detection.roundId(), k -> new CopyOnWriteArrayList<>()).add(detection);
    }

    @Override
    public List<ByzantineDetectionResult> detections(String roundId) {
        return List.copyOf(detections.getOrDefault(roundId, List.of()));
    }

    @Override
    public void addAggregation(AggregationResult result) {
        aggregations.put(result.roundId(), result);
    }

    @Override
    public Optional<AggregationResult> findAggregation(String roundId) {
        return Optional.ofNullable(aggregations.get(roundId));
    }

    @Override
    public List<AggregationResult> aggregations() {
        return List.copyOf(aggregations.values());
    }

    private <T> T withRoundLock(String roundId, Supplier<T> action) {
        ReentrantLock lock = roundLocks.get(roundId);
        if (lock == null) {
            throw NotFoundException.round(roundId);
        }
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
