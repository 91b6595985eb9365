package com.learningplatform.common.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle phase of a {@link LearningRound}.
 *
 * <h3>Transitions</h3>
 * <pre>
 *   INITIALIZATION → TRAINING → AGGREGATION → VALIDATION → COMPLETION
 *   INITIALIZATION → AGGREGATION   (aggregation requested before any update moved the round)
 *   any non-terminal phase → ROLLBACK
 * </pre>
 *
 * <p>{@link #COMPLETION} and {@link #ROLLBACK} are terminal.
 */
public enum RoundPhase {
    INITIALIZATION,
    TRAINING,
    AGGREGATION,
    VALIDATION,
    COMPLETION,
    ROLLBACK;

    private static final Map<RoundPhase, Set<RoundPhase>> ALLOWED = Map.of(
        INITIALIZATION, EnumSet.of(TRAINING, AGGREGATION, ROLLBACK),
        TRAINING,       EnumSet.of(AGGREGATION, ROLLBACK),
        AGGREGATION,    EnumSet.of(VALIDATION, ROLLBACK),
        VALIDATION,     EnumSet.of(COMPLETION, ROLLBACK),
        COMPLETION,     EnumSet.noneOf(RoundPhase.class),
        ROLLBACK,       EnumSet.noneOf(RoundPhase.class)
    );

    public boolean canTransitionTo(RoundPhase next) {
        return ALLOWED.get(this).contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETION || this == ROLLBACK;
    }

    /** Updates are accepted only before aggregation starts. */
    public boolean acceptsUpdates() {
        return this == INITIALIZATION || this == TRAINING;
    }
}
