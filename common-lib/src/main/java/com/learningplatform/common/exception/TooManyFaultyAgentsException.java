package com.learningplatform.common.exception;

/** Suspected agents exceed the round's Byzantine tolerance; aggregation is refused. */
public class TooManyFaultyAgentsException extends CoordinatorException {
    private final int suspected;
    private final int tolerance;

    public TooManyFaultyAgentsException(String roundId, int suspected, int tolerance) {
        super(ErrorCode.TOO_MANY_FAULTY_AGENTS,
              "Round " + roundId + " has " + suspected + " suspected agents, tolerance is " + tolerance);
        this.suspected = suspected;
        this.tolerance = tolerance;
    }

    public int getSuspected() {
        return suspected;
    }

    public int getTolerance() {
        return tolerance;
    }
}
