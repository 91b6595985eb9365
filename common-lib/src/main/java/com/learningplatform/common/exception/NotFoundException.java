package com.learningplatform.common.exception;

/** Unknown agent or round. */
public class NotFoundException extends CoordinatorException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException agent(String agentId) {
        return new NotFoundException("Unknown agent: " + agentId);
    }

    public static NotFoundException round(String roundId) {
        return new NotFoundException("Unknown learning round: " + roundId);
    }
}
