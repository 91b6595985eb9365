package com.learningplatform.common.exception;

/**
 * Raised when fewer than 3 agents qualify for a round, fewer than 3 updates were
 * submitted, or fewer than 2 updates survive Byzantine exclusion.
 */
public class InsufficientParticipantsException extends CoordinatorException {
    private final int available;
    private final int required;

    public InsufficientParticipantsException(String message, int available, int required) {
        super(ErrorCode.INSUFFICIENT_PARTICIPANTS,
              message + " (available=" + available + ", required=" + required + ")");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
