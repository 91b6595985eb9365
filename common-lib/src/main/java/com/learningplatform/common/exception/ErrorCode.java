package com.learningplatform.common.exception;

public enum ErrorCode {
    NOT_FOUND,
    INVALID_ARGUMENT,
    INSUFFICIENT_PARTICIPANTS,
    TOO_MANY_FAULTY_AGENTS
}
