package com.learningplatform.common.exception;

/**
 * Root of every failure the coordinator reports to callers.
 * The coordinator never retries; callers own the retry policy.
 */
public class CoordinatorException extends RuntimeException {
    private final ErrorCode code;

    public CoordinatorException(ErrorCode code, String message) {
        super("[" + code + "] " + message);
        this.code = code;
    }

    public CoordinatorException(ErrorCode code, String message, Throwable cause) {
        super("[" + code + "] " + message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
