package com.learningplatform.coordinator.controller;

import com.learningplatform.common.exception.CoordinatorException;
import com.learningplatform.common.exception.ErrorCode;
import com.learningplatform.coordinator.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the coordinator's error taxonomy onto HTTP.
 *
 * <pre>
 *   NOT_FOUND                 → 404
 *   INVALID_ARGUMENT          → 400
 *   INSUFFICIENT_PARTICIPANTS → 409
 *   TOO_MANY_FAULTY_AGENTS    → 422
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CoordinatorException.class)
    public ResponseEntity<ErrorResponse> handleCoordinator(CoordinatorException ex) {
        HttpStatus status = statusOf(ex.getCode());
        log.info("Request failed. status={} code={} message={}", status.value(), ex.getCode(), ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse(ex.getCode().name(), ex.getMessage()), status);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.info("Request rejected. message={}", ex.getMessage());
        return new ResponseEntity<>(
            new ErrorResponse(ErrorCode.INVALID_ARGUMENT.name(), ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case NOT_FOUND                 -> HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT          -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_PARTICIPANTS -> HttpStatus.CONFLICT;
            case TOO_MANY_FAULTY_AGENTS    -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
