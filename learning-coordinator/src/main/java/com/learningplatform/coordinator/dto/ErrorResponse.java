package com.learningplatform.coordinator.dto;

/**
 * @param error   machine-readable code, e.g. {@code INSUFFICIENT_PARTICIPANTS}
 * @param message human-readable detail
 */
public record ErrorResponse(String error, String message) {}
