package com.dining.reservation.exception;

/**
 * Coarse error taxonomy exposed to callers. {@code GlobalExceptionHandler} maps each kind to
 * one HTTP status.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_INPUT,
    BUSINESS_RULE_VIOLATION,
    PERSISTENCE_ERROR
}
