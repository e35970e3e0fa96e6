package com.dining.reservation.service;

/**
 * Outcome of {@link ConflictChecker#check}. {@code explanation} is set only when
 * {@code conflict} is true.
 */
public record ConflictCheckResult(boolean conflict, String explanation) {

    private static final ConflictCheckResult CLEAR = new ConflictCheckResult(false, null);

    public static ConflictCheckResult clear() {
        return CLEAR;
    }

    public static ConflictCheckResult conflict(String explanation) {
        return new ConflictCheckResult(true, explanation);
    }
}
