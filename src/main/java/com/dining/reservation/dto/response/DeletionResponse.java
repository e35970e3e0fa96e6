package com.dining.reservation.dto.response;

public record DeletionResponse(
    String message,
    DeletionType deletionType
) {
    public enum DeletionType {
        SOFT,
        HARD
    }
}
