package com.dining.reservation.dto.response;

import com.dining.reservation.exception.BookingFailure;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    BookingFailure reason,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors
) {
    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path) {
        this(status, error, message, null, timestamp, path, List.of());
    }

    public ErrorResponse(int status, String error, String message, BookingFailure reason,
                         Instant timestamp, String path) {
        this(status, error, message, reason, timestamp, path, List.of());
    }

    public record FieldError(String field, String message) {}
}
