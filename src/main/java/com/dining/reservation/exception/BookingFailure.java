package com.dining.reservation.exception;

/**
 * Precise reason a booking, lookup or cancellation was refused. Serialized by name in the
 * {@code reason} field of error responses.
 */
public enum BookingFailure {
    RESTAURANT_NOT_FOUND(ErrorKind.NOT_FOUND),
    HOST_NOT_FOUND(ErrorKind.NOT_FOUND),
    ATTENDEE_NOT_FOUND(ErrorKind.NOT_FOUND),
    EATER_NOT_FOUND(ErrorKind.NOT_FOUND),
    RESERVATION_NOT_FOUND(ErrorKind.NOT_FOUND),

    INVALID_TIME_FORMAT(ErrorKind.INVALID_INPUT),
    INVALID_DATE_FORMAT(ErrorKind.INVALID_INPUT),
    INVALID_PARTY(ErrorKind.INVALID_INPUT),

    RESTAURANT_NOT_ACCEPTING_RESERVATIONS(ErrorKind.BUSINESS_RULE_VIOLATION),
    HOURS_NOT_AVAILABLE(ErrorKind.BUSINESS_RULE_VIOLATION),
    OUTSIDE_OPERATING_HOURS(ErrorKind.BUSINESS_RULE_VIOLATION),
    WINDOW_CROSSES_MIDNIGHT(ErrorKind.BUSINESS_RULE_VIOLATION),
    PARTY_CONFLICT(ErrorKind.BUSINESS_RULE_VIOLATION),
    NO_TABLE_SIZE(ErrorKind.BUSINESS_RULE_VIOLATION),
    NO_CAPACITY(ErrorKind.BUSINESS_RULE_VIOLATION),

    PERSISTENCE_ERROR(ErrorKind.PERSISTENCE_ERROR);

    private final ErrorKind kind;

    BookingFailure(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
