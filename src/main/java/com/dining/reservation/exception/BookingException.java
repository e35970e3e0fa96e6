package com.dining.reservation.exception;

/**
 * Base of every engine-level refusal. Carries the {@link BookingFailure} so the HTTP layer
 * can report both the kind and the exact rule that was violated.
 */
public abstract class BookingException extends RuntimeException {

    private final BookingFailure reason;

    protected BookingException(BookingFailure reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected BookingException(BookingFailure reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public BookingFailure getReason() {
        return reason;
    }

    public ErrorKind getKind() {
        return reason.kind();
    }
}
