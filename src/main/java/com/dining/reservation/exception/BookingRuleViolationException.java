package com.dining.reservation.exception;

/**
 * Restaurant-level rule refusals: not accepting reservations, no hours on record, closed at
 * the requested time, or a window that would run past midnight.
 */
public class BookingRuleViolationException extends BookingException {

    public BookingRuleViolationException(BookingFailure reason, String message) {
        super(reason, message);
    }
}
