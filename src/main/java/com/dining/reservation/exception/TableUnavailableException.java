package com.dining.reservation.exception;

/**
 * No table can seat the party: either none is large enough ({@link BookingFailure#NO_TABLE_SIZE})
 * or every large-enough table is taken for the window ({@link BookingFailure#NO_CAPACITY}).
 */
public class TableUnavailableException extends BookingException {

    public TableUnavailableException(BookingFailure reason, String message) {
        super(reason, message);
    }
}
