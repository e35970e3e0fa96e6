package com.dining.reservation.exception;

public class ReservationConflictException extends BookingException {

    public ReservationConflictException(String message) {
        super(BookingFailure.PARTY_CONFLICT, message);
    }
}
