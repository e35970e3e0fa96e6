package com.dining.reservation.exception;

public class ReservationPersistenceException extends BookingException {

    public ReservationPersistenceException(String message, Throwable cause) {
        super(BookingFailure.PERSISTENCE_ERROR, message, cause);
    }
}
