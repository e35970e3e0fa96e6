package com.dining.reservation.exception;

public class InvalidInputException extends BookingException {

    public InvalidInputException(BookingFailure reason, String message) {
        super(reason, message);
    }
}
