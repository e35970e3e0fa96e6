package com.dining.reservation.exception;

public class ResourceNotFoundException extends BookingException {

    public ResourceNotFoundException(BookingFailure reason, String entityName, Long id) {
        super(reason, entityName + " not found with id " + id);
    }

    public ResourceNotFoundException(BookingFailure reason, String message) {
        super(reason, message);
    }
}
