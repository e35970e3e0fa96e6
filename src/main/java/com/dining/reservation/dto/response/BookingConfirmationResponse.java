package com.dining.reservation.dto.response;

public record BookingConfirmationResponse(
    String message,
    ReservationResponse reservation
) {}
