package com.dining.reservation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Booking request. {@code date} ({@code YYYY-MM-DD}) and {@code time} ({@code HH:MM}) stay
 * textual here; their format is checked by the booking engine so that malformed values
 * produce the engine's own error reasons.
 */
public record CreateReservationRequest(

    @NotNull(message = "Eater ID is required")
    Long eaterId,

    @NotNull(message = "Restaurant ID is required")
    Long restaurantId,

    @NotBlank(message = "Date is required")
    String date,

    @NotBlank(message = "Time is required")
    String time,

    List<@NotNull Long> attendeeIds,

    @PositiveOrZero(message = "Guests count must not be negative")
    Integer guestsCount
) {

    public List<Long> attendeeIdsOrEmpty() {
        return attendeeIds != null ? attendeeIds : List.of();
    }

    public int guestsCountOrZero() {
        return guestsCount != null ? guestsCount : 0;
    }
}
