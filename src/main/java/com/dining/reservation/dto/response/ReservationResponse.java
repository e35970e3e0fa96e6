package com.dining.reservation.dto.response;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record ReservationResponse(
    Long id,
    Long hostId,
    String hostName,
    RestaurantSummary restaurant,
    Long tableId,
    LocalDate date,
    String startTime,
    String endTime,
    int partySize,
    boolean active,
    Instant createdAt,
    Instant updatedAt,
    List<AttendeeSummary> attendees
) {
    public record RestaurantSummary(Long id, String name) {}

    public record AttendeeSummary(Long id, String name, String email) {}
}
