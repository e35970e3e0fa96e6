package com.dining.reservation.dto.response;

import java.util.List;

public record RestaurantResponse(
    Long id,
    String name,
    Double averageRating,
    String address,
    String phone,
    Hours hours,
    List<EndorsementSummary> endorsements,
    boolean hasParking,
    boolean acceptsReservations
) {
    public record Hours(String opening, String closing) {}

    public record EndorsementSummary(Long id, String name) {}
}
