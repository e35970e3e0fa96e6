package com.dining.reservation.mapper;

import com.dining.reservation.dto.response.ReservationResponse;
import com.dining.reservation.entity.Eater;
import com.dining.reservation.entity.Reservation;
import com.dining.reservation.entity.Restaurant;

import java.util.Comparator;
import java.util.List;

public final class ReservationMapper {

    private ReservationMapper() {}

    /**
     * Host and restaurant are passed in because the reservation only holds their ids.
     * Either may be {@code null} if the referenced row has disappeared.
     */
    public static ReservationResponse toResponse(Reservation reservation, Eater host, Restaurant restaurant) {
        List<ReservationResponse.AttendeeSummary> attendees = reservation.getAttendees().stream()
            .sorted(Comparator.comparing(Eater::getId))
            .map(a -> new ReservationResponse.AttendeeSummary(a.getId(), a.getName(), a.getEmail()))
            .toList();

        return new ReservationResponse(
            reservation.getId(),
            reservation.getHostId(),
            host != null ? host.getName() : null,
            new ReservationResponse.RestaurantSummary(
                reservation.getRestaurantId(),
                restaurant != null ? restaurant.getName() : null),
            reservation.getTableId(),
            reservation.getReservationDate(),
            reservation.getStartTime(),
            reservation.getEndTime(),
            reservation.getPartySize(),
            reservation.isActive(),
            reservation.getCreatedAt(),
            reservation.getUpdatedAt(),
            attendees
        );
    }
}
