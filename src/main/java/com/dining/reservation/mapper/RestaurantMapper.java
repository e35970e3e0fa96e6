package com.dining.reservation.mapper;

import com.dining.reservation.dto.response.RestaurantResponse;
import com.dining.reservation.entity.Endorsement;
import com.dining.reservation.entity.Restaurant;
import com.dining.reservation.entity.RestaurantHours;
import com.dining.reservation.time.TimeWindow;

import java.util.Comparator;
import java.util.List;

public final class RestaurantMapper {

    private RestaurantMapper() {}

    public static RestaurantResponse toResponse(Restaurant restaurant, RestaurantHours hours) {
        List<RestaurantResponse.EndorsementSummary> endorsements = restaurant.getEndorsements().stream()
            .sorted(Comparator.comparing(Endorsement::getId))
            .map(e -> new RestaurantResponse.EndorsementSummary(e.getId(), e.getName()))
            .toList();

        RestaurantResponse.Hours hoursView = hours != null
            ? new RestaurantResponse.Hours(
                hours.getOpeningTime().format(TimeWindow.CLOCK_FORMAT),
                hours.getClosingTime().format(TimeWindow.CLOCK_FORMAT))
            : new RestaurantResponse.Hours(null, null);

        return new RestaurantResponse(
            restaurant.getId(),
            restaurant.getName(),
            restaurant.getAverageRating(),
            restaurant.getAddress(),
            restaurant.getPhone(),
            hoursView,
            endorsements,
            restaurant.isHasParking(),
            restaurant.isAcceptsReservations()
        );
    }
}
