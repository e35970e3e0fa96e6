package com.dining.reservation.dto.response;

import java.util.List;

public record AvailableRestaurantsResponse(
    int count,
    List<RestaurantResponse> restaurants
) {
    public static AvailableRestaurantsResponse of(List<RestaurantResponse> restaurants) {
        return new AvailableRestaurantsResponse(restaurants.size(), restaurants);
    }
}
