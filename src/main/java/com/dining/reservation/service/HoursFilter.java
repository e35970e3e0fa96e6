package com.dining.reservation.service;

import com.dining.reservation.entity.Restaurant;
import com.dining.reservation.entity.RestaurantHours;
import com.dining.reservation.exception.BookingFailure;
import com.dining.reservation.exception.BookingRuleViolationException;
import com.dining.reservation.repository.RestaurantHoursRepository;
import com.dining.reservation.time.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Decides whether a restaurant is open at a single instant, the reservation start. The
 * computed end time is not checked against closing time. Search applies the same rule in
 * SQL through {@code RestaurantSpecifications.openAt}.
 */
@Component
@RequiredArgsConstructor
public class HoursFilter {

    private final RestaurantHoursRepository restaurantHoursRepository;

    public static boolean isOpenAt(RestaurantHours hours, LocalTime time) {
        return !time.isBefore(hours.getOpeningTime()) && !time.isAfter(hours.getClosingTime());
    }

    public Optional<RestaurantHours> hoursOf(Long restaurantId) {
        return restaurantHoursRepository.findByRestaurantId(restaurantId);
    }

    /**
     * Booking-side lookup, run before the requested time is parsed.
     *
     * @throws BookingRuleViolationException if the restaurant has no hours on record
     */
    public RestaurantHours requireHours(Restaurant restaurant) {
        return hoursOf(restaurant.getId())
            .orElseThrow(() -> new BookingRuleViolationException(
                BookingFailure.HOURS_NOT_AVAILABLE, "Restaurant hours not available"));
    }

    /**
     * @throws BookingRuleViolationException if the restaurant is closed at {@code start}
     */
    public void requireOpenAt(RestaurantHours hours, LocalTime start) {
        if (!isOpenAt(hours, start)) {
            throw new BookingRuleViolationException(BookingFailure.OUTSIDE_OPERATING_HOURS,
                "Restaurant is not open at " + start.format(TimeWindow.CLOCK_FORMAT));
        }
    }
}
