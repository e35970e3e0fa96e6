package com.dining.reservation.service;

import com.dining.reservation.entity.Reservation;
import com.dining.reservation.entity.Restaurant;
import com.dining.reservation.repository.ReservationRepository;
import com.dining.reservation.repository.RestaurantRepository;
import com.dining.reservation.time.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Detects whether a person already holds an active reservation, as host or as attendee,
 * whose window overlaps a requested one on the same date.
 */
@Component
@RequiredArgsConstructor
public class ConflictChecker {

    private static final Logger log = LoggerFactory.getLogger(ConflictChecker.class);

    private final ReservationRepository reservationRepository;
    private final RestaurantRepository restaurantRepository;

    public ConflictCheckResult check(Long eaterId, LocalDate date, TimeWindow window) {
        Map<Long, Reservation> held = new LinkedHashMap<>();
        for (Reservation r : reservationRepository.findByHostIdAndReservationDateAndActiveTrue(eaterId, date)) {
            held.putIfAbsent(r.getId(), r);
        }
        for (Reservation r : reservationRepository.findActiveAttendingOn(eaterId, date)) {
            held.putIfAbsent(r.getId(), r);
        }

        for (Reservation reservation : held.values()) {
            Optional<TimeWindow> existing = TimeWindow.fromStored(reservation.getStartTime(), reservation.getEndTime());
            if (existing.isEmpty()) {
                // skip the row, not the whole check
                log.warn("Skipping reservation {} with unparsable window {}-{} during conflict check",
                    reservation.getId(), reservation.getStartTime(), reservation.getEndTime());
                continue;
            }
            if (window.overlaps(existing.get())) {
                return ConflictCheckResult.conflict(String.format(
                    "You already have a reservation at %s from %s to %s on this date.",
                    restaurantName(reservation.getRestaurantId()),
                    reservation.getStartTime(), reservation.getEndTime()));
            }
        }
        return ConflictCheckResult.clear();
    }

    private String restaurantName(Long restaurantId) {
        return restaurantRepository.findById(restaurantId)
            .map(Restaurant::getName)
            .orElse("Restaurant ID " + restaurantId);
    }
}
