package com.dining.reservation.service;

import com.dining.reservation.entity.DiningTable;
import com.dining.reservation.entity.Reservation;
import com.dining.reservation.exception.BookingFailure;
import com.dining.reservation.repository.DiningTableRepository;
import com.dining.reservation.repository.ReservationRepository;
import com.dining.reservation.time.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Best-fit table selection: the smallest table that seats the party and has no active
 * reservation overlapping the requested window. Nothing is written; the caller commits.
 */
@Component
@RequiredArgsConstructor
public class TableAllocator {

    private static final Logger log = LoggerFactory.getLogger(TableAllocator.class);

    static final String NO_TABLE_SIZE_MESSAGE = "No tables available for that party size";
    static final String NO_CAPACITY_MESSAGE = "No tables available for that party size at the requested time";

    private final DiningTableRepository diningTableRepository;
    private final ReservationRepository reservationRepository;

    public TableAllocation allocate(Long restaurantId, int partySize, LocalDate date, TimeWindow window) {
        List<DiningTable> candidates = diningTableRepository
            .findByRestaurantIdAndCapacityGreaterThanEqualOrderByCapacityAscIdAsc(restaurantId, partySize);
        if (candidates.isEmpty()) {
            return TableAllocation.failed(BookingFailure.NO_TABLE_SIZE, NO_TABLE_SIZE_MESSAGE);
        }

        Set<Long> occupied = occupiedTableIds(restaurantId, date, window);
        return candidates.stream()
            .filter(table -> !occupied.contains(table.getId()))
            .findFirst()
            .map(TableAllocation::allocated)
            .orElseGet(() -> TableAllocation.failed(BookingFailure.NO_CAPACITY, NO_CAPACITY_MESSAGE));
    }

    /** Capacity existence only: some table is large enough, regardless of bookings. */
    public boolean hasTableFor(Long restaurantId, int partySize) {
        return diningTableRepository.existsByRestaurantIdAndCapacityGreaterThanEqual(restaurantId, partySize);
    }

    private Set<Long> occupiedTableIds(Long restaurantId, LocalDate date, TimeWindow window) {
        Set<Long> occupied = new HashSet<>();
        for (Reservation reservation
                : reservationRepository.findByRestaurantIdAndReservationDateAndActiveTrue(restaurantId, date)) {
            Optional<TimeWindow> booked = TimeWindow.fromStored(reservation.getStartTime(), reservation.getEndTime());
            if (booked.isEmpty()) {
                log.warn("Skipping reservation {} with unparsable window {}-{}",
                    reservation.getId(), reservation.getStartTime(), reservation.getEndTime());
                continue;
            }
            if (window.overlaps(booked.get())) {
                occupied.add(reservation.getTableId());
            }
        }
        return occupied;
    }
}
