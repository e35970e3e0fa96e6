package com.dining.reservation.service;

import com.dining.reservation.config.BookingProperties;
import com.dining.reservation.dto.response.RestaurantResponse;
import com.dining.reservation.entity.Eater;
import com.dining.reservation.entity.Restaurant;
import com.dining.reservation.exception.BookingFailure;
import com.dining.reservation.exception.InvalidInputException;
import com.dining.reservation.exception.ResourceNotFoundException;
import com.dining.reservation.mapper.RestaurantMapper;
import com.dining.reservation.repository.EaterRepository;
import com.dining.reservation.repository.RestaurantRepository;
import com.dining.reservation.repository.spec.RestaurantSearchCriteria;
import com.dining.reservation.time.TimeParseResult;
import com.dining.reservation.time.TimeParser;
import com.dining.reservation.time.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only search mode of the booking engine: which restaurants could seat this party at
 * this time right now. Results are advisory; nothing is held for the caller.
 *
 * <p>Candidates come from one query combining reservation acceptance, dietary coverage and
 * opening hours. Each candidate is then checked for a large-enough table and for a table
 * free over the whole window. Order is restaurant id order.
 */
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final EaterRepository eaterRepository;
    private final RestaurantRepository restaurantRepository;
    private final RestrictionMatcher restrictionMatcher;
    private final HoursFilter hoursFilter;
    private final TableAllocator tableAllocator;
    private final BookingProperties bookingProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<RestaurantResponse> findAvailableRestaurants(String time, String date,
                                                             List<Long> eaterIds, int additionalGuests) {
        if (eaterIds == null || eaterIds.isEmpty()) {
            throw new InvalidInputException(BookingFailure.INVALID_PARTY, "At least one eater ID is required");
        }
        if (additionalGuests < 0) {
            throw new InvalidInputException(BookingFailure.INVALID_PARTY, "Additional guests must not be negative");
        }

        Set<Long> partyIds = new LinkedHashSet<>(eaterIds);
        List<Long> foundIds = eaterRepository.findAllById(partyIds).stream().map(Eater::getId).toList();
        if (foundIds.size() != partyIds.size()) {
            Long missingId = partyIds.stream().filter(id -> !foundIds.contains(id)).findFirst().orElseThrow();
            throw new ResourceNotFoundException(BookingFailure.EATER_NOT_FOUND, "Eater", missingId);
        }

        TimeParseResult parsed = TimeParser.parse(time);
        if (!parsed.isSuccess()) {
            throw new InvalidInputException(BookingFailure.INVALID_TIME_FORMAT, parsed.error());
        }

        int partySize = addGuests(partyIds.size(), additionalGuests);
        LocalDate reservationDate = parseDateOrToday(date);
        TimeWindow window = TimeWindow.starting(parsed.time(), bookingProperties.defaultDuration());
        if (window.crossesMidnight() && bookingProperties.rejectMidnightCrossing()) {
            log.debug("Window {} crosses midnight; no restaurant can be offered", window);
            return List.of();
        }

        RestaurantSearchCriteria criteria = restrictionMatcher.criteriaFor(partyIds, parsed.time());
        List<Restaurant> candidates = restaurantRepository.findAll(criteria.toSpecification(), Sort.by("id"));

        List<RestaurantResponse> available = new ArrayList<>();
        for (Restaurant restaurant : candidates) {
            if (!tableAllocator.hasTableFor(restaurant.getId(), partySize)) {
                continue;
            }
            if (tableAllocator.allocate(restaurant.getId(), partySize, reservationDate, window).isAllocated()) {
                available.add(RestaurantMapper.toResponse(restaurant,
                    hoursFilter.hoursOf(restaurant.getId()).orElse(null)));
            }
        }
        log.debug("Availability for party of {} on {} {}: {} of {} candidates",
            partySize, reservationDate, window, available.size(), candidates.size());
        return available;
    }

    /** Named members plus guests; a total beyond {@code int} range is rejected as an invalid party. */
    static int addGuests(int members, int guests) {
        try {
            return Math.addExact(members, guests);
        } catch (ArithmeticException ex) {
            throw new InvalidInputException(BookingFailure.INVALID_PARTY, "Party size is too large");
        }
    }

    /** Missing or malformed dates mean today. */
    LocalDate parseDateOrToday(String date) {
        if (date == null || date.isBlank()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException ex) {
            log.debug("Unparsable search date '{}', falling back to today", date);
            return LocalDate.now(clock);
        }
    }
}
