package com.dining.reservation.service;

import com.dining.reservation.config.BookingProperties;
import com.dining.reservation.dto.request.CreateReservationRequest;
import com.dining.reservation.dto.response.BookingConfirmationResponse;
import com.dining.reservation.dto.response.DeletionResponse;
import com.dining.reservation.dto.response.ReservationResponse;
import com.dining.reservation.entity.Eater;
import com.dining.reservation.entity.Reservation;
import com.dining.reservation.entity.Restaurant;
import com.dining.reservation.entity.RestaurantHours;
import com.dining.reservation.exception.BookingFailure;
import com.dining.reservation.exception.BookingRuleViolationException;
import com.dining.reservation.exception.InvalidInputException;
import com.dining.reservation.exception.ReservationConflictException;
import com.dining.reservation.exception.ReservationPersistenceException;
import com.dining.reservation.exception.ResourceNotFoundException;
import com.dining.reservation.exception.TableUnavailableException;
import com.dining.reservation.mapper.ReservationMapper;
import com.dining.reservation.repository.EaterRepository;
import com.dining.reservation.repository.ReservationRepository;
import com.dining.reservation.repository.RestaurantRepository;
import com.dining.reservation.time.TimeParseResult;
import com.dining.reservation.time.TimeParser;
import com.dining.reservation.time.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Booking orchestrator: turns a booking request into a committed reservation or a single
 * precise refusal, and owns lookup and cancellation.
 *
 * <p>{@link #create} validates in a fixed order and stops at the first failure. Nothing is
 * written before the final commit, so a refusal never leaves partial state behind.
 *
 * <p><strong>Serialization</strong>: the restaurant row is locked when it is first read and
 * every party member's row is locked, in ascending id order, before the conflict checks.
 * Two bookings that share a restaurant or a person therefore run their conflict check,
 * allocation and commit one after the other inside their own transactions.
 */
@Service
@RequiredArgsConstructor
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    static final String CREATED_MESSAGE = "Reservation created successfully";
    static final String SOFT_DELETED_MESSAGE = "Reservation marked as deleted";
    static final String HARD_DELETED_MESSAGE = "Reservation permanently deleted";

    private final RestaurantRepository restaurantRepository;
    private final EaterRepository eaterRepository;
    private final ReservationRepository reservationRepository;
    private final HoursFilter hoursFilter;
    private final ConflictChecker conflictChecker;
    private final TableAllocator tableAllocator;
    private final BookingProperties bookingProperties;

    @Transactional
    public BookingConfirmationResponse create(CreateReservationRequest request) {
        Restaurant restaurant = restaurantRepository.findByIdForUpdate(request.restaurantId())
            .orElseThrow(() -> new ResourceNotFoundException(
                BookingFailure.RESTAURANT_NOT_FOUND, "Restaurant", request.restaurantId()));
        if (!restaurant.isAcceptsReservations()) {
            throw new BookingRuleViolationException(BookingFailure.RESTAURANT_NOT_ACCEPTING_RESERVATIONS,
                "Restaurant does not accept reservations");
        }

        Eater host = eaterRepository.findById(request.eaterId())
            .orElseThrow(() -> new ResourceNotFoundException(
                BookingFailure.HOST_NOT_FOUND, "Eater with ID " + request.eaterId() + " not found"));

        List<Eater> attendees = resolveAttendees(request.attendeeIdsOrEmpty());

        int guests = request.guestsCountOrZero();
        if (guests < 0) {
            throw new InvalidInputException(BookingFailure.INVALID_PARTY, "Guests count must not be negative");
        }
        int partySize = partySize(host, attendees, guests);

        LocalDate date = parseDate(request.date());
        RestaurantHours hours = hoursFilter.requireHours(restaurant);
        LocalTime start = parseTime(request.time());
        hoursFilter.requireOpenAt(hours, start);

        TimeWindow window = TimeWindow.starting(start, bookingProperties.defaultDuration());
        if (window.crossesMidnight() && bookingProperties.rejectMidnightCrossing()) {
            throw new BookingRuleViolationException(BookingFailure.WINDOW_CROSSES_MIDNIGHT,
                "Reservation from " + window.startText() + " to " + window.endText() + " would run past midnight");
        }

        lockParty(host, attendees);
        ensureAvailable(host, null, date, window);
        for (Eater attendee : attendees) {
            if (!attendee.getId().equals(host.getId())) {
                ensureAvailable(attendee, "Attendee " + attendee.getName() + ": ", date, window);
            }
        }

        TableAllocation allocation = tableAllocator.allocate(restaurant.getId(), partySize, date, window);
        if (!allocation.isAllocated()) {
            log.info("Booking refused at restaurant {} on {} {}: {}",
                restaurant.getId(), date, window, allocation.failure());
            throw new TableUnavailableException(allocation.failure(), allocation.message());
        }

        Reservation reservation = new Reservation();
        reservation.setHostId(host.getId());
        reservation.setRestaurantId(restaurant.getId());
        reservation.setTableId(allocation.table().getId());
        reservation.setReservationDate(date);
        reservation.setStartTime(window.startText());
        reservation.setEndTime(window.endText());
        reservation.setPartySize(partySize);
        reservation.setActive(true);
        reservation.setAttendees(attendeeSet(host, attendees));

        Reservation saved;
        try {
            saved = reservationRepository.saveAndFlush(reservation);
        } catch (DataAccessException ex) {
            throw new ReservationPersistenceException(
                "Error creating reservation: " + ex.getMostSpecificCause().getMessage(), ex);
        }

        log.info("Reservation {} booked: restaurant {} table {} on {} {} for party of {}",
            saved.getId(), restaurant.getId(), saved.getTableId(), date, window, partySize);
        return new BookingConfirmationResponse(CREATED_MESSAGE,
            ReservationMapper.toResponse(saved, host, restaurant));
    }

    @Transactional(readOnly = true)
    public ReservationResponse findById(Long id, boolean includeInactive) {
        Reservation reservation = reservationRepository.findByIdWithAttendees(id)
            .filter(r -> includeInactive || r.isActive())
            .orElseThrow(() -> new ResourceNotFoundException(BookingFailure.RESERVATION_NOT_FOUND, "Reservation", id));
        return ReservationMapper.toResponse(reservation,
            eaterRepository.findById(reservation.getHostId()).orElse(null),
            restaurantRepository.findById(reservation.getRestaurantId()).orElse(null));
    }

    @Transactional(readOnly = true)
    public Page<ReservationResponse> findAll(Long hostId, Long restaurantId, LocalDate date,
                                             boolean includeInactive, Pageable pageable) {
        Specification<Reservation> spec = Specification.where(null);

        if (hostId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("hostId"), hostId));
        }
        if (restaurantId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("restaurantId"), restaurantId));
        }
        if (date != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("reservationDate"), date));
        }
        if (!includeInactive) {
            spec = spec.and((root, query, cb) -> cb.isTrue(root.get("active")));
        }

        Page<Reservation> page = reservationRepository.findAll(spec, pageable);
        Map<Long, Eater> hosts = byId(eaterRepository.findAllById(
            page.map(Reservation::getHostId).toSet()), Eater::getId);
        Map<Long, Restaurant> restaurants = byId(restaurantRepository.findAllById(
            page.map(Reservation::getRestaurantId).toSet()), Restaurant::getId);

        return page.map(r -> ReservationMapper.toResponse(r,
            hosts.get(r.getHostId()), restaurants.get(r.getRestaurantId())));
    }

    /**
     * Hard delete removes the row and its attendee links. Soft delete only clears the active
     * flag, which frees the table and every member's window at once; repeating it is a no-op.
     */
    @Transactional
    public DeletionResponse delete(Long id, boolean softDelete) {
        Reservation reservation = reservationRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(BookingFailure.RESERVATION_NOT_FOUND,
                "Reservation not found"));

        try {
            if (softDelete) {
                reservation.setActive(false);
                reservationRepository.saveAndFlush(reservation);
                log.info("Reservation {} soft-deleted", id);
                return new DeletionResponse(SOFT_DELETED_MESSAGE, DeletionResponse.DeletionType.SOFT);
            }
            reservationRepository.delete(reservation);
            reservationRepository.flush();
            log.info("Reservation {} permanently deleted", id);
            return new DeletionResponse(HARD_DELETED_MESSAGE, DeletionResponse.DeletionType.HARD);
        } catch (DataAccessException ex) {
            throw new ReservationPersistenceException(
                "Error deleting reservation: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    /** Host counted once even when also listed as an attendee; guests add to the total. */
    static int partySize(Eater host, Collection<Eater> attendees, int guests) {
        Set<Long> members = new LinkedHashSet<>();
        members.add(host.getId());
        attendees.forEach(a -> members.add(a.getId()));
        return AvailabilityService.addGuests(members.size(), guests);
    }

    private List<Eater> resolveAttendees(List<Long> attendeeIds) {
        List<Eater> attendees = new ArrayList<>();
        for (Long attendeeId : new LinkedHashSet<>(attendeeIds)) {
            Eater attendee = eaterRepository.findById(attendeeId)
                .orElseThrow(() -> new ResourceNotFoundException(
                    BookingFailure.ATTENDEE_NOT_FOUND, "Attendee with ID " + attendeeId + " not found"));
            attendees.add(attendee);
        }
        return attendees;
    }

    private void lockParty(Eater host, List<Eater> attendees) {
        Set<Long> ids = new TreeSet<>();
        ids.add(host.getId());
        attendees.forEach(a -> ids.add(a.getId()));
        eaterRepository.findAllByIdForUpdate(ids);
    }

    private void ensureAvailable(Eater eater, String prefix, LocalDate date, TimeWindow window) {
        ConflictCheckResult result = conflictChecker.check(eater.getId(), date, window);
        if (result.conflict()) {
            String message = prefix != null ? prefix + result.explanation() : result.explanation();
            log.info("Booking refused for eater {} on {} {}: {}", eater.getId(), date, window, message);
            throw new ReservationConflictException(message);
        }
    }

    private static Set<Eater> attendeeSet(Eater host, List<Eater> attendees) {
        Set<Eater> members = new LinkedHashSet<>();
        members.add(host);
        for (Eater attendee : attendees) {
            if (!attendee.getId().equals(host.getId())) {
                members.add(attendee);
            }
        }
        return members;
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException ex) {
            throw new InvalidInputException(BookingFailure.INVALID_DATE_FORMAT,
                "Invalid date format. Use YYYY-MM-DD");
        }
    }

    private static LocalTime parseTime(String text) {
        TimeParseResult parsed = TimeParser.parse(text);
        if (!parsed.isSuccess()) {
            throw new InvalidInputException(BookingFailure.INVALID_TIME_FORMAT, parsed.error());
        }
        return parsed.time();
    }

    private static <T> Map<Long, T> byId(List<T> items, Function<T, Long> idOf) {
        return items.stream().collect(Collectors.toMap(idOf, Function.identity()));
    }
}
