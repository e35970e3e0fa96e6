package com.dining.reservation.unit.service;

import com.dining.reservation.config.BookingProperties;
import com.dining.reservation.dto.request.CreateReservationRequest;
import com.dining.reservation.dto.response.BookingConfirmationResponse;
import com.dining.reservation.dto.response.DeletionResponse;
import com.dining.reservation.dto.response.ReservationResponse;
import com.dining.reservation.entity.DiningTable;
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
import com.dining.reservation.repository.EaterRepository;
import com.dining.reservation.repository.ReservationRepository;
import com.dining.reservation.repository.RestaurantRepository;
import com.dining.reservation.service.ConflictCheckResult;
import com.dining.reservation.service.ConflictChecker;
import com.dining.reservation.service.HoursFilter;
import com.dining.reservation.service.ReservationService;
import com.dining.reservation.service.TableAllocation;
import com.dining.reservation.service.TableAllocator;
import com.dining.reservation.time.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReservationServiceTest {

    private static final Long RESTAURANT_ID = 10L;
    private static final LocalDate DATE = LocalDate.of(2025, 6, 14);

    @Mock
    private RestaurantRepository restaurantRepository;

    @Mock
    private EaterRepository eaterRepository;

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private HoursFilter hoursFilter;

    @Mock
    private ConflictChecker conflictChecker;

    @Mock
    private TableAllocator tableAllocator;

    private ReservationService reservationService;

    @BeforeEach
    void setUp() {
        reservationService = new ReservationService(restaurantRepository, eaterRepository, reservationRepository,
            hoursFilter, conflictChecker, tableAllocator, new BookingProperties(Duration.ofHours(2), true));
    }

    @Test
    void create_happyPath_createsReservationForWholeParty() {
        Restaurant restaurant = createTestRestaurant(RESTAURANT_ID, "Chez Test", true);
        Eater host = createTestEater(1L, "Alice");
        RestaurantHours hours = createTestHours(LocalTime.of(12, 0), LocalTime.of(22, 0));
        when(restaurantRepository.findByIdForUpdate(RESTAURANT_ID)).thenReturn(Optional.of(restaurant));
        when(eaterRepository.findById(1L)).thenReturn(Optional.of(host));
        when(eaterRepository.findById(2L)).thenReturn(Optional.of(createTestEater(2L, "Bob")));
        when(eaterRepository.findById(3L)).thenReturn(Optional.of(createTestEater(3L, "Carol")));
        when(hoursFilter.requireHours(restaurant)).thenReturn(hours);
        when(conflictChecker.check(any(), eq(DATE), any(TimeWindow.class))).thenReturn(ConflictCheckResult.clear());
        when(tableAllocator.allocate(eq(RESTAURANT_ID), eq(5), eq(DATE), any(TimeWindow.class)))
            .thenReturn(TableAllocation.allocated(createTestTable(100L, 6)));
        when(reservationRepository.saveAndFlush(any(Reservation.class))).thenAnswer(invocation -> {
            Reservation saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 1L);
            return saved;
        });

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "18:00", List.of(2L, 3L), 2);
        BookingConfirmationResponse response = reservationService.create(request);

        assertThat(response.message()).isEqualTo("Reservation created successfully");
        ReservationResponse reservation = response.reservation();
        assertThat(reservation.id()).isEqualTo(1L);
        assertThat(reservation.hostId()).isEqualTo(1L);
        assertThat(reservation.hostName()).isEqualTo("Alice");
        assertThat(reservation.restaurant().name()).isEqualTo("Chez Test");
        assertThat(reservation.tableId()).isEqualTo(100L);
        assertThat(reservation.date()).isEqualTo(DATE);
        assertThat(reservation.startTime()).isEqualTo("18:00");
        assertThat(reservation.endTime()).isEqualTo("20:00");
        assertThat(reservation.partySize()).isEqualTo(5);
        assertThat(reservation.active()).isTrue();
        assertThat(reservation.attendees())
            .extracting(ReservationResponse.AttendeeSummary::id)
            .containsExactly(1L, 2L, 3L);
        verify(hoursFilter).requireOpenAt(hours, LocalTime.of(18, 0));
        verify(eaterRepository).findAllByIdForUpdate(any());
    }

    @Test
    void create_hostAlsoListedAsAttendee_countedOnce() {
        Restaurant restaurant = createTestRestaurant(RESTAURANT_ID, "Chez Test", true);
        Eater host = createTestEater(1L, "Alice");
        when(restaurantRepository.findByIdForUpdate(RESTAURANT_ID)).thenReturn(Optional.of(restaurant));
        when(eaterRepository.findById(1L)).thenReturn(Optional.of(host));
        when(eaterRepository.findById(2L)).thenReturn(Optional.of(createTestEater(2L, "Bob")));
        when(conflictChecker.check(any(), eq(DATE), any(TimeWindow.class))).thenReturn(ConflictCheckResult.clear());
        when(tableAllocator.allocate(eq(RESTAURANT_ID), eq(2), eq(DATE), any(TimeWindow.class)))
            .thenReturn(TableAllocation.allocated(createTestTable(100L, 2)));
        when(reservationRepository.saveAndFlush(any(Reservation.class))).thenAnswer(invocation -> invocation.getArgument(0));

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "12:00", List.of(1L, 2L, 2L), null);
        BookingConfirmationResponse response = reservationService.create(request);

        assertThat(response.reservation().partySize()).isEqualTo(2);
        assertThat(response.reservation().attendees()).hasSize(2);
        verify(conflictChecker).check(eq(1L), eq(DATE), any(TimeWindow.class));
        verify(conflictChecker).check(eq(2L), eq(DATE), any(TimeWindow.class));
    }

    @Test
    void create_storesNormalizedWindow() {
        Restaurant restaurant = createTestRestaurant(RESTAURANT_ID, "Chez Test", true);
        when(restaurantRepository.findByIdForUpdate(RESTAURANT_ID)).thenReturn(Optional.of(restaurant));
        when(eaterRepository.findById(1L)).thenReturn(Optional.of(createTestEater(1L, "Alice")));
        when(conflictChecker.check(any(), eq(DATE), any(TimeWindow.class))).thenReturn(ConflictCheckResult.clear());
        when(tableAllocator.allocate(eq(RESTAURANT_ID), eq(1), eq(DATE), any(TimeWindow.class)))
            .thenReturn(TableAllocation.allocated(createTestTable(100L, 2)));
        when(reservationRepository.saveAndFlush(any(Reservation.class))).thenAnswer(invocation -> invocation.getArgument(0));

        reservationService.create(new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "9:5", null, 0));

        ArgumentCaptor<Reservation> captor = ArgumentCaptor.forClass(Reservation.class);
        verify(reservationRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getStartTime()).isEqualTo("09:05");
        assertThat(captor.getValue().getEndTime()).isEqualTo("11:05");
        assertThat(captor.getValue().getTableId()).isEqualTo(100L);
    }

    @Test
    void create_whenRestaurantNotFound_throwsResourceNotFound() {
        when(restaurantRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        var request = new CreateReservationRequest(1L, 99L, "2025-06-14", "18:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Restaurant")
            .hasMessageContaining("99")
            .extracting("reason").isEqualTo(BookingFailure.RESTAURANT_NOT_FOUND);

        verify(reservationRepository, never()).saveAndFlush(any());
    }

    @Test
    void create_whenRestaurantNotAcceptingReservations_throwsRuleViolation() {
        when(restaurantRepository.findByIdForUpdate(RESTAURANT_ID))
            .thenReturn(Optional.of(createTestRestaurant(RESTAURANT_ID, "Walk-ins Only", false)));

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "18:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(BookingRuleViolationException.class)
            .extracting("reason").isEqualTo(BookingFailure.RESTAURANT_NOT_ACCEPTING_RESERVATIONS);
    }

    @Test
    void create_whenHostNotFound_throwsResourceNotFound() {
        when(restaurantRepository.findByIdForUpdate(RESTAURANT_ID))
            .thenReturn(Optional.of(createTestRestaurant(RESTAURANT_ID, "Chez Test", true)));
        when(eaterRepository.findById(99L)).thenReturn(Optional.empty());

        var request = new CreateReservationRequest(99L, RESTAURANT_ID, "2025-06-14", "18:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Eater with ID 99 not found")
            .extracting("reason").isEqualTo(BookingFailure.HOST_NOT_FOUND);
    }

    @Test
    void create_whenAttendeeNotFound_throwsResourceNotFound() {
        when(restaurantRepository.findByIdForUpdate(RESTAURANT_ID))
            .thenReturn(Optional.of(createTestRestaurant(RESTAURANT_ID, "Chez Test", true)));
        when(eaterRepository.findById(1L)).thenReturn(Optional.of(createTestEater(1L, "Alice")));
        when(eaterRepository.findById(42L)).thenReturn(Optional.empty());

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "18:00", List.of(42L), null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Attendee with ID 42 not found")
            .extracting("reason").isEqualTo(BookingFailure.ATTENDEE_NOT_FOUND);
    }

    @Test
    void create_whenDateMalformed_throwsInvalidInput() {
        stubRestaurantAndHost();

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "14/06/2025", "18:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(InvalidInputException.class)
            .hasMessage("Invalid date format. Use YYYY-MM-DD")
            .extracting("reason").isEqualTo(BookingFailure.INVALID_DATE_FORMAT);
    }

    @Test
    void create_whenTimeMalformed_throwsInvalidInput() {
        stubRestaurantAndHost();

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "25:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("Invalid hours value: 25")
            .extracting("reason").isEqualTo(BookingFailure.INVALID_TIME_FORMAT);
    }

    @Test
    void create_whenHoursMissingAndTimeMalformed_reportsMissingHours() {
        stubRestaurantAndHost();
        when(hoursFilter.requireHours(any(Restaurant.class))).thenThrow(new BookingRuleViolationException(
            BookingFailure.HOURS_NOT_AVAILABLE, "Restaurant hours not available"));

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "25:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(BookingRuleViolationException.class)
            .hasMessage("Restaurant hours not available")
            .extracting("reason").isEqualTo(BookingFailure.HOURS_NOT_AVAILABLE);

        verify(hoursFilter, never()).requireOpenAt(any(), any());
    }

    @Test
    void create_whenGuestCountOverflowsPartySize_throwsInvalidParty() {
        stubRestaurantAndHost();

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "18:00", null, Integer.MAX_VALUE);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(InvalidInputException.class)
            .hasMessage("Party size is too large")
            .extracting("reason").isEqualTo(BookingFailure.INVALID_PARTY);

        verify(tableAllocator, never()).allocate(any(), anyInt(), any(), any());
        verify(reservationRepository, never()).saveAndFlush(any(Reservation.class));
    }

    @Test
    void create_whenWindowRunsPastMidnight_throwsRuleViolation() {
        stubRestaurantAndHost();

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "23:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(BookingRuleViolationException.class)
            .extracting("reason").isEqualTo(BookingFailure.WINDOW_CROSSES_MIDNIGHT);

        verify(tableAllocator, never()).allocate(any(), anyInt(), any(), any());
    }

    @Test
    void create_whenHostHasOverlappingReservation_throwsConflict() {
        stubRestaurantAndHost();
        when(conflictChecker.check(eq(1L), eq(DATE), any(TimeWindow.class))).thenReturn(ConflictCheckResult.conflict(
            "You already have a reservation at Other Place from 19:00 to 21:00 on this date."));

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "18:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(ReservationConflictException.class)
            .hasMessage("You already have a reservation at Other Place from 19:00 to 21:00 on this date.")
            .extracting("reason").isEqualTo(BookingFailure.PARTY_CONFLICT);

        verify(tableAllocator, never()).allocate(any(), anyInt(), any(), any());
        verify(reservationRepository, never()).saveAndFlush(any());
    }

    @Test
    void create_whenAttendeeHasOverlappingReservation_prefixesAttendeeName() {
        stubRestaurantAndHost();
        when(eaterRepository.findById(2L)).thenReturn(Optional.of(createTestEater(2L, "Bob")));
        when(conflictChecker.check(eq(1L), eq(DATE), any(TimeWindow.class))).thenReturn(ConflictCheckResult.clear());
        when(conflictChecker.check(eq(2L), eq(DATE), any(TimeWindow.class))).thenReturn(ConflictCheckResult.conflict(
            "You already have a reservation at Other Place from 17:00 to 19:00 on this date."));

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "18:00", List.of(2L), null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(ReservationConflictException.class)
            .hasMessage("Attendee Bob: You already have a reservation at Other Place from 17:00 to 19:00 on this date.");
    }

    @Test
    void create_whenNoTableFree_throwsTableUnavailable() {
        stubRestaurantAndHost();
        when(conflictChecker.check(eq(1L), eq(DATE), any(TimeWindow.class))).thenReturn(ConflictCheckResult.clear());
        when(tableAllocator.allocate(eq(RESTAURANT_ID), eq(1), eq(DATE), any(TimeWindow.class)))
            .thenReturn(TableAllocation.failed(BookingFailure.NO_CAPACITY,
                "No tables available for that party size at the requested time"));

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "18:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(TableUnavailableException.class)
            .hasMessage("No tables available for that party size at the requested time")
            .extracting("reason").isEqualTo(BookingFailure.NO_CAPACITY);

        verify(reservationRepository, never()).saveAndFlush(any());
    }

    @Test
    void create_whenSaveFails_throwsPersistenceException() {
        stubRestaurantAndHost();
        when(conflictChecker.check(eq(1L), eq(DATE), any(TimeWindow.class))).thenReturn(ConflictCheckResult.clear());
        when(tableAllocator.allocate(eq(RESTAURANT_ID), eq(1), eq(DATE), any(TimeWindow.class)))
            .thenReturn(TableAllocation.allocated(createTestTable(100L, 2)));
        when(reservationRepository.saveAndFlush(any(Reservation.class)))
            .thenThrow(new DataIntegrityViolationException("constraint violated"));

        var request = new CreateReservationRequest(1L, RESTAURANT_ID, "2025-06-14", "18:00", null, null);

        assertThatThrownBy(() -> reservationService.create(request))
            .isInstanceOf(ReservationPersistenceException.class)
            .hasMessageStartingWith("Error creating reservation")
            .extracting("reason").isEqualTo(BookingFailure.PERSISTENCE_ERROR);
    }

    @Test
    void findById_activeReservation_returnsIt() {
        Reservation reservation = createTestReservation(5L, true);
        when(reservationRepository.findByIdWithAttendees(5L)).thenReturn(Optional.of(reservation));
        when(eaterRepository.findById(1L)).thenReturn(Optional.of(createTestEater(1L, "Alice")));
        when(restaurantRepository.findById(RESTAURANT_ID))
            .thenReturn(Optional.of(createTestRestaurant(RESTAURANT_ID, "Chez Test", true)));

        ReservationResponse response = reservationService.findById(5L, false);

        assertThat(response.id()).isEqualTo(5L);
        assertThat(response.hostName()).isEqualTo("Alice");
        assertThat(response.restaurant().name()).isEqualTo("Chez Test");
    }

    @Test
    void findById_softDeletedWithoutIncludeInactive_throwsNotFound() {
        when(reservationRepository.findByIdWithAttendees(5L)).thenReturn(Optional.of(createTestReservation(5L, false)));

        assertThatThrownBy(() -> reservationService.findById(5L, false))
            .isInstanceOf(ResourceNotFoundException.class)
            .extracting("reason").isEqualTo(BookingFailure.RESERVATION_NOT_FOUND);
    }

    @Test
    void findById_softDeletedWithIncludeInactive_returnsIt() {
        when(reservationRepository.findByIdWithAttendees(5L)).thenReturn(Optional.of(createTestReservation(5L, false)));
        when(eaterRepository.findById(1L)).thenReturn(Optional.empty());
        when(restaurantRepository.findById(RESTAURANT_ID)).thenReturn(Optional.empty());

        ReservationResponse response = reservationService.findById(5L, true);

        assertThat(response.active()).isFalse();
        assertThat(response.hostName()).isNull();
    }

    @Test
    void delete_soft_marksInactive() {
        Reservation reservation = createTestReservation(5L, true);
        when(reservationRepository.findById(5L)).thenReturn(Optional.of(reservation));

        DeletionResponse response = reservationService.delete(5L, true);

        assertThat(response.message()).isEqualTo("Reservation marked as deleted");
        assertThat(response.deletionType()).isEqualTo(DeletionResponse.DeletionType.SOFT);
        assertThat(reservation.isActive()).isFalse();
        verify(reservationRepository).saveAndFlush(reservation);
        verify(reservationRepository, never()).delete(any(Reservation.class));
    }

    @Test
    void delete_hard_removesRow() {
        Reservation reservation = createTestReservation(5L, true);
        when(reservationRepository.findById(5L)).thenReturn(Optional.of(reservation));

        DeletionResponse response = reservationService.delete(5L, false);

        assertThat(response.message()).isEqualTo("Reservation permanently deleted");
        assertThat(response.deletionType()).isEqualTo(DeletionResponse.DeletionType.HARD);
        verify(reservationRepository).delete(reservation);
        verify(reservationRepository).flush();
    }

    @Test
    void delete_whenNotFound_throwsResourceNotFound() {
        when(reservationRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reservationService.delete(99L, true))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Reservation not found");
    }

    private void stubRestaurantAndHost() {
        when(restaurantRepository.findByIdForUpdate(RESTAURANT_ID))
            .thenReturn(Optional.of(createTestRestaurant(RESTAURANT_ID, "Chez Test", true)));
        when(eaterRepository.findById(1L)).thenReturn(Optional.of(createTestEater(1L, "Alice")));
    }

    private Restaurant createTestRestaurant(Long id, String name, boolean acceptsReservations) {
        Restaurant restaurant = new Restaurant();
        ReflectionTestUtils.setField(restaurant, "id", id);
        restaurant.setName(name);
        restaurant.setAcceptsReservations(acceptsReservations);
        return restaurant;
    }

    private Eater createTestEater(Long id, String name) {
        Eater eater = new Eater();
        ReflectionTestUtils.setField(eater, "id", id);
        eater.setName(name);
        eater.setEmail(name.toLowerCase() + "@example.com");
        return eater;
    }

    private RestaurantHours createTestHours(LocalTime opening, LocalTime closing) {
        RestaurantHours hours = new RestaurantHours();
        hours.setRestaurantId(RESTAURANT_ID);
        hours.setOpeningTime(opening);
        hours.setClosingTime(closing);
        return hours;
    }

    private DiningTable createTestTable(Long id, int capacity) {
        DiningTable table = new DiningTable();
        ReflectionTestUtils.setField(table, "id", id);
        table.setRestaurantId(RESTAURANT_ID);
        table.setCapacity(capacity);
        return table;
    }

    private Reservation createTestReservation(Long id, boolean active) {
        Reservation reservation = new Reservation();
        ReflectionTestUtils.setField(reservation, "id", id);
        reservation.setHostId(1L);
        reservation.setRestaurantId(RESTAURANT_ID);
        reservation.setTableId(100L);
        reservation.setReservationDate(DATE);
        reservation.setStartTime("18:00");
        reservation.setEndTime("20:00");
        reservation.setPartySize(2);
        reservation.setActive(active);
        return reservation;
    }
}
