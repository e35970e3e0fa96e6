package com.dining.reservation.controller;

import com.dining.reservation.dto.request.CreateReservationRequest;
import com.dining.reservation.dto.response.BookingConfirmationResponse;
import com.dining.reservation.dto.response.DeletionResponse;
import com.dining.reservation.dto.response.PagedResponse;
import com.dining.reservation.dto.response.ReservationResponse;
import com.dining.reservation.service.ReservationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
@Tag(name = "Reservations", description = "Table booking with table and person double-booking protection")
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping
    @Operation(summary = "Create a reservation", description = "Books the smallest free table that seats the host, "
        + "the named attendees and the unnamed guests. Fails if any party member already has an overlapping booking.")
    @ApiResponse(responseCode = "201", description = "Reservation created")
    @ApiResponse(responseCode = "400", description = "Validation error or malformed date/time")
    @ApiResponse(responseCode = "404", description = "Restaurant, host or attendee not found")
    @ApiResponse(responseCode = "409", description = "Closed, conflicting booking, or no table available")
    public ResponseEntity<BookingConfirmationResponse> create(@Valid @RequestBody CreateReservationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reservationService.create(request));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get reservation by ID")
    @ApiResponse(responseCode = "200", description = "Reservation found")
    @ApiResponse(responseCode = "404", description = "Reservation not found, or soft-deleted and inactive records not requested")
    public ResponseEntity<ReservationResponse> findById(
            @PathVariable Long id,
            @Parameter(description = "Also return soft-deleted reservations") @RequestParam(defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(reservationService.findById(id, includeInactive));
    }

    @GetMapping
    @Operation(summary = "List reservations", description = "Returns a paginated list of reservations, newest first, with optional filters.")
    public ResponseEntity<PagedResponse<ReservationResponse>> findAll(
            @Parameter(description = "Filter by host eater ID") @RequestParam(required = false) Long hostId,
            @Parameter(description = "Filter by restaurant ID") @RequestParam(required = false) Long restaurantId,
            @Parameter(description = "Filter by date (YYYY-MM-DD)") @RequestParam(required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @Parameter(description = "Include soft-deleted reservations") @RequestParam(defaultValue = "false") boolean includeInactive,
            @PageableDefault(sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            reservationService.findAll(hostId, restaurantId, date, includeInactive, pageable)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a reservation", description = "Hard delete removes the reservation and its attendees. "
        + "Soft delete marks it inactive, freeing the table and the party's time window while keeping it for history.")
    @ApiResponse(responseCode = "200", description = "Reservation deleted")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    public ResponseEntity<DeletionResponse> delete(
            @PathVariable Long id,
            @Parameter(description = "Mark inactive instead of removing") @RequestParam(defaultValue = "false") boolean softDelete) {
        return ResponseEntity.ok(reservationService.delete(id, softDelete));
    }
}
