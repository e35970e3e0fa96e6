package com.dining.reservation.controller;

import com.dining.reservation.dto.response.AvailableRestaurantsResponse;
import com.dining.reservation.service.AvailabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/restaurants")
@RequiredArgsConstructor
@Tag(name = "Restaurants", description = "Availability search for groups of eaters")
public class RestaurantController {

    private final AvailabilityService availabilityService;

    @GetMapping("/available")
    @Operation(summary = "Find available restaurants", description = "Returns restaurants that accept reservations, "
        + "cover every party member's dietary restrictions, are open at the requested time and have a table "
        + "free for the whole reservation window.")
    @ApiResponse(responseCode = "200", description = "Search completed (the list may be empty)")
    @ApiResponse(responseCode = "400", description = "Malformed time, no eaters, or negative guest count")
    @ApiResponse(responseCode = "404", description = "One of the eaters does not exist")
    public ResponseEntity<AvailableRestaurantsResponse> findAvailable(
            @Parameter(description = "Start time, HH:MM (24h)") @RequestParam String time,
            @Parameter(description = "Date, YYYY-MM-DD; today when omitted or malformed") @RequestParam(required = false) String date,
            @Parameter(description = "Registered party members") @RequestParam(name = "eaterId", required = false) List<Long> eaterIds,
            @Parameter(description = "Guests without an account") @RequestParam(defaultValue = "0") int additionalGuests) {
        return ResponseEntity.ok(AvailableRestaurantsResponse.of(
            availabilityService.findAvailableRestaurants(time, date, eaterIds, additionalGuests)));
    }
}
