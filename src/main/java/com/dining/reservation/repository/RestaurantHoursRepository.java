package com.dining.reservation.repository;

import com.dining.reservation.entity.RestaurantHours;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RestaurantHoursRepository extends JpaRepository<RestaurantHours, Long> {

    Optional<RestaurantHours> findByRestaurantId(Long restaurantId);
}
