package com.dining.reservation.repository;

import com.dining.reservation.entity.DiningTable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DiningTableRepository extends JpaRepository<DiningTable, Long> {

    /** Best-fit candidates: smallest capacity first, id as a stable tie-breaker. */
    List<DiningTable> findByRestaurantIdAndCapacityGreaterThanEqualOrderByCapacityAscIdAsc(
        Long restaurantId, int capacity);

    boolean existsByRestaurantIdAndCapacityGreaterThanEqual(Long restaurantId, int capacity);
}
