package com.dining.reservation.repository;

import com.dining.reservation.entity.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long>,
        JpaSpecificationExecutor<Reservation> {

    List<Reservation> findByRestaurantIdAndReservationDateAndActiveTrue(Long restaurantId, LocalDate date);

    List<Reservation> findByHostIdAndReservationDateAndActiveTrue(Long hostId, LocalDate date);

    @Query("SELECT r FROM Reservation r JOIN r.attendees a "
        + "WHERE a.id = :eaterId AND r.reservationDate = :date AND r.active = true")
    List<Reservation> findActiveAttendingOn(@Param("eaterId") Long eaterId, @Param("date") LocalDate date);

    @Query("SELECT DISTINCT r FROM Reservation r LEFT JOIN FETCH r.attendees WHERE r.id = :id")
    Optional<Reservation> findByIdWithAttendees(@Param("id") Long id);
}
