package com.dining.reservation.repository;

import com.dining.reservation.entity.Eater;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface EaterRepository extends JpaRepository<Eater, Long> {

    /**
     * Locks the given eaters in ascending id order. Bookings take these locks after the
     * restaurant lock and always in this order, so concurrent bookings cannot deadlock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT e FROM Eater e WHERE e.id IN :ids ORDER BY e.id")
    List<Eater> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);

    @Query("SELECT DISTINCT r.id FROM Eater e JOIN e.dietaryRestrictions r WHERE e.id IN :ids")
    List<Long> findRestrictionIdsByEaterIds(@Param("ids") Collection<Long> ids);
}
