package com.dining.reservation.repository;

import com.dining.reservation.entity.DietaryRestriction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface DietaryRestrictionRepository extends JpaRepository<DietaryRestriction, Long> {

    @Query("SELECT DISTINCT en.id FROM DietaryRestriction r JOIN r.endorsements en WHERE r.id IN :ids")
    List<Long> findEndorsementIdsByRestrictionIds(@Param("ids") Collection<Long> ids);
}
