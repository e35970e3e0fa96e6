package com.dining.reservation.service;

import com.dining.reservation.repository.DietaryRestrictionRepository;
import com.dining.reservation.repository.EaterRepository;
import com.dining.reservation.repository.spec.RestaurantSearchCriteria;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Turns a party's dietary restrictions into the endorsement requirement a restaurant must
 * meet.
 *
 * <p>Every endorsement mapped from <em>any</em> requested restriction is collected into one
 * set, and a restaurant qualifies when it holds at least that many of them. This is a
 * count over the union, not a per-restriction cover: a restaurant that serves every
 * restriction through one endorsement each can still be rejected if other mapped
 * endorsements are missing.
 */
@Component
@RequiredArgsConstructor
public class RestrictionMatcher {

    private final EaterRepository eaterRepository;
    private final DietaryRestrictionRepository dietaryRestrictionRepository;

    /** Union of restriction ids across the given eaters. Unnamed guests contribute nothing. */
    public Set<Long> aggregateRestrictions(Collection<Long> eaterIds) {
        if (eaterIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(eaterRepository.findRestrictionIdsByEaterIds(eaterIds));
    }

    public Set<Long> requiredEndorsements(Set<Long> restrictionIds) {
        if (restrictionIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(dietaryRestrictionRepository.findEndorsementIdsByRestrictionIds(restrictionIds));
    }

    public RestaurantSearchCriteria criteriaFor(Collection<Long> eaterIds, LocalTime requestedTime) {
        Set<Long> restrictions = aggregateRestrictions(eaterIds);
        if (restrictions.isEmpty()) {
            return new RestaurantSearchCriteria(requestedTime, false, Set.of());
        }
        return new RestaurantSearchCriteria(requestedTime, true, requiredEndorsements(restrictions));
    }
}
