package com.dining.reservation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.HashSet;
import java.util.Set;

/**
 * A person-level dietary need such as "Vegan".
 *
 * <p>{@link #endorsements} is the coverage mapping: the set of restaurant endorsements
 * that satisfy this restriction. The join table {@code restriction_endorsement_mappings}
 * is owned here. The mapping is reference data; the booking engine only reads it, through
 * {@code DietaryRestrictionRepository.findEndorsementIdsByRestrictionIds}.
 */
@Entity
@Table(name = "dietary_restrictions")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class DietaryRestriction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 50)
    private String name;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "restriction_endorsement_mappings",
            joinColumns = @JoinColumn(name = "restriction_id"),
            inverseJoinColumns = @JoinColumn(name = "endorsement_id")
    )
    private Set<Endorsement> endorsements = new HashSet<>();
}
