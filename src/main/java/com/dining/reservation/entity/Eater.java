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
import org.hibernate.annotations.BatchSize;

import java.util.HashSet;
import java.util.Set;

/**
 * A person who can host or attend a reservation.
 *
 * <p>Eaters are created and edited outside the booking engine; the engine treats them as
 * immutable. An eater's row doubles as the per-person lock taken by
 * {@code ReservationService.create} so that two bookings involving the same person are
 * serialized.
 *
 * <p>{@code @ToString} is omitted so that logging an eater never initialises the lazy
 * {@link #dietaryRestrictions} collection.
 */
@Entity
@Table(name = "eaters")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Eater extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "email", nullable = false, unique = true, length = 100)
    private String email;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "eater_dietary_restrictions",
            joinColumns = @JoinColumn(name = "eater_id"),
            inverseJoinColumns = @JoinColumn(name = "restriction_id")
    )
    @BatchSize(size = 20)
    private Set<DietaryRestriction> dietaryRestrictions = new HashSet<>();
}
