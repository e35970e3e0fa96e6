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
 * JPA entity representing a restaurant that may take reservations.
 *
 * <p><strong>No object graph to hours, tables or reservations</strong>: {@link RestaurantHours},
 * {@link DiningTable} and {@link Reservation} reference the restaurant by id only and are
 * loaded through their own repositories. The only mapped association is the
 * {@code restaurant_endorsements} join table, which the restriction matcher queries.
 *
 * <p>The row is also the per-restaurant lock taken during booking: table allocation and
 * commit for one restaurant never run concurrently.
 */
@Entity
@Table(name = "restaurants")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Restaurant extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "average_rating")
    private Double averageRating;

    @Column(name = "address", length = 255)
    private String address;

    @Column(name = "phone", length = 20)
    private String phone;

    @Column(name = "email", length = 100)
    private String email;

    @Column(name = "website_url", length = 255)
    private String websiteUrl;

    @Column(name = "has_parking", nullable = false)
    private boolean hasParking;

    @Column(name = "accepts_reservations", nullable = false)
    private boolean acceptsReservations = true;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "restaurant_endorsements",
            joinColumns = @JoinColumn(name = "restaurant_id"),
            inverseJoinColumns = @JoinColumn(name = "endorsement_id")
    )
    @BatchSize(size = 20)
    private Set<Endorsement> endorsements = new HashSet<>();
}
