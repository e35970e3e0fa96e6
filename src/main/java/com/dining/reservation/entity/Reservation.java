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
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JPA entity representing a table booking for a party.
 *
 * <p><strong>References by id</strong>: host, restaurant and table are plain foreign-key
 * columns rather than mapped associations. Every traversal goes through a repository
 * lookup, so a reservation never drags the restaurant or its other bookings into the
 * persistence context.
 *
 * <p><strong>Attendees</strong>: Reservation owns the {@code reservation_attendees} join
 * table. The host is always a member. A hard delete removes the join rows together with
 * the reservation; no cascade to {@link Eater} is configured.
 *
 * <p><strong>Time window</strong>: {@link #startTime} and {@link #endTime} are stored as
 * {@code HH:MM} strings. {@code endTime} is always derived from {@code startTime} plus the
 * booking duration when the reservation is created and is never edited afterwards.
 *
 * <p><strong>Soft delete</strong>: {@link #active} set to {@code false} keeps the row for
 * history but removes it from every availability and conflict query.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} guards concurrent soft deletes
 * of the same reservation.
 */
@Entity
@Table(name = "reservations")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Reservation extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "host_id", nullable = false)
    private Long hostId;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "reservation_date", nullable = false)
    private LocalDate reservationDate;

    @Column(name = "start_time", nullable = false, length = 5)
    private String startTime;

    @Column(name = "end_time", nullable = false, length = 5)
    private String endTime;

    /** Host, named attendees and unnamed guests. Never exceeds the table's capacity. */
    @Column(name = "party_size", nullable = false)
    private int partySize;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "reservation_attendees",
            joinColumns = @JoinColumn(name = "reservation_id"),
            inverseJoinColumns = @JoinColumn(name = "eater_id")
    )
    @BatchSize(size = 20)
    private Set<Eater> attendees = new LinkedHashSet<>();

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;
}
