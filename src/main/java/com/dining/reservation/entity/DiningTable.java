package com.dining.reservation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A physical table inside a restaurant. Immutable once created; {@code capacity >= 1}
 * is enforced by the {@code chk_dining_tables_capacity} check constraint.
 */
@Entity
@Table(name = "dining_tables")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class DiningTable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "capacity", nullable = false)
    private int capacity;
}
