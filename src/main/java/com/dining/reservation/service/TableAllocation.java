package com.dining.reservation.service;

import com.dining.reservation.entity.DiningTable;
import com.dining.reservation.exception.BookingFailure;

/**
 * Result of {@link TableAllocator#allocate}. Either {@code table} is set, or {@code failure}
 * and {@code message} explain why none could be chosen.
 */
public record TableAllocation(DiningTable table, BookingFailure failure, String message) {

    public static TableAllocation allocated(DiningTable table) {
        return new TableAllocation(table, null, null);
    }

    public static TableAllocation failed(BookingFailure failure, String message) {
        return new TableAllocation(null, failure, message);
    }

    public boolean isAllocated() {
        return table != null;
    }
}
