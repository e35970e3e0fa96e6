package com.dining.reservation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Booking engine settings bound from the {@code booking.*} namespace.
 *
 * @param defaultDuration        length of every reservation window
 * @param rejectMidnightCrossing refuse bookings whose window would wrap past 23:59; when
 *                               {@code false} the wrapped end time is stored as-is
 */
@ConfigurationProperties(prefix = "booking")
public record BookingProperties(
    @DefaultValue("PT2H") Duration defaultDuration,
    @DefaultValue("true") boolean rejectMidnightCrossing
) {

    public BookingProperties {
        if (defaultDuration.isZero() || defaultDuration.isNegative()) {
            throw new IllegalArgumentException("booking.default-duration must be positive");
        }
    }
}
