package com.dining.reservation.time;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Half-open same-day interval {@code [start, end)} at minute resolution.
 *
 * <p>Two windows overlap when {@code a.start < b.end && a.end > b.start}; windows that only
 * touch ({@code a.end == b.start}) do not, so back-to-back bookings are allowed.
 *
 * <p>{@link #starting(LocalTime, Duration)} wraps the end modulo 24 hours. A wrapped window
 * has {@code end <= start}; {@link #crossesMidnight()} reports it so the booking layer can
 * refuse it.
 */
public record TimeWindow(LocalTime start, LocalTime end) {

    public static final DateTimeFormatter CLOCK_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static TimeWindow starting(LocalTime start, Duration duration) {
        return new TimeWindow(start, start.plus(duration));
    }

    /**
     * Rebuilds the window of a stored reservation. Returns empty when either stored string
     * does not parse.
     */
    public static Optional<TimeWindow> fromStored(String startText, String endText) {
        TimeParseResult start = TimeParser.parse(startText);
        TimeParseResult end = TimeParser.parse(endText);
        if (!start.isSuccess() || !end.isSuccess()) {
            return Optional.empty();
        }
        return Optional.of(new TimeWindow(start.time(), end.time()));
    }

    public boolean overlaps(TimeWindow other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public boolean crossesMidnight() {
        return !end.isAfter(start);
    }

    public String startText() {
        return start.format(CLOCK_FORMAT);
    }

    public String endText() {
        return end.format(CLOCK_FORMAT);
    }

    @Override
    public String toString() {
        return startText() + "-" + endText();
    }
}
