package com.dining.reservation.time;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Outcome of {@link TimeParser#parse(String)}: either a clock time or a message describing
 * why the input was rejected. Exactly one of the two components is non-null.
 */
public record TimeParseResult(LocalTime time, String error) {

    public TimeParseResult {
        if ((time == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of time or error must be set");
        }
    }

    public static TimeParseResult success(LocalTime time) {
        return new TimeParseResult(Objects.requireNonNull(time, "time"), null);
    }

    public static TimeParseResult failure(String error) {
        return new TimeParseResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return time != null;
    }
}
