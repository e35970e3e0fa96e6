package com.dining.reservation.time;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses same-day clock times in the forms {@code H}, {@code HH}, {@code H:MM},
 * {@code HH:MM} and {@code HH:MM:SS}. Seconds are validated and then dropped; the engine
 * works at minute resolution.
 *
 * <p>Parsing never throws. Malformed input yields a failed {@link TimeParseResult} so that
 * callers decide whether it is a client error (a booking request) or data to skip (a stored
 * reservation scanned for conflicts).
 */
public final class TimeParser {

    private static final Pattern TIME_PATTERN =
        Pattern.compile("^(\\d{1,2})(?::(\\d{1,2})(?::(\\d{1,2}))?)?$");

    private TimeParser() {}

    public static TimeParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return TimeParseResult.failure("Time string cannot be empty");
        }
        String trimmed = text.trim();
        Matcher matcher = TIME_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            return TimeParseResult.failure("Invalid time format: " + trimmed + ". Use HH:MM format.");
        }

        int hours = Integer.parseInt(matcher.group(1));
        int minutes = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0;
        int seconds = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0;

        if (hours > 23) {
            return TimeParseResult.failure("Invalid hours value: " + hours + ". Must be between 0-23.");
        }
        if (minutes > 59) {
            return TimeParseResult.failure("Invalid minutes value: " + minutes + ". Must be between 0-59.");
        }
        if (seconds > 59) {
            return TimeParseResult.failure("Invalid seconds value: " + seconds + ". Must be between 0-59.");
        }
        return TimeParseResult.success(LocalTime.of(hours, minutes));
    }
}
