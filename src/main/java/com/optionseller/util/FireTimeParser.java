package com.optionseller.util;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Turns an operator-entered 24h wall-clock time ({@code HH:mm} or {@code HH:mm:ss}) into
 * an instant today in the market time zone.
 */
public final class FireTimeParser {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private FireTimeParser() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    public static Instant todayAt(String time, Clock clock) {
        if (time == null || time.isBlank()) {
            throw new IllegalArgumentException("Time is required in 24H format (HH:mm or HH:mm:ss)");
        }
        String trimmed = time.trim();
        LocalTime localTime;
        try {
            localTime = LocalTime.parse(trimmed, trimmed.length() == 5 ? HH_MM : HH_MM_SS);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time '" + time + "'. Use 24H format HH:mm or HH:mm:ss", e);
        }
        return LocalDate.now(clock).atTime(localTime).atZone(clock.getZone()).toInstant();
    }
}
