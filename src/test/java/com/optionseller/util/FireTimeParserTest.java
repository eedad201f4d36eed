package com.optionseller.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class FireTimeParserTest {

    // 2024-01-18 09:30 IST
    private final Clock clock = Clock.fixed(Instant.parse("2024-01-18T04:00:00Z"), ZoneId.of("Asia/Kolkata"));

    @Test
    @DisplayName("Should read HH:mm as today at that minute")
    void shouldParseHoursAndMinutes() {
        assertEquals(Instant.parse("2024-01-18T04:15:00Z"), FireTimeParser.todayAt("09:45", clock));
    }

    @Test
    @DisplayName("Should read HH:mm:ss with seconds")
    void shouldParseSeconds() {
        assertEquals(Instant.parse("2024-01-18T09:44:30Z"), FireTimeParser.todayAt("15:14:30", clock));
    }

    @Test
    @DisplayName("Should reject malformed and blank input")
    void shouldRejectMalformed() {
        assertThrows(IllegalArgumentException.class, () -> FireTimeParser.todayAt("9.45", clock));
        assertThrows(IllegalArgumentException.class, () -> FireTimeParser.todayAt("25:00", clock));
        assertThrows(IllegalArgumentException.class, () -> FireTimeParser.todayAt(" ", clock));
        assertThrows(IllegalArgumentException.class, () -> FireTimeParser.todayAt(null, clock));
    }
}
