package com.hedgedata.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateFormatsTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("Keeps ISO dates")
        void keepsIso() {
            assertEquals("2024-01-05", DateFormats.normalize("2024-01-05"));
        }

        @Test
        @DisplayName("Converts US month/day/year")
        void convertsUsFormat() {
            assertEquals("2024-01-05", DateFormats.normalize("01/05/2024"));
        }

        @Test
        @DisplayName("Converts day-month-year")
        void convertsDayMonthYear() {
            assertEquals("2024-01-05", DateFormats.normalize("05-01-2024"));
        }

        @Test
        @DisplayName("Returns unrecognized input unchanged")
        void returnsUnrecognizedUnchanged() {
            assertEquals("last tuesday", DateFormats.normalize("last tuesday"));
            assertEquals("2024-02-30", DateFormats.normalize("2024-02-30"));
            assertNull(DateFormats.normalize(null));
        }
    }

    @Test
    @DisplayName("dateOnly strips the time of ISO timestamps")
    void dateOnlyStripsTime() {
        assertEquals("2024-01-02", DateFormats.dateOnly("2024-01-02T05:00:00Z"));
        assertEquals("2024-01-02", DateFormats.dateOnly("2024-01-02 16:00:00"));
        assertEquals("2024-01-02", DateFormats.dateOnly("01/02/2024"));
    }

    @Test
    @DisplayName("Epoch seconds convert at UTC midnight")
    void epochSecondsRoundTripAtMidnight() {
        assertEquals(1704153600L, DateFormats.toEpochSeconds("2024-01-02"));
        assertEquals("2024-01-02", DateFormats.fromEpochSeconds(1704153600L));
        assertEquals("2024-01-02", DateFormats.fromEpochSeconds(1704153600L + 86_399L));
    }

    @Test
    @DisplayName("parse rejects values that are not dates")
    void parseRejectsGarbage() {
        assertEquals(LocalDate.of(2024, 1, 5), DateFormats.parse("01/05/2024"));
        assertThrows(IllegalArgumentException.class, () -> DateFormats.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DateFormats.parse(null));
    }
}
