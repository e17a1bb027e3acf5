package com.hedgedata.data.cache;

import com.hedgedata.core.model.Price;
import com.hedgedata.data.cache.PriceCoverage.DateRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriceCoverageTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    private static List<Price> bars(String... days) {
        return Arrays.stream(days).map(d -> new Price("AAPL", d, 1, 1, 1, 1, 1)).toList();
    }

    @Test
    @DisplayName("Empty cache needs the whole range")
    void emptyCache() {
        assertEquals(List.of(new DateRange("2024-01-01", "2024-01-05")),
            PriceCoverage.missingRanges(List.of(), "2024-01-01", "2024-01-05", TODAY));
    }

    @Test
    @DisplayName("Only the uncovered head and tail are missing")
    void headAndTail() {
        List<DateRange> missing = PriceCoverage.missingRanges(bars("2024-01-09", "2024-01-10"),
            "2024-01-02", "2024-01-12", TODAY);

        assertEquals(List.of(new DateRange("2024-01-02", "2024-01-08"), new DateRange("2024-01-11", "2024-01-12")),
            missing);
    }

    @Test
    @DisplayName("Edges made of weekends and holidays are not missing")
    void nonTradingEdges() {
        // Jan 1 is a holiday, Jan 6-7 a weekend
        assertTrue(PriceCoverage.missingRanges(bars("2024-01-02", "2024-01-05"),
            "2024-01-01", "2024-01-07", TODAY).isEmpty());
    }

    @Test
    @DisplayName("Today's bar alone does not count as missing")
    void todayIsNotFinal() {
        assertTrue(PriceCoverage.missingRanges(bars("2024-05-30", "2024-05-31"),
            "2024-05-30", "2024-06-03", LocalDate.of(2024, 6, 3)).isEmpty());
    }

    @Test
    @DisplayName("Range entirely after the cache is missing from its start")
    void rangeAfterCache() {
        assertEquals(List.of(new DateRange("2024-02-01", "2024-02-05")),
            PriceCoverage.missingRanges(bars("2024-01-02"), "2024-02-01", "2024-02-05", TODAY));
    }

    @Test
    @DisplayName("Range falling between cached bars is missing entirely")
    void rangeBetweenCachedBars() {
        assertEquals(List.of(new DateRange("2023-06-01", "2023-06-30")),
            PriceCoverage.missingRanges(bars("2023-01-03", "2024-01-31"), "2023-06-01", "2023-06-30", TODAY));
    }

    @Test
    @DisplayName("Weekend between cached bars is not missing")
    void weekendBetweenCachedBars() {
        assertTrue(PriceCoverage.missingRanges(bars("2024-01-05", "2024-01-08"),
            "2024-01-06", "2024-01-07", TODAY).isEmpty());
    }

    @Test
    @DisplayName("Holes inside a range that has cached bars are not detected")
    void interiorHoleIgnored() {
        assertTrue(PriceCoverage.missingRanges(bars("2024-01-02", "2024-01-31"),
            "2024-01-02", "2024-01-31", TODAY).isEmpty());
    }
}
