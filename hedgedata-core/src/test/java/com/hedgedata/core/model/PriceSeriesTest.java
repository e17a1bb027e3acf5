package com.hedgedata.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriceSeriesTest {

    private static Price bar(String day, double close) {
        return new Price("MSFT", day, close, close + 1, close - 1, close, 10L);
    }

    @Test
    @DisplayName("Sorts chronologically and keeps the last bar per day")
    void sortsAndDedups() {
        PriceSeries series = PriceSeries.of(List.of(
            bar("2024-01-03", 102), bar("2024-01-02", 100), bar("2024-01-03", 103)));

        assertEquals(2, series.size());
        assertEquals("2024-01-02", series.first().orElseThrow().time());
        assertEquals(103.0, series.last().orElseThrow().close());
        assertArrayEquals(new double[]{100, 103}, series.closes());
        assertEquals(0.03, series.totalReturn(), 1e-9);
    }

    @Test
    @DisplayName("Empty series has no bars and zero return")
    void emptySeries() {
        PriceSeries series = PriceSeries.of(List.of());

        assertTrue(series.isEmpty());
        assertTrue(series.first().isEmpty());
        assertEquals(0.0, series.totalReturn());
    }
}
