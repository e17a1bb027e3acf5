package com.hedgedata.data.cache;

import com.hedgedata.core.model.CompanyNews;
import com.hedgedata.core.model.Price;
import com.hedgedata.core.model.RecordKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordCacheTest {

    private RecordCache cache;

    @BeforeEach
    void setUp() {
        cache = new InMemoryRecordCache();
    }

    private static Price bar(String day, double close) {
        return new Price("AAPL", day, close, close, close, close, 100L);
    }

    @Test
    @DisplayName("Nothing cached reads as an empty list")
    void emptyRead() {
        assertTrue(cache.get(RecordKind.PRICES, "AAPL").isEmpty());
    }

    @Test
    @DisplayName("Writing the same records twice changes nothing")
    void idempotentSet() {
        List<Price> prices = List.of(bar("2024-01-02", 1), bar("2024-01-03", 2));

        cache.set(RecordKind.PRICES, "AAPL", prices);
        List<Price> once = cache.get(RecordKind.PRICES, "AAPL");
        cache.set(RecordKind.PRICES, "AAPL", prices);

        assertEquals(once, cache.get(RecordKind.PRICES, "AAPL"));
        assertEquals(2, once.size());
    }

    @Test
    @DisplayName("A record with an existing key replaces the cached one")
    void mergeReplaces() {
        cache.set(RecordKind.PRICES, "AAPL", List.of(bar("2024-01-02", 1), bar("2024-01-03", 2)));

        cache.set(RecordKind.PRICES, "AAPL", List.of(bar("2024-01-03", 2.5), bar("2024-01-04", 3)));

        List<Price> merged = cache.get(RecordKind.PRICES, "AAPL");
        assertEquals(3, merged.size());
        assertEquals(2.5, merged.get(1).close());
    }

    @Test
    @DisplayName("Merged collections keep the kind's order")
    void mergeSorts() {
        cache.set(RecordKind.PRICES, "AAPL", List.of(bar("2024-01-05", 5), bar("2024-01-02", 2)));
        cache.set(RecordKind.PRICES, "AAPL", List.of(bar("2024-01-03", 3)));
        cache.set(RecordKind.COMPANY_NEWS, "AAPL", List.of(
            new CompanyNews("AAPL", "2024-01-02", "old", null, null, "u1", null),
            new CompanyNews("AAPL", "2024-01-09", "new", null, null, "u2", null)));

        assertEquals(List.of("2024-01-02", "2024-01-03", "2024-01-05"),
            cache.get(RecordKind.PRICES, "AAPL").stream().map(Price::time).toList());
        assertEquals("new", cache.get(RecordKind.COMPANY_NEWS, "AAPL").get(0).headline());
    }

    @Test
    @DisplayName("Tickers are case-insensitive and kept apart")
    void tickersAreSeparate() {
        cache.set(RecordKind.PRICES, "aapl", List.of(bar("2024-01-02", 1)));

        assertEquals(1, cache.get(RecordKind.PRICES, "AAPL").size());
        assertTrue(cache.get(RecordKind.PRICES, "MSFT").isEmpty());
        assertTrue(cache.get(RecordKind.COMPANY_NEWS, "AAPL").isEmpty());
    }

    @Test
    @DisplayName("clear drops one ticker or everything")
    void clear() {
        cache.set(RecordKind.PRICES, "AAPL", List.of(bar("2024-01-02", 1)));
        cache.set(RecordKind.PRICES, "MSFT", List.of(new Price("MSFT", "2024-01-02", 1, 1, 1, 1, 1)));

        cache.clear("aapl");
        assertTrue(cache.get(RecordKind.PRICES, "AAPL").isEmpty());
        assertFalse(cache.get(RecordKind.PRICES, "MSFT").isEmpty());

        cache.clear();
        assertTrue(cache.get(RecordKind.PRICES, "MSFT").isEmpty());
    }

    @Test
    @DisplayName("Blank tickers are rejected")
    void blankTicker() {
        assertThrows(IllegalArgumentException.class, () -> cache.get(RecordKind.PRICES, " "));
    }

    @Test
    @DisplayName("One lock per kind and ticker, whatever the ticker's case")
    void oneLockPerKey() {
        assertSame(cache.lockFor(RecordKind.PRICES, "AAPL"), cache.lockFor(RecordKind.PRICES, " aapl"));
        assertNotSame(cache.lockFor(RecordKind.PRICES, "AAPL"), cache.lockFor(RecordKind.COMPANY_NEWS, "AAPL"));
        assertNotSame(cache.lockFor(RecordKind.PRICES, "AAPL"), cache.lockFor(RecordKind.PRICES, "MSFT"));
    }
}
