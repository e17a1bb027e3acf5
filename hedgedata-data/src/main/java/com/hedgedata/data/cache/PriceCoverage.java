package com.hedgedata.data.cache;

import com.hedgedata.core.model.Price;
import com.hedgedata.core.util.DateFormats;
import com.hedgedata.core.util.TradingCalendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Works out which part of a requested price range the cache cannot answer.
 *
 * When no cached bar falls inside the requested range, the whole range is
 * missing. Otherwise only the edges are checked: the head before the first
 * cached bar and the tail after the last one. A gap counts only if it contains
 * a trading day strictly before today, since today's bar is not final. A hole
 * inside a range that already has cached bars is not detected.
 */
public final class PriceCoverage {

    private PriceCoverage() {
        // Prevent instantiation
    }

    /**
     * Inclusive date range to fetch.
     */
    public record DateRange(String start, String end) {
    }

    public static List<DateRange> missingRanges(List<Price> cached, String start, String end, LocalDate today) {
        if (cached.isEmpty()) {
            return List.of(new DateRange(start, end));
        }
        String first = null;
        String last = null;
        boolean anyInRange = false;
        for (Price p : cached) {
            if (first == null || p.time().compareTo(first) < 0) first = p.time();
            if (last == null || p.time().compareTo(last) > 0) last = p.time();
            if (RecordFilter.within(p.time(), start, end)) anyInRange = true;
        }

        LocalDate from = DateFormats.parse(start);
        LocalDate to = DateFormats.parse(end);
        LocalDate firstCached = DateFormats.parse(first);
        LocalDate lastCached = DateFormats.parse(last);
        LocalDate yesterday = today.minusDays(1);

        if (!anyInRange) {
            return TradingCalendar.hasTradingDay(from, min(to, yesterday))
                ? List.of(new DateRange(start, end))
                : List.of();
        }

        List<DateRange> missing = new ArrayList<>(2);
        if (from.isBefore(firstCached)) {
            LocalDate headEnd = min(firstCached.minusDays(1), to);
            if (TradingCalendar.hasTradingDay(from, min(headEnd, yesterday))) {
                missing.add(new DateRange(start, DateFormats.format(headEnd)));
            }
        }
        if (to.isAfter(lastCached)) {
            LocalDate tailStart = max(lastCached.plusDays(1), from);
            if (TradingCalendar.hasTradingDay(tailStart, min(to, yesterday))) {
                missing.add(new DateRange(DateFormats.format(tailStart), end));
            }
        }
        return missing;
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }
}
