package com.hedgedata.data.cache;

import com.hedgedata.core.model.FinancialMetrics;
import com.hedgedata.core.model.FinancialRecord;
import com.hedgedata.core.model.LineItem;
import com.hedgedata.core.model.RecordKind;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Range, period and limit views over cached collections. Every method returns
 * a new list in the kind's order; inputs are never modified.
 */
public final class RecordFilter {

    private RecordFilter() {
        // Prevent instantiation
    }

    /**
     * Records whose date key lies in [start, end]. A null start is unbounded below.
     */
    public static <T extends FinancialRecord> List<T> inRange(RecordKind<T> kind, List<T> records,
                                                              String start, String end) {
        return records.stream()
            .filter(r -> within(r.dateKey(), start, end))
            .sorted(kind.getOrder())
            .toList();
    }

    /**
     * Same as {@link #inRange} truncated to the first {@code limit} records.
     */
    public static <T extends FinancialRecord> List<T> inRange(RecordKind<T> kind, List<T> records,
                                                              String start, String end, int limit) {
        return limit(inRange(kind, records, start, end), limit);
    }

    /**
     * Metrics for one period type reported on or before {@code end}, newest first.
     */
    public static List<FinancialMetrics> metrics(List<FinancialMetrics> records, String end,
                                                 String period, int limit) {
        List<FinancialMetrics> matching = records.stream()
            .filter(m -> within(m.reportPeriod(), null, end))
            .filter(m -> period == null || period.equalsIgnoreCase(m.period()))
            .sorted(RecordKind.FINANCIAL_METRICS.getOrder())
            .toList();
        return limit(matching, limit);
    }

    /**
     * Requested line items for one period type on or before {@code end}, newest
     * first. {@code limit} bounds the number of distinct report periods returned.
     */
    public static List<LineItem> lineItems(List<LineItem> records, Collection<String> names,
                                           String end, String period, int limit) {
        Set<String> wanted = names.stream().map(String::toLowerCase).collect(Collectors.toSet());
        List<LineItem> matching = records.stream()
            .filter(item -> wanted.contains(item.lineItem().toLowerCase()))
            .filter(item -> within(item.reportPeriod(), null, end))
            .filter(item -> period == null || period.equalsIgnoreCase(item.period()))
            .sorted(RecordKind.LINE_ITEMS.getOrder())
            .toList();
        if (limit <= 0) {
            return List.of();
        }
        Set<String> periods = new LinkedHashSet<>();
        for (LineItem item : matching) {
            periods.add(item.reportPeriod());
            if (periods.size() == limit) {
                break;
            }
        }
        return matching.stream().filter(item -> periods.contains(item.reportPeriod())).toList();
    }

    public static <T> List<T> limit(List<T> records, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return records.size() <= limit ? records : List.copyOf(records.subList(0, limit));
    }

    // ISO dates compare correctly as strings
    static boolean within(String key, String start, String end) {
        if (key == null) {
            return false;
        }
        if (start != null && key.compareTo(start) < 0) {
            return false;
        }
        return end == null || key.compareTo(end) <= 0;
    }
}
