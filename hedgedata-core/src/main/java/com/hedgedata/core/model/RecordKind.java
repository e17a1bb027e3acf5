package com.hedgedata.core.model;

import java.util.Comparator;
import java.util.List;

/**
 * Entity kind of cached records, typed by the record class it holds.
 * Carries the cache key and the order in which read results are returned:
 * prices chronologically, everything else newest first.
 *
 * @param <T> record type
 */
public final class RecordKind<T extends FinancialRecord> {

    public static final RecordKind<Price> PRICES =
        new RecordKind<>("prices", Price.class, true);
    public static final RecordKind<FinancialMetrics> FINANCIAL_METRICS =
        new RecordKind<>("financial_metrics", FinancialMetrics.class, false);
    public static final RecordKind<LineItem> LINE_ITEMS =
        new RecordKind<>("line_items", LineItem.class, false);
    public static final RecordKind<InsiderTrade> INSIDER_TRADES =
        new RecordKind<>("insider_trades", InsiderTrade.class, false);
    public static final RecordKind<CompanyNews> COMPANY_NEWS =
        new RecordKind<>("company_news", CompanyNews.class, false);

    private static final List<RecordKind<?>> VALUES =
        List.of(PRICES, FINANCIAL_METRICS, LINE_ITEMS, INSIDER_TRADES, COMPANY_NEWS);

    private final String key;
    private final Class<T> type;
    private final boolean ascending;
    private final Comparator<T> order;

    private RecordKind(String key, Class<T> type, boolean ascending) {
        this.key = key;
        this.type = type;
        this.ascending = ascending;
        // dedupKey breaks ties so records sharing a date keep a stable order
        Comparator<T> byDate = Comparator.comparing(FinancialRecord::dateKey,
            Comparator.nullsFirst(Comparator.naturalOrder()));
        Comparator<T> chronological = byDate.thenComparing(FinancialRecord::dedupKey);
        this.order = ascending ? chronological : chronological.reversed();
    }

    public static List<RecordKind<?>> values() {
        return VALUES;
    }

    /**
     * Stable identifier used in cache keys and file names.
     */
    public String getKey() {
        return key;
    }

    public Class<T> getType() {
        return type;
    }

    public boolean isAscending() {
        return ascending;
    }

    /**
     * Order in which filtered reads of this kind are returned.
     */
    public Comparator<T> getOrder() {
        return order;
    }

    @Override
    public String toString() {
        return key;
    }
}
