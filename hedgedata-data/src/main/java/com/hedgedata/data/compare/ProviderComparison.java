package com.hedgedata.data.compare;

import com.hedgedata.core.model.DataProvider;
import com.hedgedata.core.model.FinancialMetric;
import com.hedgedata.core.model.FinancialMetrics;
import com.hedgedata.core.model.Price;
import com.hedgedata.core.model.PriceSeries;
import com.hedgedata.data.FetchResult;
import com.hedgedata.data.ProviderSettings;
import com.hedgedata.data.cache.InMemoryRecordCache;
import com.hedgedata.data.provider.DataProviderClient;
import com.hedgedata.data.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches the same ticker from two providers directly, without failover, and
 * lines up the latest price bar, the latest metrics and the market cap.
 *
 * Each side gets its own client over a fresh in-memory cache, so neither
 * provider can answer from records the other one fetched.
 */
public class ProviderComparison {

    private static final Logger log = LoggerFactory.getLogger(ProviderComparison.class);

    private final ProviderSettings settings;
    private final ProviderRegistry.ClientFactory factory;

    public ProviderComparison(ProviderSettings settings) {
        this(settings, ProviderRegistry::createClient);
    }

    public ProviderComparison(ProviderSettings settings, ProviderRegistry.ClientFactory factory) {
        this.settings = settings;
        this.factory = factory;
    }

    public ComparisonReport compare(String ticker, String startDate, String endDate,
                                    DataProvider left, DataProvider right) {
        List<FieldDiff> fields = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        FetchResult<DataProviderClient> leftClient = isolatedClient(left);
        FetchResult<DataProviderClient> rightClient = isolatedClient(right);

        FetchResult<List<Price>> leftPrices =
            FetchResult.of(() -> unwrap(leftClient).getPrices(ticker, startDate, endDate));
        FetchResult<List<Price>> rightPrices =
            FetchResult.of(() -> unwrap(rightClient).getPrices(ticker, startDate, endDate));
        comparePrices(valueOf(leftPrices, left, "prices", notes), valueOf(rightPrices, right, "prices", notes),
            fields, notes);

        FetchResult<List<FinancialMetrics>> leftMetrics =
            FetchResult.of(() -> unwrap(leftClient).getFinancialMetrics(ticker, endDate, "ttm", 1));
        FetchResult<List<FinancialMetrics>> rightMetrics =
            FetchResult.of(() -> unwrap(rightClient).getFinancialMetrics(ticker, endDate, "ttm", 1));
        compareMetrics(valueOf(leftMetrics, left, "financial metrics", notes),
            valueOf(rightMetrics, right, "financial metrics", notes), fields);

        FetchResult<Optional<Double>> leftCap =
            FetchResult.of(() -> unwrap(leftClient).getMarketCap(ticker, endDate));
        FetchResult<Optional<Double>> rightCap =
            FetchResult.of(() -> unwrap(rightClient).getMarketCap(ticker, endDate));
        Optional<Double> lc = valueOf(leftCap, left, "market cap", notes).flatMap(o -> o);
        Optional<Double> rc = valueOf(rightCap, right, "market cap", notes).flatMap(o -> o);
        if (lc.isPresent() || rc.isPresent()) {
            fields.add(new FieldDiff("market_cap (live)", lc.orElse(null), rc.orElse(null)));
        }

        ComparisonReport report = new ComparisonReport(ticker, left, right, fields, notes);
        log.info("Compared {} across {} and {}: {} fields, {} significant differences", ticker,
            left.getDisplayName(), right.getDisplayName(), fields.size(), report.significantDifferences().size());
        return report;
    }

    private FetchResult<DataProviderClient> isolatedClient(DataProvider provider) {
        return FetchResult.of(() -> factory.create(provider, settings, new InMemoryRecordCache()));
    }

    private static DataProviderClient unwrap(FetchResult<DataProviderClient> client) throws Exception {
        if (client instanceof FetchResult.Success<DataProviderClient> success) {
            return success.value();
        }
        throw ((FetchResult.Failure<DataProviderClient>) client).error();
    }

    private static void comparePrices(Optional<List<Price>> left, Optional<List<Price>> right,
                                      List<FieldDiff> fields, List<String> notes) {
        if (left.isEmpty() || right.isEmpty()) {
            return;
        }
        Optional<Price> l = PriceSeries.of(left.get()).last();
        Optional<Price> r = PriceSeries.of(right.get()).last();
        if (l.isEmpty() || r.isEmpty()) {
            notes.add("No price bars on " + (l.isEmpty() ? "left" : "right") + " side");
            return;
        }
        if (!l.get().time().equals(r.get().time())) {
            notes.add("Latest bars differ in date: " + l.get().time() + " vs " + r.get().time());
            return;
        }
        String day = l.get().time();
        fields.add(new FieldDiff("open " + day, l.get().open(), r.get().open()));
        fields.add(new FieldDiff("high " + day, l.get().high(), r.get().high()));
        fields.add(new FieldDiff("low " + day, l.get().low(), r.get().low()));
        fields.add(new FieldDiff("close " + day, l.get().close(), r.get().close()));
        fields.add(new FieldDiff("volume " + day, (double) l.get().volume(), (double) r.get().volume()));
    }

    private static void compareMetrics(Optional<List<FinancialMetrics>> left, Optional<List<FinancialMetrics>> right,
                                       List<FieldDiff> fields) {
        FinancialMetrics l = left.flatMap(list -> list.stream().findFirst()).orElse(null);
        FinancialMetrics r = right.flatMap(list -> list.stream().findFirst()).orElse(null);
        if (l == null && r == null) {
            return;
        }
        for (FinancialMetric metric : FinancialMetric.values()) {
            Double lv = l != null ? l.values().get(metric) : null;
            Double rv = r != null ? r.values().get(metric) : null;
            if (lv != null || rv != null) {
                fields.add(new FieldDiff(metric.getCanonicalName(), lv, rv));
            }
        }
    }

    private static <T> Optional<T> valueOf(FetchResult<T> result, DataProvider provider, String what,
                                           List<String> notes) {
        if (result instanceof FetchResult.Success<T> success) {
            return Optional.ofNullable(success.value());
        }
        Exception error = ((FetchResult.Failure<T>) result).error();
        notes.add(provider.getDisplayName() + " " + what + " failed: " + error.getMessage());
        log.warn("{} {} failed: {}", provider.getDisplayName(), what, error.getMessage());
        return Optional.empty();
    }
}
