package com.hedgedata.data.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.hedgedata.core.model.CompanyNews;
import com.hedgedata.core.model.DataProvider;
import com.hedgedata.core.model.FinancialMetric;
import com.hedgedata.core.model.FinancialMetrics;
import com.hedgedata.core.model.InsiderTrade;
import com.hedgedata.core.model.LineItem;
import com.hedgedata.core.model.Price;
import com.hedgedata.core.util.DateFormats;
import com.hedgedata.data.ProviderSettings;
import com.hedgedata.data.cache.RecordCache;
import com.hedgedata.data.cache.RecordFilter;
import com.hedgedata.data.exception.FetchException;
import com.hedgedata.data.exception.ProviderConfigurationException;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Financial Datasets client (financialdatasets.ai). The API key is optional:
 * a handful of tickers are served without one, which makes this the
 * no-credential fallback provider. When present it is sent as {@code X-API-KEY}.
 *
 * Field names in responses already match the canonical snake_case names.
 */
public class FinancialDatasetsClient extends AbstractCachingProviderClient {

    private static final Logger log = LoggerFactory.getLogger(FinancialDatasetsClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.financialdatasets.ai";

    // Largest page the paginated endpoints accept
    private static final int MAX_PAGE_SIZE = 1000;
    private static final int MAX_PAGES = 50;

    private final String apiKey;

    public FinancialDatasetsClient(ProviderSettings settings, RecordCache cache) throws ProviderConfigurationException {
        this(settings.getApiKey(DataProvider.FINANCIAL_DATASETS).orElse(null),
            settings.getBaseUrl(DataProvider.FINANCIAL_DATASETS).orElse(DEFAULT_BASE_URL),
            cache, Clock.systemUTC());
    }

    /**
     * @param apiKey may be null
     */
    public FinancialDatasetsClient(String apiKey, String baseUrl, RecordCache cache, Clock clock)
            throws ProviderConfigurationException {
        super(cache, baseUrl, clock);
        this.apiKey = apiKey != null && !apiKey.isBlank() ? apiKey : null;
    }

    @Override
    public DataProvider getProvider() {
        return DataProvider.FINANCIAL_DATASETS;
    }

    @Override
    protected void authenticate(Request.Builder request) {
        if (apiKey != null) {
            request.header("X-API-KEY", apiKey);
        }
    }

    // ========== Prices ==========

    @Override
    protected List<Price> fetchPrices(String ticker, String startDate, String endDate) throws FetchException {
        HttpUrl url = endpoint("prices/")
            .addQueryParameter("ticker", ticker)
            .addQueryParameter("interval", "day")
            .addQueryParameter("interval_multiplier", "1")
            .addQueryParameter("start_date", startDate)
            .addQueryParameter("end_date", endDate)
            .build();
        JsonNode bars = requireArray(getJson(url), "prices", "prices");

        List<Price> prices = new ArrayList<>(bars.size());
        for (JsonNode bar : bars) {
            String time = text(bar, "time");
            Double open = number(bar, "open");
            Double high = number(bar, "high");
            Double low = number(bar, "low");
            Double close = number(bar, "close");
            if (time == null || open == null || high == null || low == null || close == null) {
                log.warn("Skipping malformed Financial Datasets price bar for {}: {}", ticker, bar);
                continue;
            }
            Double volume = number(bar, "volume");
            prices.add(new Price(ticker, DateFormats.dateOnly(time), open, high, low, close,
                volume != null ? volume.longValue() : 0L));
        }
        return prices;
    }

    // ========== Financial metrics ==========

    @Override
    protected List<FinancialMetrics> fetchFinancialMetrics(String ticker, String endDate, String period, int limit)
            throws FetchException {
        HttpUrl url = endpoint("financial-metrics/")
            .addQueryParameter("ticker", ticker)
            .addQueryParameter("report_period_lte", endDate)
            .addQueryParameter("limit", String.valueOf(limit))
            .addQueryParameter("period", period != null ? period : "ttm")
            .build();
        JsonNode rows = requireArray(getJson(url), "financial_metrics", "financial-metrics");

        List<FinancialMetrics> metrics = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            String reportPeriod = text(row, "report_period");
            if (reportPeriod == null) {
                log.warn("Skipping Financial Datasets metrics row without report_period for {}", ticker);
                continue;
            }
            Map<FinancialMetric, Double> values = new EnumMap<>(FinancialMetric.class);
            for (FinancialMetric metric : FinancialMetric.values()) {
                Double value = number(row, metric.getCanonicalName());
                if (value != null) {
                    values.put(metric, value);
                }
            }
            String rowPeriod = text(row, "period");
            metrics.add(new FinancialMetrics(ticker, DateFormats.dateOnly(reportPeriod),
                rowPeriod != null ? rowPeriod : period, text(row, "currency"), values));
        }
        return metrics;
    }

    // ========== Line items ==========

    @Override
    protected List<LineItem> fetchLineItems(String ticker, List<String> lineItems, String endDate, String period,
                                            int limit) throws FetchException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tickers", List.of(ticker));
        body.put("line_items", lineItems);
        body.put("end_date", endDate);
        body.put("period", period != null ? period : "ttm");
        body.put("limit", limit);
        JsonNode results = requireArray(postJson(endpoint("financials/search/line-items").build(), body),
            "search_results", "line-items search");

        List<LineItem> items = new ArrayList<>();
        for (JsonNode result : results) {
            String reportPeriod = text(result, "report_period");
            if (reportPeriod == null) {
                log.warn("Skipping Financial Datasets line item result without report_period for {}", ticker);
                continue;
            }
            String resultPeriod = text(result, "period");
            for (String name : lineItems) {
                if (!result.has(name)) {
                    log.debug("Financial Datasets returned no '{}' for {} {}", name, ticker, reportPeriod);
                    continue;
                }
                items.add(new LineItem(ticker, name, number(result, name), DateFormats.dateOnly(reportPeriod),
                    resultPeriod != null ? resultPeriod : period, text(result, "currency")));
            }
        }
        return items;
    }

    // ========== Insider trades ==========

    @Override
    protected List<InsiderTrade> fetchInsiderTrades(String ticker, String startDate, String endDate, int limit)
            throws FetchException {
        List<JsonNode> rows = paginate("insider-trades/", "insider_trades", "filing_date_gte", "filing_date_lte",
            "filing_date", ticker, startDate, endDate, limit);

        List<InsiderTrade> trades = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            String filingDate = text(row, "filing_date");
            if (filingDate == null) {
                log.warn("Skipping Financial Datasets insider trade without filing_date for {}", ticker);
                continue;
            }
            String transactionDate = text(row, "transaction_date");
            trades.add(new InsiderTrade(
                ticker,
                DateFormats.dateOnly(filingDate),
                transactionDate != null ? DateFormats.dateOnly(transactionDate) : null,
                text(row, "name"),
                text(row, "title"),
                text(row, "transaction_type"),
                number(row, "transaction_shares"),
                number(row, "transaction_price_per_share"),
                number(row, "transaction_value"),
                number(row, "shares_owned_after_transaction")
            ));
        }
        return trades;
    }

    // ========== Company news ==========

    @Override
    protected List<CompanyNews> fetchCompanyNews(String ticker, String startDate, String endDate, int limit)
            throws FetchException {
        List<JsonNode> rows = paginate("news/", "news", "start_date", "end_date", "date",
            ticker, startDate, endDate, limit);

        List<CompanyNews> news = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            String date = text(row, "date");
            String title = text(row, "title");
            if (date == null || title == null) {
                log.warn("Skipping Financial Datasets article without date or title for {}", ticker);
                continue;
            }
            news.add(new CompanyNews(ticker, DateFormats.dateOnly(date), title, null,
                text(row, "source"), text(row, "url"), text(row, "sentiment")));
        }
        return news;
    }

    /**
     * Walk a date-descending endpoint backwards. Each page ends at the oldest
     * date of the previous one; stops on a short page, without a start date,
     * once the start date is reached, or when the cursor stops moving.
     */
    private List<JsonNode> paginate(String path, String arrayField, String startParam, String endParam,
                                    String dateField, String ticker, String startDate, String endDate,
                                    int limit) throws FetchException {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        Function<JsonNode, String> dateOf = row -> {
            String d = text(row, dateField);
            return d != null ? DateFormats.dateOnly(d) : null;
        };

        List<JsonNode> rows = new ArrayList<>();
        String currentEnd = endDate;
        for (int page = 0; page < MAX_PAGES; page++) {
            HttpUrl.Builder url = endpoint(path)
                .addQueryParameter("ticker", ticker)
                .addQueryParameter(endParam, currentEnd)
                .addQueryParameter("limit", String.valueOf(pageSize));
            if (startDate != null) {
                url.addQueryParameter(startParam, startDate);
            }
            JsonNode batch = requireArray(getJson(url.build()), arrayField, path);
            batch.forEach(rows::add);

            if (startDate == null || batch.size() < pageSize) {
                break;
            }
            String oldest = null;
            for (JsonNode row : batch) {
                String d = dateOf.apply(row);
                if (d != null && (oldest == null || d.compareTo(oldest) < 0)) {
                    oldest = d;
                }
            }
            if (oldest == null || oldest.compareTo(startDate) <= 0 || oldest.equals(currentEnd)) {
                break;
            }
            currentEnd = oldest;
        }
        return rows;
    }

    // ========== Market cap ==========

    /**
     * Live market cap from the company facts when {@code endDate} is today,
     * otherwise the market cap of the latest ttm metrics on or before it,
     * fetched without going through the metrics cache.
     */
    @Override
    public Optional<Double> getMarketCap(String ticker, String endDate) throws FetchException {
        String symbol = requireTicker(ticker);
        String end = requireDate(endDate, "endDate");

        if (end.equals(DateFormats.format(today()))) {
            HttpUrl url = endpoint("company/facts/")
                .addQueryParameter("ticker", symbol)
                .build();
            JsonNode facts = getJson(url).path("company_facts");
            Double marketCap = facts.isObject() ? number(facts, "market_cap") : null;
            return Optional.ofNullable(marketCap);
        }

        // Straight from the provider; market cap lookups never read or fill the cache
        List<FinancialMetrics> metrics = RecordFilter.metrics(fetchFinancialMetrics(symbol, end, "ttm", 10),
            end, "ttm", 1);
        return metrics.isEmpty() ? Optional.empty() : metrics.get(0).marketCap();
    }
}
