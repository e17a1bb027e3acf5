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
import com.hedgedata.data.exception.FetchException;
import com.hedgedata.data.exception.NormalizationException;
import com.hedgedata.data.exception.ProviderConfigurationException;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finnhub client (finnhub.io). Requires an API key, sent as the
 * {@code X-Finnhub-Token} header.
 *
 * API docs: https://finnhub.io/docs/api
 */
public class FinnhubClient extends AbstractCachingProviderClient {

    private static final Logger log = LoggerFactory.getLogger(FinnhubClient.class);

    public static final String DEFAULT_BASE_URL = "https://finnhub.io/api/v1";

    private static final long SECONDS_PER_DAY = 86_400L;
    private static final int DEFAULT_NEWS_DAYS = 30;
    private static final double MILLIONS = 1_000_000d;
    private static final double PERCENT = 0.01d;

    /**
     * Field in /stock/metric and the factor that converts it to the canonical unit.
     * Finnhub reports money in millions and ratios of income in percent.
     */
    private record MetricField(String field, double scale) {
    }

    private static final Map<FinancialMetric, MetricField> METRIC_FIELDS = Map.ofEntries(
        Map.entry(FinancialMetric.MARKET_CAP, new MetricField("marketCapitalization", MILLIONS)),
        Map.entry(FinancialMetric.ENTERPRISE_VALUE, new MetricField("enterpriseValue", MILLIONS)),
        Map.entry(FinancialMetric.PRICE_TO_EARNINGS_RATIO, new MetricField("peBasicExclExtraTTM", 1)),
        Map.entry(FinancialMetric.PRICE_TO_BOOK_RATIO, new MetricField("pbQuarterly", 1)),
        Map.entry(FinancialMetric.PRICE_TO_SALES_RATIO, new MetricField("psTTM", 1)),
        Map.entry(FinancialMetric.ENTERPRISE_VALUE_TO_EBITDA_RATIO, new MetricField("evToEBITDA", 1)),
        Map.entry(FinancialMetric.ENTERPRISE_VALUE_TO_REVENUE_RATIO, new MetricField("evToRevenue", 1)),
        Map.entry(FinancialMetric.GROSS_MARGIN, new MetricField("grossMarginTTM", PERCENT)),
        Map.entry(FinancialMetric.OPERATING_MARGIN, new MetricField("operatingMarginTTM", PERCENT)),
        Map.entry(FinancialMetric.NET_MARGIN, new MetricField("netProfitMarginTTM", PERCENT)),
        Map.entry(FinancialMetric.RETURN_ON_EQUITY, new MetricField("roeTTM", PERCENT)),
        Map.entry(FinancialMetric.RETURN_ON_ASSETS, new MetricField("roaTTM", PERCENT)),
        Map.entry(FinancialMetric.RETURN_ON_INVESTED_CAPITAL, new MetricField("roiTTM", PERCENT)),
        Map.entry(FinancialMetric.CURRENT_RATIO, new MetricField("currentRatioQuarterly", 1)),
        Map.entry(FinancialMetric.QUICK_RATIO, new MetricField("quickRatioQuarterly", 1)),
        Map.entry(FinancialMetric.DEBT_TO_EQUITY, new MetricField("totalDebt/totalEquityQuarterly", 1)),
        Map.entry(FinancialMetric.INTEREST_COVERAGE, new MetricField("netInterestCoverageTTM", 1)),
        Map.entry(FinancialMetric.DIVIDEND_YIELD, new MetricField("dividendYieldIndicatedAnnual", PERCENT)),
        Map.entry(FinancialMetric.PAYOUT_RATIO, new MetricField("payoutRatioTTM", PERCENT)),
        Map.entry(FinancialMetric.REVENUE_GROWTH, new MetricField("revenueGrowthTTMYoy", PERCENT)),
        Map.entry(FinancialMetric.EARNINGS_GROWTH, new MetricField("epsGrowthTTMYoy", PERCENT)),
        Map.entry(FinancialMetric.EARNINGS_PER_SHARE, new MetricField("epsTTM", 1)),
        Map.entry(FinancialMetric.BOOK_VALUE_PER_SHARE, new MetricField("bookValuePerShareQuarterly", 1)),
        Map.entry(FinancialMetric.FREE_CASH_FLOW_PER_SHARE, new MetricField("cashFlowPerShareTTM", 1))
    );

    // Canonical line item name -> field of an annual /stock/financials statement
    private static final Map<String, String> LINE_ITEM_FIELDS = Map.ofEntries(
        Map.entry("revenue", "revenue"),
        Map.entry("operating_income", "operatingIncome"),
        Map.entry("net_income", "netIncome"),
        Map.entry("capital_expenditure", "capitalExpenditures"),
        Map.entry("depreciation_and_amortization", "depreciationAndAmortization"),
        Map.entry("outstanding_shares", "outstandingShares"),
        Map.entry("total_assets", "totalAssets"),
        Map.entry("total_liabilities", "totalLiabilities"),
        Map.entry("dividends_and_other_cash_distributions", "dividendsPaid"),
        Map.entry("issuance_or_purchase_of_equity_shares", "issuanceOfCapitalStock")
    );

    private final String apiKey;

    public FinnhubClient(ProviderSettings settings, RecordCache cache) throws ProviderConfigurationException {
        this(settings.getApiKey(DataProvider.FINNHUB).orElse(null),
            settings.getBaseUrl(DataProvider.FINNHUB).orElse(DEFAULT_BASE_URL),
            cache, Clock.systemUTC());
    }

    public FinnhubClient(String apiKey, String baseUrl, RecordCache cache, Clock clock)
            throws ProviderConfigurationException {
        super(cache, baseUrl, clock);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderConfigurationException(DataProvider.FINNHUB.getCredentialKey() + " is not set");
        }
        this.apiKey = apiKey;
    }

    @Override
    public DataProvider getProvider() {
        return DataProvider.FINNHUB;
    }

    @Override
    protected void authenticate(Request.Builder request) {
        request.header("X-Finnhub-Token", apiKey);
    }

    // ========== Prices ==========

    @Override
    protected List<Price> fetchPrices(String ticker, String startDate, String endDate) throws FetchException {
        HttpUrl url = endpoint("stock/candle")
            .addQueryParameter("symbol", ticker)
            .addQueryParameter("resolution", "D")
            .addQueryParameter("from", String.valueOf(DateFormats.toEpochSeconds(startDate)))
            // 'to' is exclusive at second precision; one more day includes the end date's bar
            .addQueryParameter("to", String.valueOf(DateFormats.toEpochSeconds(endDate) + SECONDS_PER_DAY))
            .build();
        JsonNode root = getJson(url);

        if ("no_data".equals(text(root, "s"))) {
            return List.of();
        }
        JsonNode times = requireArray(root, "t", "candle");
        JsonNode opens = root.path("o");
        JsonNode highs = root.path("h");
        JsonNode lows = root.path("l");
        JsonNode closes = root.path("c");
        JsonNode volumes = root.path("v");

        List<Price> prices = new ArrayList<>(times.size());
        for (int i = 0; i < times.size(); i++) {
            JsonNode t = times.get(i);
            if (!t.isNumber() || !opens.path(i).isNumber() || !highs.path(i).isNumber()
                    || !lows.path(i).isNumber() || !closes.path(i).isNumber()) {
                log.warn("Skipping malformed Finnhub candle {} for {}", i, ticker);
                continue;
            }
            prices.add(new Price(
                ticker,
                DateFormats.fromEpochSeconds(t.asLong()),
                opens.get(i).asDouble(),
                highs.get(i).asDouble(),
                lows.get(i).asDouble(),
                closes.get(i).asDouble(),
                volumes.path(i).asLong(0)
            ));
        }
        return prices;
    }

    // ========== Financial metrics ==========

    @Override
    protected List<FinancialMetrics> fetchFinancialMetrics(String ticker, String endDate, String period, int limit)
            throws FetchException {
        HttpUrl url = endpoint("stock/metric")
            .addQueryParameter("symbol", ticker)
            .addQueryParameter("metric", "all")
            .build();
        JsonNode root = getJson(url);

        JsonNode metric = root.get("metric");
        if (metric == null || !metric.isObject()) {
            throw new NormalizationException(getProvider(), "Expected object 'metric' in metric response for " + ticker);
        }

        Map<FinancialMetric, Double> values = new EnumMap<>(FinancialMetric.class);
        METRIC_FIELDS.forEach((canonical, source) -> {
            Double value = number(metric, source.field());
            if (value != null) {
                values.put(canonical, value * source.scale());
            }
        });

        String reportPeriod = latestAnnualPeriod(root.path("series").path("annual"));
        if (reportPeriod == null) {
            reportPeriod = DateFormats.format(today());
        }
        // stock/metric only has the current snapshot. It is labelled with the requested
        // period so the cache view for that period finds it, whatever period was asked for.
        return List.of(new FinancialMetrics(ticker, reportPeriod, period != null ? period : "ttm", null, values));
    }

    // Newest 'period' across the annual series; each series lists {period, v} entries
    private static String latestAnnualPeriod(JsonNode annual) {
        String latest = null;
        Iterator<JsonNode> series = annual.elements();
        while (series.hasNext()) {
            for (JsonNode point : series.next()) {
                String p = text(point, "period");
                if (p != null && (latest == null || p.compareTo(latest) > 0)) {
                    latest = p;
                }
            }
        }
        return latest != null ? DateFormats.dateOnly(latest) : null;
    }

    // ========== Line items ==========

    @Override
    protected List<LineItem> fetchLineItems(String ticker, List<String> lineItems, String endDate, String period,
                                            int limit) throws FetchException {
        HttpUrl url = endpoint("stock/financials")
            .addQueryParameter("symbol", ticker)
            .addQueryParameter("statement", "all")
            .addQueryParameter("freq", "annual")
            .build();
        JsonNode statements = requireArray(getJson(url), "financials", "financials");

        for (String name : lineItems) {
            if (!LINE_ITEM_FIELDS.containsKey(name)) {
                log.debug("Finnhub has no mapping for line item '{}', skipping", name);
            }
        }

        int endYear = DateFormats.parse(endDate).getYear();
        List<JsonNode> annual = new ArrayList<>();
        for (JsonNode statement : statements) {
            JsonNode year = statement.get("year");
            if (year == null || !year.canConvertToInt()) {
                log.warn("Skipping Finnhub statement without a year for {}", ticker);
                continue;
            }
            if (year.asInt() <= endYear) {
                annual.add(statement);
            }
        }
        annual.sort((a, b) -> Integer.compare(b.get("year").asInt(), a.get("year").asInt()));

        List<LineItem> items = new ArrayList<>();
        for (JsonNode statement : annual.subList(0, Math.min(Math.max(limit, 0), annual.size()))) {
            // Annual statements are assumed to close on December 31
            String reportPeriod = statement.get("year").asInt() + "-12-31";
            for (String name : lineItems) {
                String field = LINE_ITEM_FIELDS.get(name);
                if (field == null || !statement.has(field)) {
                    continue;
                }
                items.add(new LineItem(ticker, name, number(statement, field), reportPeriod,
                    period != null ? period : "annual", null));
            }
        }
        return items;
    }

    // ========== Insider trades ==========

    @Override
    protected List<InsiderTrade> fetchInsiderTrades(String ticker, String startDate, String endDate, int limit)
            throws FetchException {
        HttpUrl.Builder url = endpoint("stock/insider-transactions")
            .addQueryParameter("symbol", ticker)
            .addQueryParameter("to", endDate);
        if (startDate != null) {
            url.addQueryParameter("from", startDate);
        }
        JsonNode data = requireArray(getJson(url.build()), "data", "insider-transactions");

        List<InsiderTrade> trades = new ArrayList<>();
        for (JsonNode trade : data) {
            String filingDate = text(trade, "filingDate");
            String transactionDate = text(trade, "transactionDate");
            String name = text(trade, "name");
            if (name == null || (filingDate == null && transactionDate == null)) {
                log.warn("Skipping Finnhub insider transaction without name or dates for {}", ticker);
                continue;
            }
            Double change = number(trade, "change");
            Double price = number(trade, "transactionPrice");
            trades.add(new InsiderTrade(
                ticker,
                filingDate != null ? DateFormats.normalize(filingDate) : null,
                transactionDate != null ? DateFormats.normalize(transactionDate) : null,
                name,
                null,
                text(trade, "transactionCode"),
                change,
                price,
                change != null && price != null ? change * price : null,
                number(trade, "share")
            ));
        }
        return trades;
    }

    // ========== Company news ==========

    @Override
    protected List<CompanyNews> fetchCompanyNews(String ticker, String startDate, String endDate, int limit)
            throws FetchException {
        String from = startDate != null
            ? startDate
            : DateFormats.format(DateFormats.parse(endDate).minusDays(DEFAULT_NEWS_DAYS));
        HttpUrl url = endpoint("company-news")
            .addQueryParameter("symbol", ticker)
            .addQueryParameter("from", from)
            .addQueryParameter("to", endDate)
            .build();
        JsonNode articles = requireArray(getJson(url), null, "company-news");

        List<CompanyNews> news = new ArrayList<>();
        for (JsonNode article : articles) {
            JsonNode datetime = article.get("datetime");
            String headline = text(article, "headline");
            if (datetime == null || !datetime.canConvertToLong() || headline == null) {
                log.warn("Skipping Finnhub article without datetime or headline for {}", ticker);
                continue;
            }
            news.add(new CompanyNews(
                ticker,
                DateFormats.fromEpochSeconds(datetime.asLong()),
                headline,
                text(article, "summary"),
                text(article, "source"),
                text(article, "url"),
                null
            ));
        }
        return news;
    }

    // ========== Market cap ==========

    /**
     * Current market cap from the company profile. Finnhub has no history for
     * it, so {@code endDate} only gets validated.
     */
    @Override
    public Optional<Double> getMarketCap(String ticker, String endDate) throws FetchException {
        String symbol = requireTicker(ticker);
        requireDate(endDate, "endDate");
        HttpUrl url = endpoint("stock/profile2")
            .addQueryParameter("symbol", symbol)
            .build();
        Double millions = number(getJson(url), "marketCapitalization");
        if (millions == null || millions <= 0) {
            return Optional.empty();
        }
        return Optional.of(millions * MILLIONS);
    }
}
