package com.hedgedata.data.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.hedgedata.core.model.CompanyNews;
import com.hedgedata.core.model.FinancialMetric;
import com.hedgedata.core.model.FinancialMetrics;
import com.hedgedata.core.model.InsiderTrade;
import com.hedgedata.core.model.LineItem;
import com.hedgedata.core.model.Price;
import com.hedgedata.core.model.RecordKind;
import com.hedgedata.data.HttpClientFactory;
import com.hedgedata.data.cache.InMemoryRecordCache;
import com.hedgedata.data.cache.RecordCache;
import com.hedgedata.data.exception.NormalizationException;
import com.hedgedata.data.provider.StubProviderServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

import static org.junit.jupiter.api.Assertions.*;

class FinancialDatasetsClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private StubProviderServer server;
    private RecordCache cache;

    @BeforeEach
    void setUp() throws Exception {
        server = StubProviderServer.start();
        cache = new InMemoryRecordCache();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private FinancialDatasetsClient client(String apiKey) throws Exception {
        return new FinancialDatasetsClient(apiKey, server.baseUrl(), cache, CLOCK);
    }

    @Test
    @DisplayName("Works without an API key and sends none")
    void worksWithoutKey() throws Exception {
        server.json("/prices/", "{\"prices\":["
            + "{\"time\":\"2024-01-03T05:00:00Z\",\"open\":184.2,\"high\":185.8,\"low\":183.4,\"close\":184.2,\"volume\":58414460},"
            + "{\"time\":\"2024-01-02T05:00:00Z\",\"open\":187.1,\"high\":188.4,\"low\":183.8,\"close\":185.6,\"volume\":82488700}]}");

        List<Price> prices = client(null).getPrices("AAPL", "2024-01-02", "2024-01-03");

        StubProviderServer.RecordedRequest request = server.requests("/prices/").get(0);
        assertNull(request.header("X-API-KEY"));
        assertEquals("AAPL", request.param("ticker"));
        assertEquals("day", request.param("interval"));
        assertEquals(List.of("2024-01-02", "2024-01-03"), prices.stream().map(Price::time).toList());
        assertEquals(82488700L, prices.get(0).volume());
    }

    @Test
    @DisplayName("Sends the API key header when configured")
    void sendsKey() throws Exception {
        server.json("/prices/", "{\"prices\":[]}");

        client("fd-key").getPrices("AAPL", "2024-01-02", "2024-01-03");

        assertEquals("fd-key", server.requests("/prices/").get(0).header("X-API-KEY"));
    }

    @Test
    @DisplayName("Response without the expected array is rejected")
    void wrongShape() {
        server.json("/prices/", "{\"detail\":\"Ticker not found\"}");

        assertThrows(NormalizationException.class,
            () -> client(null).getPrices("ZZZZ", "2024-01-02", "2024-01-03"));
    }

    @Test
    @DisplayName("Metrics use canonical field names")
    void metrics() throws Exception {
        server.json("/financial-metrics/", "{\"financial_metrics\":["
            + "{\"ticker\":\"AAPL\",\"report_period\":\"2024-03-30\",\"period\":\"ttm\",\"currency\":\"USD\","
            + "\"market_cap\":2.6e12,\"return_on_equity\":1.47,\"peg_ratio\":null},"
            + "{\"ticker\":\"AAPL\",\"report_period\":\"2023-12-30\",\"period\":\"ttm\",\"currency\":\"USD\","
            + "\"market_cap\":2.9e12},"
            + "{\"ticker\":\"AAPL\",\"period\":\"ttm\"}]}");

        List<FinancialMetrics> metrics = client(null).getFinancialMetrics("AAPL", "2024-05-31", "ttm", 5);

        StubProviderServer.RecordedRequest request = server.requests("/financial-metrics/").get(0);
        assertEquals("2024-05-31", request.param("report_period_lte"));
        assertEquals("5", request.param("limit"));
        assertEquals(2, metrics.size());
        assertEquals("2024-03-30", metrics.get(0).reportPeriod());
        assertEquals(1.47, metrics.get(0).get(FinancialMetric.RETURN_ON_EQUITY).orElseThrow());
        assertTrue(metrics.get(0).get(FinancialMetric.PEG_RATIO).isEmpty());
        assertEquals("USD", metrics.get(1).currency());
    }

    @Test
    @DisplayName("Line items are searched with a POST")
    void lineItems() throws Exception {
        server.json("/financials/search/line-items", "{\"search_results\":["
            + "{\"ticker\":\"AAPL\",\"report_period\":\"2023-09-30\",\"period\":\"annual\",\"currency\":\"USD\","
            + "\"net_income\":96995000000,\"free_cash_flow\":99584000000},"
            + "{\"ticker\":\"AAPL\",\"report_period\":\"2022-09-24\",\"period\":\"annual\",\"currency\":\"USD\","
            + "\"net_income\":99803000000}]}");

        List<LineItem> items = client(null).searchLineItems("AAPL", List.of("net_income", "free_cash_flow"),
            "2023-12-31", "annual", 2);

        StubProviderServer.RecordedRequest request = server.requests("/financials/search/line-items").get(0);
        assertEquals("POST", request.method());
        JsonNode body = HttpClientFactory.getMapper().readTree(request.body());
        assertEquals("AAPL", body.get("tickers").get(0).asText());
        assertEquals(2, body.get("line_items").size());
        assertEquals(2, body.get("limit").asInt());

        assertEquals(3, items.size());
        assertEquals("2023-09-30", items.get(0).reportPeriod());
        assertEquals(99803000000.0, items.get(2).value());
    }

    @Test
    @DisplayName("Insider trades page backwards by filing date")
    void insiderTradesPaginate() throws Exception {
        server.route("/insider-trades/", request -> switch (request.param("filing_date_lte")) {
            case "2024-03-31" -> Reply.ok("{\"insider_trades\":["
                + trade("2024-03-20", "A") + "," + trade("2024-03-10", "B") + "]}");
            case "2024-03-10" -> Reply.ok("{\"insider_trades\":["
                + trade("2024-03-10", "B") + "," + trade("2024-02-01", "C") + "]}");
            case "2024-02-01" -> Reply.ok("{\"insider_trades\":[" + trade("2024-02-01", "C") + "]}");
            default -> new Reply(400, "{}");
        });

        List<InsiderTrade> trades = client("k").getInsiderTrades("AAPL", "2024-03-31", "2024-01-01", 2);

        assertEquals(3, server.count("/insider-trades/"));
        assertEquals("2024-01-01", server.requests("/insider-trades/").get(0).param("filing_date_gte"));
        assertEquals(3, cache.get(RecordKind.INSIDER_TRADES, "AAPL").size());
        assertEquals(List.of("A", "B"), trades.stream().map(InsiderTrade::insiderName).toList());
    }

    private static String trade(String filingDate, String name) {
        return "{\"ticker\":\"AAPL\",\"name\":\"" + name + "\",\"title\":\"Director\",\"filing_date\":\""
            + filingDate + "\",\"transaction_date\":\"" + filingDate + "\",\"transaction_shares\":-10,"
            + "\"transaction_price_per_share\":100.0,\"transaction_value\":-1000.0,"
            + "\"shares_owned_after_transaction\":500}";
    }

    @Test
    @DisplayName("News without a start date is a single page")
    void newsSinglePage() throws Exception {
        server.json("/news/", "{\"news\":["
            + "{\"ticker\":\"AAPL\",\"title\":\"Apple earnings\",\"source\":\"Motley Fool\","
            + "\"date\":\"2024-05-03T10:00:00Z\",\"url\":\"https://n/1\",\"sentiment\":\"positive\"},"
            + "{\"ticker\":\"AAPL\",\"title\":\"Apple event\",\"source\":\"Reuters\","
            + "\"date\":\"2024-05-07\",\"url\":\"https://n/2\",\"sentiment\":\"neutral\"}]}");

        List<CompanyNews> news = client(null).getCompanyNews("AAPL", "2024-05-31", null, 2);

        assertEquals(1, server.count("/news/"));
        assertNull(server.requests("/news/").get(0).param("start_date"));
        assertEquals(List.of("2024-05-07", "2024-05-03"), news.stream().map(CompanyNews::date).toList());
        assertEquals("positive", news.get(1).sentiment());
    }

    @Test
    @DisplayName("Market cap for today comes from company facts")
    void marketCapToday() throws Exception {
        server.json("/company/facts/", "{\"company_facts\":{\"ticker\":\"AAPL\",\"market_cap\":2.95e12}}");

        assertEquals(2.95e12, client(null).getMarketCap("AAPL", "2024-06-01").orElseThrow());
        assertEquals(0, server.count("/financial-metrics/"));
    }

    @Test
    @DisplayName("Historical market cap comes from uncached metrics")
    void marketCapHistorical() throws Exception {
        server.json("/financial-metrics/", "{\"financial_metrics\":["
            + "{\"report_period\":\"2023-12-30\",\"period\":\"ttm\",\"market_cap\":2.9e12}]}");

        FinancialDatasetsClient fd = client(null);
        assertEquals(2.9e12, fd.getMarketCap("AAPL", "2024-01-15").orElseThrow());
        assertEquals(2.9e12, fd.getMarketCap("AAPL", "2024-01-15").orElseThrow());

        // Each lookup goes to the provider and leaves the metrics cache alone
        assertEquals(2, server.count("/financial-metrics/"));
        assertEquals(0, server.count("/company/facts/"));
        assertTrue(cache.get(RecordKind.FINANCIAL_METRICS, "AAPL").isEmpty());
    }

    @Test
    @DisplayName("Waits for the cache's key lock held by another client")
    void honoursSharedKeyLock() throws Exception {
        server.json("/prices/", "{\"prices\":[{\"time\":\"2024-01-02\",\"open\":1,\"high\":1,\"low\":1,"
            + "\"close\":1,\"volume\":1}]}");
        FinancialDatasetsClient fd = client(null);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // Given another client on the same cache is mid-fetch for AAPL prices
        Lock lock = cache.lockFor(RecordKind.PRICES, "aapl");
        lock.lock();
        Future<List<Price>> pending;
        try {
            pending = executor.submit(() -> fd.getPrices("AAPL", "2024-01-02", "2024-01-02"));
            Thread.sleep(200);

            // Then this client has not started its own request
            assertEquals(0, server.count("/prices/"));
            assertFalse(pending.isDone());
        } finally {
            lock.unlock();
        }

        assertEquals(1, pending.get(5, TimeUnit.SECONDS).size());
        assertEquals(1, server.count("/prices/"));
        executor.shutdownNow();
    }
}
