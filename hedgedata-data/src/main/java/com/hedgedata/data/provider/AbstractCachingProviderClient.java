package com.hedgedata.data.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgedata.core.model.CompanyNews;
import com.hedgedata.core.model.FinancialMetrics;
import com.hedgedata.core.model.FinancialRecord;
import com.hedgedata.core.model.InsiderTrade;
import com.hedgedata.core.model.LineItem;
import com.hedgedata.core.model.Price;
import com.hedgedata.core.model.RecordKind;
import com.hedgedata.core.util.DateFormats;
import com.hedgedata.data.HttpClientFactory;
import com.hedgedata.data.cache.PriceCoverage;
import com.hedgedata.data.cache.PriceCoverage.DateRange;
import com.hedgedata.data.cache.RecordCache;
import com.hedgedata.data.cache.RecordFilter;
import com.hedgedata.data.exception.FetchException;
import com.hedgedata.data.exception.NormalizationException;
import com.hedgedata.data.exception.ProviderConfigurationException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.UnaryOperator;

/**
 * Read-through caching shared by all provider clients.
 *
 * Every list operation runs under the cache's (kind, ticker) lock, which any
 * other client on the same cache shares: read the cache, answer from it when
 * it can, otherwise fetch from the provider, merge the normalized batch into
 * the cache and answer from the merged collection. Prices are fetched only for
 * the parts of the requested range the cache cannot answer (see
 * {@link PriceCoverage}); other kinds treat any non-empty cached view as a hit.
 *
 * Subclasses supply the provider calls and own their field mappings.
 */
public abstract class AbstractCachingProviderClient implements DataProviderClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractCachingProviderClient.class);

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final int MAX_ERROR_BODY = 200;

    protected final RecordCache cache;
    protected final OkHttpClient client;
    protected final ObjectMapper mapper;
    protected final HttpUrl baseUrl;
    private final Clock clock;

    protected AbstractCachingProviderClient(RecordCache cache, String baseUrl, Clock clock)
            throws ProviderConfigurationException {
        HttpUrl parsed = baseUrl != null ? HttpUrl.parse(baseUrl) : null;
        if (parsed == null) {
            throw new ProviderConfigurationException("Invalid base URL for " + getProvider().getDisplayName()
                + ": " + baseUrl);
        }
        this.cache = cache;
        this.client = HttpClientFactory.getClient();
        this.mapper = HttpClientFactory.getMapper();
        this.baseUrl = parsed;
        this.clock = clock;
    }

    // ========== Provider calls ==========

    protected abstract List<Price> fetchPrices(String ticker, String startDate, String endDate)
        throws FetchException;

    protected abstract List<FinancialMetrics> fetchFinancialMetrics(String ticker, String endDate, String period,
                                                                    int limit) throws FetchException;

    protected abstract List<LineItem> fetchLineItems(String ticker, List<String> lineItems, String endDate,
                                                     String period, int limit) throws FetchException;

    protected abstract List<InsiderTrade> fetchInsiderTrades(String ticker, String startDate, String endDate,
                                                             int limit) throws FetchException;

    protected abstract List<CompanyNews> fetchCompanyNews(String ticker, String startDate, String endDate,
                                                          int limit) throws FetchException;

    /**
     * Add the provider's credential to an outgoing request.
     */
    protected abstract void authenticate(Request.Builder request);

    // ========== Cached operations ==========

    @Override
    public List<Price> getPrices(String ticker, String startDate, String endDate) throws FetchException {
        String symbol = requireTicker(ticker);
        String start = requireDate(startDate, "startDate");
        String end = requireDate(endDate, "endDate");
        if (start.compareTo(end) > 0) {
            throw new IllegalArgumentException("startDate " + start + " is after endDate " + end);
        }

        Lock lock = cache.lockFor(RecordKind.PRICES, symbol);
        lock.lock();
        try {
            List<Price> cached = cache.get(RecordKind.PRICES, symbol);
            List<DateRange> missing = PriceCoverage.missingRanges(cached, start, end, LocalDate.now(clock));
            if (missing.isEmpty()) {
                log.debug("{} prices for {} {}..{} served from cache", getProvider().getDisplayName(),
                    symbol, start, end);
            }
            for (DateRange range : missing) {
                List<Price> fetched = fetchPrices(symbol, range.start(), range.end());
                log.debug("Fetched {} prices for {} {}..{} from {}", fetched.size(), symbol,
                    range.start(), range.end(), getProvider().getDisplayName());
                cache.set(RecordKind.PRICES, symbol, fetched);
            }
            return RecordFilter.inRange(RecordKind.PRICES, cache.get(RecordKind.PRICES, symbol), start, end);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<FinancialMetrics> getFinancialMetrics(String ticker, String endDate, String period, int limit)
            throws FetchException {
        String symbol = requireTicker(ticker);
        String end = requireDate(endDate, "endDate");
        return readThrough(RecordKind.FINANCIAL_METRICS, symbol,
            cached -> RecordFilter.metrics(cached, end, period, limit),
            () -> fetchFinancialMetrics(symbol, end, period, limit));
    }

    @Override
    public List<LineItem> searchLineItems(String ticker, List<String> lineItems, String endDate, String period,
                                          int limit) throws FetchException {
        String symbol = requireTicker(ticker);
        String end = requireDate(endDate, "endDate");
        if (lineItems == null || lineItems.isEmpty()) {
            return List.of();
        }
        return readThrough(RecordKind.LINE_ITEMS, symbol,
            cached -> RecordFilter.lineItems(cached, lineItems, end, period, limit),
            () -> fetchLineItems(symbol, lineItems, end, period, limit));
    }

    @Override
    public List<InsiderTrade> getInsiderTrades(String ticker, String endDate, String startDate, int limit)
            throws FetchException {
        String symbol = requireTicker(ticker);
        String end = requireDate(endDate, "endDate");
        String start = startDate != null ? requireDate(startDate, "startDate") : null;
        return readThrough(RecordKind.INSIDER_TRADES, symbol,
            cached -> RecordFilter.inRange(RecordKind.INSIDER_TRADES, cached, start, end, limit),
            () -> fetchInsiderTrades(symbol, start, end, limit));
    }

    @Override
    public List<CompanyNews> getCompanyNews(String ticker, String endDate, String startDate, int limit)
            throws FetchException {
        String symbol = requireTicker(ticker);
        String end = requireDate(endDate, "endDate");
        String start = startDate != null ? requireDate(startDate, "startDate") : null;
        return readThrough(RecordKind.COMPANY_NEWS, symbol,
            cached -> RecordFilter.inRange(RecordKind.COMPANY_NEWS, cached, start, end, limit),
            () -> fetchCompanyNews(symbol, start, end, limit));
    }

    @FunctionalInterface
    protected interface Fetcher<T> {
        List<T> fetch() throws FetchException;
    }

    private <T extends FinancialRecord> List<T> readThrough(RecordKind<T> kind, String ticker,
                                                            UnaryOperator<List<T>> view,
                                                            Fetcher<T> fetcher) throws FetchException {
        Lock lock = cache.lockFor(kind, ticker);
        lock.lock();
        try {
            List<T> hit = view.apply(cache.get(kind, ticker));
            if (!hit.isEmpty()) {
                log.debug("{} {} for {} served from cache", getProvider().getDisplayName(), kind, ticker);
                return hit;
            }
            List<T> fetched = fetcher.fetch();
            log.debug("Fetched {} {} for {} from {}", fetched.size(), kind, ticker, getProvider().getDisplayName());
            cache.set(kind, ticker, fetched);
            return view.apply(cache.get(kind, ticker));
        } finally {
            lock.unlock();
        }
    }

    // ========== HTTP ==========

    protected HttpUrl.Builder endpoint(String path) {
        return baseUrl.newBuilder().addPathSegments(path);
    }

    protected JsonNode getJson(HttpUrl url) throws FetchException {
        Request.Builder request = new Request.Builder().url(url).get();
        authenticate(request);
        return execute(request.build());
    }

    protected JsonNode postJson(HttpUrl url, Object body) throws FetchException {
        String payload;
        try {
            payload = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new FetchException(getProvider(), "Could not encode request for " + url.encodedPath(), e);
        }
        Request.Builder request = new Request.Builder().url(url).post(RequestBody.create(payload, JSON));
        authenticate(request);
        return execute(request.build());
    }

    private JsonNode execute(Request request) throws FetchException {
        String path = request.url().encodedPath();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new FetchException(getProvider(), response.code(),
                    "HTTP " + response.code() + " from " + path + ": " + abbreviate(text));
            }
            try {
                return mapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw new NormalizationException(getProvider(),
                    "Unparsable response from " + path + ": " + e.getOriginalMessage());
            }
        } catch (IOException e) {
            throw new FetchException(getProvider(), "Request to " + path + " failed: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }

    // ========== Payload helpers ==========

    /**
     * Child array of a response, or a NormalizationException when the payload
     * does not have the expected shape.
     */
    protected JsonNode requireArray(JsonNode root, String field, String what) throws NormalizationException {
        JsonNode node = field == null ? root : root.get(field);
        if (node == null || !node.isArray()) {
            throw new NormalizationException(getProvider(), "Expected array '" + (field == null ? "<root>" : field)
                + "' in " + what + " response");
        }
        return node;
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String s = value.asText();
        return s.isBlank() ? null : s;
    }

    /**
     * Numeric field, accepting numbers encoded as strings. Null when absent or not a number.
     */
    protected static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    protected LocalDate today() {
        return LocalDate.now(clock);
    }

    static String requireTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Ticker is required");
        }
        return ticker.trim().toUpperCase();
    }

    static String requireDate(String date, String name) {
        if (date == null || date.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return DateFormats.format(DateFormats.parse(date));
    }
}
