package com.hedgedata.data;

import com.hedgedata.core.model.CompanyNews;
import com.hedgedata.core.model.DataProvider;
import com.hedgedata.core.model.FinancialMetrics;
import com.hedgedata.core.model.InsiderTrade;
import com.hedgedata.core.model.LineItem;
import com.hedgedata.core.model.Price;
import com.hedgedata.core.model.PriceSeries;
import com.hedgedata.data.exception.DataProviderException;
import com.hedgedata.data.exception.ProviderConfigurationException;
import com.hedgedata.data.provider.DataProviderClient;
import com.hedgedata.data.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for financial data. Each call goes to the default provider; if
 * that fails it is retried once against the fallback provider, and if that
 * fails too the call returns an empty list (or an empty Optional for market
 * cap). Data calls never throw.
 */
public class FinancialDataService {

    private static final Logger log = LoggerFactory.getLogger(FinancialDataService.class);

    public static final String DEFAULT_PERIOD = "ttm";
    public static final int DEFAULT_METRICS_LIMIT = 10;
    public static final int DEFAULT_RECORD_LIMIT = 1000;

    private final ProviderRegistry registry;

    /**
     * @throws ProviderConfigurationException if no default provider can be resolved
     */
    public FinancialDataService(ProviderRegistry registry) throws ProviderConfigurationException {
        this.registry = registry;
        log.info("Using data provider {}", registry.getDefaultProvider().getDisplayName());
    }

    /**
     * Service configured from system properties, environment and the config file.
     */
    public static FinancialDataService create() throws ProviderConfigurationException {
        return new FinancialDataService(ProviderRegistry.create(ProviderSettings.load()));
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    // ========== Operations ==========

    public List<Price> getPrices(String ticker, String startDate, String endDate) {
        return dispatch("prices", ticker, client -> client.getPrices(ticker, startDate, endDate), List.of());
    }

    public PriceSeries getPriceSeries(String ticker, String startDate, String endDate) {
        return PriceSeries.of(getPrices(ticker, startDate, endDate));
    }

    public List<FinancialMetrics> getFinancialMetrics(String ticker, String endDate) {
        return getFinancialMetrics(ticker, endDate, DEFAULT_PERIOD, DEFAULT_METRICS_LIMIT);
    }

    public List<FinancialMetrics> getFinancialMetrics(String ticker, String endDate, String period, int limit) {
        return dispatch("financial metrics", ticker,
            client -> client.getFinancialMetrics(ticker, endDate, period, limit), List.of());
    }

    public List<LineItem> searchLineItems(String ticker, List<String> lineItems, String endDate) {
        return searchLineItems(ticker, lineItems, endDate, DEFAULT_PERIOD, DEFAULT_METRICS_LIMIT);
    }

    public List<LineItem> searchLineItems(String ticker, List<String> lineItems, String endDate, String period,
                                          int limit) {
        return dispatch("line items", ticker,
            client -> client.searchLineItems(ticker, lineItems, endDate, period, limit), List.of());
    }

    public List<InsiderTrade> getInsiderTrades(String ticker, String endDate) {
        return getInsiderTrades(ticker, endDate, null, DEFAULT_RECORD_LIMIT);
    }

    public List<InsiderTrade> getInsiderTrades(String ticker, String endDate, String startDate, int limit) {
        return dispatch("insider trades", ticker,
            client -> client.getInsiderTrades(ticker, endDate, startDate, limit), List.of());
    }

    public List<CompanyNews> getCompanyNews(String ticker, String endDate) {
        return getCompanyNews(ticker, endDate, null, DEFAULT_RECORD_LIMIT);
    }

    public List<CompanyNews> getCompanyNews(String ticker, String endDate, String startDate, int limit) {
        return dispatch("company news", ticker,
            client -> client.getCompanyNews(ticker, endDate, startDate, limit), List.of());
    }

    public Optional<Double> getMarketCap(String ticker, String endDate) {
        return dispatch("market cap", ticker, client -> client.getMarketCap(ticker, endDate), Optional.empty());
    }

    // ========== Failover ==========

    @FunctionalInterface
    private interface ClientCall<T> {
        T apply(DataProviderClient client) throws DataProviderException;
    }

    private <T> T dispatch(String operation, String ticker, ClientCall<T> call, T empty) {
        FetchResult<DataProvider> resolved = FetchResult.of(registry::getDefaultProvider);
        if (resolved instanceof FetchResult.Failure<DataProvider> failure) {
            log.error("No provider for {} of {}: {}", operation, ticker, failure.error().getMessage());
            return empty;
        }
        DataProvider primary = ((FetchResult.Success<DataProvider>) resolved).value();

        FetchResult<T> first = attempt(primary, call);
        if (first instanceof FetchResult.Success<T> success) {
            return orEmpty(success.value(), empty);
        }
        Exception primaryError = ((FetchResult.Failure<T>) first).error();

        Optional<DataProvider> fallback = registry.getFallbackProvider(primary);
        if (fallback.isEmpty()) {
            log.error("Failed to get {} for {} from {}: {}", operation, ticker, primary.getDisplayName(),
                primaryError.getMessage());
            return empty;
        }
        log.warn("Failed to get {} for {} from {}: {}. Trying {}", operation, ticker, primary.getDisplayName(),
            primaryError.getMessage(), fallback.get().getDisplayName());

        FetchResult<T> second = attempt(fallback.get(), call);
        if (second instanceof FetchResult.Success<T> success) {
            return orEmpty(success.value(), empty);
        }
        Exception fallbackError = ((FetchResult.Failure<T>) second).error();
        log.error("Failed to get {} for {}: {}. Fallback {} also failed: {}", operation, ticker,
            primaryError.getMessage(), fallback.get().getDisplayName(), fallbackError.getMessage());
        return empty;
    }

    private <T> FetchResult<T> attempt(DataProvider provider, ClientCall<T> call) {
        return FetchResult.of(() -> call.apply(registry.getClient(provider)));
    }

    private static <T> T orEmpty(T value, T empty) {
        return value != null ? value : empty;
    }
}
