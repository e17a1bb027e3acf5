package com.hedgedata.data.provider;

import com.hedgedata.core.model.CompanyNews;
import com.hedgedata.core.model.DataProvider;
import com.hedgedata.core.model.FinancialMetrics;
import com.hedgedata.core.model.InsiderTrade;
import com.hedgedata.core.model.LineItem;
import com.hedgedata.core.model.Price;
import com.hedgedata.data.exception.FetchException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Canned client for dispatcher, registry and comparison tests. Either fails
 * every call with a FetchException or returns the configured data; counts calls.
 */
public class StubDataProviderClient implements DataProviderClient {

    private final DataProvider provider;
    private final boolean failing;
    private final AtomicInteger calls = new AtomicInteger();

    private List<Price> prices = List.of();
    private List<FinancialMetrics> metrics = List.of();
    private List<LineItem> lineItems = List.of();
    private List<InsiderTrade> insiderTrades = List.of();
    private List<CompanyNews> news = List.of();
    private Double marketCap;

    private StubDataProviderClient(DataProvider provider, boolean failing) {
        this.provider = provider;
        this.failing = failing;
    }

    public static StubDataProviderClient failing(DataProvider provider) {
        return new StubDataProviderClient(provider, true);
    }

    public static StubDataProviderClient returning(DataProvider provider) {
        return new StubDataProviderClient(provider, false);
    }

    public StubDataProviderClient withPrices(List<Price> prices) {
        this.prices = prices;
        return this;
    }

    public StubDataProviderClient withMetrics(List<FinancialMetrics> metrics) {
        this.metrics = metrics;
        return this;
    }

    public StubDataProviderClient withLineItems(List<LineItem> lineItems) {
        this.lineItems = lineItems;
        return this;
    }

    public StubDataProviderClient withInsiderTrades(List<InsiderTrade> insiderTrades) {
        this.insiderTrades = insiderTrades;
        return this;
    }

    public StubDataProviderClient withNews(List<CompanyNews> news) {
        this.news = news;
        return this;
    }

    public StubDataProviderClient withMarketCap(Double marketCap) {
        this.marketCap = marketCap;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    private void call() throws FetchException {
        calls.incrementAndGet();
        if (failing) {
            throw new FetchException(provider, 500, "stubbed failure");
        }
    }

    @Override
    public DataProvider getProvider() {
        return provider;
    }

    @Override
    public List<Price> getPrices(String ticker, String startDate, String endDate) throws FetchException {
        call();
        return prices;
    }

    @Override
    public List<FinancialMetrics> getFinancialMetrics(String ticker, String endDate, String period, int limit)
            throws FetchException {
        call();
        return metrics;
    }

    @Override
    public List<LineItem> searchLineItems(String ticker, List<String> names, String endDate, String period,
                                          int limit) throws FetchException {
        call();
        return lineItems;
    }

    @Override
    public List<InsiderTrade> getInsiderTrades(String ticker, String endDate, String startDate, int limit)
            throws FetchException {
        call();
        return insiderTrades;
    }

    @Override
    public List<CompanyNews> getCompanyNews(String ticker, String endDate, String startDate, int limit)
            throws FetchException {
        call();
        return news;
    }

    @Override
    public Optional<Double> getMarketCap(String ticker, String endDate) throws FetchException {
        call();
        return Optional.ofNullable(marketCap);
    }
}
